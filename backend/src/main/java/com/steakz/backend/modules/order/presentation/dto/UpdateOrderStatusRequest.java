package com.steakz.backend.modules.order.presentation.dto;

import com.steakz.backend.modules.order.domain.OrderStatus;

import jakarta.validation.constraints.NotNull;

public record UpdateOrderStatusRequest(@NotNull(message = "status is required") OrderStatus status) {
}
