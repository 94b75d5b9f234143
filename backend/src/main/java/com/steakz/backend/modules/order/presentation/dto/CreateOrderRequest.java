package com.steakz.backend.modules.order.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

public record CreateOrderRequest(
        String branchId,
        @NotEmpty(message = "items must not be empty") List<@Valid OrderLineRequest> items
) {
}
