package com.steakz.backend.modules.order.presentation.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

public record OrderLineRequest(
        @NotNull(message = "menuItemId is required") Long menuItemId,
        @NotNull @Min(1) @Max(100) Integer quantity
) {
}
