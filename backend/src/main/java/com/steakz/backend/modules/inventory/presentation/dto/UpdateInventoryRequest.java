package com.steakz.backend.modules.inventory.presentation.dto;

import jakarta.validation.constraints.PositiveOrZero;

public record UpdateInventoryRequest(
        @PositiveOrZero(message = "quantity must not be negative") Integer quantity,
        @PositiveOrZero(message = "minQuantity must not be negative") Integer minQuantity
) {
}
