package com.steakz.backend.modules.inventory.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record CreateInventoryRequest(
        @NotNull(message = "menuItemId is required") Long menuItemId,
        @PositiveOrZero Integer quantity,
        @PositiveOrZero Integer minQuantity,
        String branchId
) {
}
