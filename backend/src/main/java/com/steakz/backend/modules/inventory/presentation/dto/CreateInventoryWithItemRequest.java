package com.steakz.backend.modules.inventory.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record CreateInventoryWithItemRequest(
        @NotBlank(message = "name is required") @Size(max = 120) String name,
        @Size(max = 60) String category,
        @Size(max = 500) String description,
        @PositiveOrZero BigDecimal price,
        @PositiveOrZero Integer quantity,
        @PositiveOrZero Integer minQuantity,
        String branchId
) {
}
