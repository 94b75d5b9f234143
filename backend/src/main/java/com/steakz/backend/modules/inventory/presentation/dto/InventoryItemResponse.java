package com.steakz.backend.modules.inventory.presentation.dto;

import java.time.OffsetDateTime;

import com.steakz.backend.modules.inventory.domain.InventoryItem;

public record InventoryItemResponse(
        Long id,
        Long branchId,
        Long menuItemId,
        String menuItemName,
        String category,
        int quantity,
        int minQuantity,
        boolean lowStock,
        OffsetDateTime updatedAt
) {
    public static InventoryItemResponse from(InventoryItem item) {
        return new InventoryItemResponse(
                item.getId(),
                item.getBranchId(),
                item.getMenuItem().getId(),
                item.getMenuItem().getName(),
                item.getMenuItem().getCategory(),
                item.getQuantity(),
                item.getMinQuantity(),
                item.isLowStock(),
                item.getUpdatedAt()
        );
    }
}
