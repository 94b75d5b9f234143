package com.steakz.backend.modules.branch.presentation.dto;

import java.math.BigDecimal;

public record BranchAnalyticsResponse(
        Long branchId,
        Sales sales,
        Reservations reservations,
        FeedbackSummary feedback,
        Inventory inventory
) {
    public record Sales(long count, BigDecimal total) {
    }

    public record Reservations(long count) {
    }

    public record FeedbackSummary(long count, double averageRating) {
    }

    public record Inventory(long lowStockCount) {
    }
}
