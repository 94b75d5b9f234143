package com.steakz.backend.modules.order.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

import com.steakz.backend.modules.order.domain.CustomerOrder;
import com.steakz.backend.modules.order.domain.OrderItem;

public record OrderResponse(
        Long id,
        Long branchId,
        Long userId,
        String status,
        BigDecimal total,
        List<Line> items,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
    public static OrderResponse from(CustomerOrder order) {
        return new OrderResponse(
                order.getId(),
                order.getBranchId(),
                order.getUserId(),
                order.getStatus().name(),
                order.getTotal(),
                order.getItems().stream().map(Line::from).toList(),
                order.getCreatedAt(),
                order.getUpdatedAt()
        );
    }

    public record Line(Long menuItemId, String name, int quantity, BigDecimal price) {
        static Line from(OrderItem item) {
            return new Line(item.getMenuItem().getId(), item.getMenuItem().getName(), item.getQuantity(), item.getPrice());
        }
    }
}
