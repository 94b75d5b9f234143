package com.steakz.backend.modules.order.domain;

public enum OrderStatus {
    PENDING,
    PREPARING,
    READY,
    SERVED,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
