package com.steakz.backend.modules.access.domain;

public enum ResourceCategory {
    ORDERS,
    INVENTORY,
    RESERVATIONS,
    FEEDBACK,
    STAFF,
    BRANCH,
    ACCOUNT
}
