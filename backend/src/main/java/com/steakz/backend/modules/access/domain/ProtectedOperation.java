package com.steakz.backend.modules.access.domain;

import static com.steakz.backend.modules.access.domain.Role.BRANCH_MANAGER;
import static com.steakz.backend.modules.access.domain.Role.CUSTOMER;
import static com.steakz.backend.modules.access.domain.Role.FRONT_STAFF;
import static com.steakz.backend.modules.access.domain.Role.KITCHEN_STAFF;
import static com.steakz.backend.modules.access.domain.Role.OWNER_ADMIN;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Static capability matrix: every protected operation with its resource category and the roles
 * that may reach it. Kitchen staff is listed with the staff tier here and narrowed by
 * {@code CategoryPolicy}; the staff roster is closed to front staff.
 */
public enum ProtectedOperation {

    ORDER_CREATE(ResourceCategory.ORDERS, EnumSet.allOf(Role.class)),
    ORDER_LIST(ResourceCategory.ORDERS, EnumSet.allOf(Role.class)),
    ORDER_STATUS_UPDATE(ResourceCategory.ORDERS, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER, KITCHEN_STAFF)),

    INVENTORY_LIST(ResourceCategory.INVENTORY, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER, FRONT_STAFF, KITCHEN_STAFF)),
    INVENTORY_CREATE(ResourceCategory.INVENTORY, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER)),
    INVENTORY_UPDATE(ResourceCategory.INVENTORY, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER)),

    RESERVATION_CREATE(ResourceCategory.RESERVATIONS, EnumSet.allOf(Role.class)),
    RESERVATION_LIST(ResourceCategory.RESERVATIONS, EnumSet.allOf(Role.class)),
    RESERVATION_STATUS_UPDATE(ResourceCategory.RESERVATIONS, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER, FRONT_STAFF, KITCHEN_STAFF)),

    FEEDBACK_CREATE(ResourceCategory.FEEDBACK, EnumSet.allOf(Role.class)),
    FEEDBACK_LIST(ResourceCategory.FEEDBACK, EnumSet.allOf(Role.class)),
    FEEDBACK_REPLY(ResourceCategory.FEEDBACK, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER, FRONT_STAFF, KITCHEN_STAFF)),
    FEEDBACK_APPROVE(ResourceCategory.FEEDBACK, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER, FRONT_STAFF, KITCHEN_STAFF)),
    FEEDBACK_DELETE(ResourceCategory.FEEDBACK, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER, FRONT_STAFF, KITCHEN_STAFF)),

    STAFF_LIST(ResourceCategory.STAFF, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER, KITCHEN_STAFF)),
    STAFF_CREATE(ResourceCategory.STAFF, EnumSet.of(OWNER_ADMIN)),
    STAFF_RESET_PASSWORD(ResourceCategory.STAFF, EnumSet.of(OWNER_ADMIN)),

    BRANCH_LIST(ResourceCategory.BRANCH, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER, FRONT_STAFF, KITCHEN_STAFF)),
    BRANCH_ANALYTICS(ResourceCategory.BRANCH, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER)),
    BRANCH_SETTINGS_READ(ResourceCategory.BRANCH, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER)),
    BRANCH_SETTINGS_UPDATE(ResourceCategory.BRANCH, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER)),
    BRANCH_SEED_SAMPLE(ResourceCategory.BRANCH, EnumSet.of(OWNER_ADMIN)),

    ACTIVE_BRANCH_READ(ResourceCategory.ACCOUNT, EnumSet.of(OWNER_ADMIN, BRANCH_MANAGER)),
    ACTIVE_BRANCH_UPDATE(ResourceCategory.ACCOUNT, EnumSet.of(OWNER_ADMIN));

    private final ResourceCategory category;
    private final Set<Role> allowedRoles;

    ProtectedOperation(ResourceCategory category, EnumSet<Role> allowedRoles) {
        this.category = category;
        this.allowedRoles = Collections.unmodifiableSet(allowedRoles);
    }

    public ResourceCategory category() {
        return category;
    }

    public Set<Role> allowedRoles() {
        return allowedRoles;
    }
}
