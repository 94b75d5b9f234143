package com.steakz.backend.modules.access.domain;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of roles. Exactly one role per account.
 */
public enum Role {
    OWNER_ADMIN,
    BRANCH_MANAGER,
    KITCHEN_STAFF,
    FRONT_STAFF,
    CUSTOMER;

    // codes written by the first release of the schema
    private static final Map<String, Role> LEGACY_CODES = Map.of(
            "ADMIN", OWNER_ADMIN,
            "MANAGER", BRANCH_MANAGER,
            "CHEF", KITCHEN_STAFF,
            "STAFF", FRONT_STAFF
    );

    /**
     * Parses a role code case-insensitively. Hyphens and underscores are interchangeable.
     * Returns empty for null, blank or unknown codes.
     */
    public static Optional<Role> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        for (Role role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.ofNullable(LEGACY_CODES.get(normalized));
    }

    public boolean isTopRole() {
        return this == OWNER_ADMIN;
    }

    public boolean isStaff() {
        return this == BRANCH_MANAGER || this == KITCHEN_STAFF || this == FRONT_STAFF;
    }
}
