package com.steakz.backend.support;

import com.steakz.backend.modules.access.application.BranchAccessEnforcer;
import com.steakz.backend.modules.access.application.BranchAccessGuard;
import com.steakz.backend.modules.access.application.BranchResolver;
import com.steakz.backend.modules.access.application.CategoryPolicy;
import com.steakz.backend.modules.access.application.RolePolicy;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.Role;

/**
 * Real access guard and a cast of actors for service tests that mock only persistence.
 */
public final class AccessFixtures {

    public static final Long BRANCH_1 = 1L;
    public static final Long BRANCH_2 = 2L;

    public static final Actor ADMIN = new Actor(100L, Role.OWNER_ADMIN, BRANCH_1, null);
    public static final Actor MANAGER_B1 = new Actor(101L, Role.BRANCH_MANAGER, BRANCH_1, null);
    public static final Actor FRONT_B1 = new Actor(102L, Role.FRONT_STAFF, BRANCH_1, null);
    public static final Actor KITCHEN_B1 = new Actor(103L, Role.KITCHEN_STAFF, BRANCH_1, null);
    public static final Actor CUSTOMER_B1 = new Actor(104L, Role.CUSTOMER, BRANCH_1, null);

    private AccessFixtures() {
    }

    public static BranchAccessGuard guard() {
        return new BranchAccessGuard(new RolePolicy(), new CategoryPolicy(), new BranchResolver(), new BranchAccessEnforcer());
    }
}
