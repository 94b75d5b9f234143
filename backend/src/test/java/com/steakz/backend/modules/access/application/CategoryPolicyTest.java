package com.steakz.backend.modules.access.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.steakz.backend.modules.access.domain.ResourceCategory;
import com.steakz.backend.modules.access.domain.Role;

import org.junit.jupiter.api.Test;

class CategoryPolicyTest {

    private final CategoryPolicy categoryPolicy = new CategoryPolicy();

    @Test
    void kitchenStaffOnlyReachesOrders() {
        for (ResourceCategory category : ResourceCategory.values()) {
            assertThat(categoryPolicy.isResourceCategoryAllowed(Role.KITCHEN_STAFF, category))
                    .as(category.name())
                    .isEqualTo(category == ResourceCategory.ORDERS);
        }
    }

    @Test
    void otherRolesAreNotNarrowed() {
        for (Role role : Role.values()) {
            if (role == Role.KITCHEN_STAFF) {
                continue;
            }
            for (ResourceCategory category : ResourceCategory.values()) {
                assertThat(categoryPolicy.isResourceCategoryAllowed(role, category)).isTrue();
            }
        }
    }
}
