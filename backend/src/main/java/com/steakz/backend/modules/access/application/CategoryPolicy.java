package com.steakz.backend.modules.access.application;

import com.steakz.backend.modules.access.domain.ResourceCategory;
import com.steakz.backend.modules.access.domain.Role;

import org.springframework.stereotype.Component;

@Component
public class CategoryPolicy {

    // kitchen staff only works the order queue
    public boolean isResourceCategoryAllowed(Role role, ResourceCategory category) {
        if (role == Role.KITCHEN_STAFF) {
            return category == ResourceCategory.ORDERS;
        }
        return true;
    }
}
