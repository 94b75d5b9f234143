package com.steakz.backend.modules.access.application;

import java.util.Set;

import com.steakz.backend.modules.access.domain.Role;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class RolePolicy {

    private static final Logger log = LoggerFactory.getLogger(RolePolicy.class);

    public boolean isRoleAllowed(Role role, Set<Role> requiredRoles) {
        if (requiredRoles == null || requiredRoles.isEmpty()) {
            log.warn("Empty required role set, denying role {}", role);
            return false;
        }
        return role != null && requiredRoles.contains(role);
    }
}
