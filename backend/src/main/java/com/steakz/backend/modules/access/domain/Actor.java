package com.steakz.backend.modules.access.domain;

/**
 * The authenticated identity behind a request.
 *
 * @param id             account id
 * @param role           the account role; null when the session could not be mapped to a role
 * @param homeBranchId   branch the account is permanently assigned to
 * @param activeBranchId sticky branch override, only honoured for {@link Role#OWNER_ADMIN}
 */
public record Actor(Long id, Role role, Long homeBranchId, Long activeBranchId) {

    public boolean isTopRole() {
        return role != null && role.isTopRole();
    }

    public boolean hasRole(Role candidate) {
        return role == candidate;
    }
}
