package com.steakz.backend.modules.access.application;

import com.steakz.backend.modules.access.domain.AccessDecision;
import com.steakz.backend.modules.access.domain.AccessOutcome;
import com.steakz.backend.modules.access.domain.Actor;

import org.springframework.stereotype.Component;

@Component
public class BranchAccessEnforcer {

    /**
     * Compares the branch that owns a resource with the actor's home branch.
     * The top role is never branch-restricted.
     */
    public AccessDecision checkBranchAccess(Actor actor, Long effectiveBranchId, Long resourceBranchId) {
        if (actor.isTopRole()) {
            return AccessDecision.allow(effectiveBranchId);
        }
        if (actor.homeBranchId() == null || resourceBranchId == null) {
            return AccessDecision.deny(AccessOutcome.BRANCH_REQUIRED, AccessDecision.REASON_BRANCH_REQUIRED);
        }
        if (!actor.homeBranchId().equals(resourceBranchId)) {
            return AccessDecision.deny(AccessOutcome.FORBIDDEN_BRANCH, AccessDecision.REASON_BRANCH_MISMATCH);
        }
        return AccessDecision.allow(resourceBranchId);
    }
}
