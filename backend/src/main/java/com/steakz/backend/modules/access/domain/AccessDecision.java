package com.steakz.backend.modules.access.domain;

import java.util.Objects;

/**
 * Allow (with the branch the operation is scoped to) or a denial with its reason.
 */
public record AccessDecision(AccessOutcome outcome, Long branchId, String reason) {

    public static final String REASON_BRANCH_MISMATCH = "branch mismatch";
    public static final String REASON_BRANCH_REQUIRED = "branch context required";
    public static final String REASON_CATEGORY = "role category restriction";

    public AccessDecision {
        Objects.requireNonNull(outcome, "outcome");
    }

    public static AccessDecision allow(Long branchId) {
        return new AccessDecision(AccessOutcome.ALLOW, branchId, null);
    }

    public static AccessDecision deny(AccessOutcome outcome, String reason) {
        if (outcome == AccessOutcome.ALLOW) {
            throw new IllegalArgumentException("deny requires a denial outcome");
        }
        return new AccessDecision(outcome, null, reason);
    }

    public boolean isAllowed() {
        return outcome == AccessOutcome.ALLOW;
    }
}
