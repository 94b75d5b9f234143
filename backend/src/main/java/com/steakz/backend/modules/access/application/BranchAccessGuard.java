package com.steakz.backend.modules.access.application;

import com.steakz.backend.modules.access.domain.AccessDecision;
import com.steakz.backend.modules.access.domain.AccessOutcome;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.BranchIdParser;
import com.steakz.backend.modules.access.domain.ParsedBranchId;
import com.steakz.backend.modules.access.domain.ProtectedOperation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs the ordered access checks for a protected operation and stops at the first failure:
 * identity, role, category, effective branch, resource branch.
 */
@Component
public class BranchAccessGuard {

    private static final Logger log = LoggerFactory.getLogger(BranchAccessGuard.class);

    private final RolePolicy rolePolicy;
    private final CategoryPolicy categoryPolicy;
    private final BranchResolver branchResolver;
    private final BranchAccessEnforcer branchAccessEnforcer;

    public BranchAccessGuard(
            RolePolicy rolePolicy,
            CategoryPolicy categoryPolicy,
            BranchResolver branchResolver,
            BranchAccessEnforcer branchAccessEnforcer
    ) {
        this.rolePolicy = rolePolicy;
        this.categoryPolicy = categoryPolicy;
        this.branchResolver = branchResolver;
        this.branchAccessEnforcer = branchAccessEnforcer;
    }

    /**
     * Role and category checks only, for operations that are not scoped to a branch.
     */
    public void authorizeOperation(ProtectedOperation operation, Actor actor) {
        AccessDecision decision = precheck(operation, actor);
        if (decision != null) {
            throw denied(operation, actor, decision);
        }
    }

    /**
     * Authorizes a branch-scoped list or create and returns the branch the operation must use.
     */
    public Long authorizeBranchScope(ProtectedOperation operation, Actor actor, String requestedBranchId) {
        AccessDecision decision = evaluateBranchScope(operation, actor, requestedBranchId);
        if (!decision.isAllowed()) {
            throw denied(operation, actor, decision);
        }
        return decision.branchId();
    }

    public Long authorizeBranchScope(ProtectedOperation operation, Actor actor, Long requestedBranchId) {
        return authorizeBranchScope(operation, actor, requestedBranchId == null ? null : requestedBranchId.toString());
    }

    /**
     * Authorizes an operation on an existing resource. The lookup runs only when the actor has
     * passed the identity, role and category checks.
     */
    public Long authorizeResource(ProtectedOperation operation, Actor actor, ResourceBranchLookup lookup) {
        AccessDecision decision = evaluateResource(operation, actor, lookup);
        if (!decision.isAllowed()) {
            throw denied(operation, actor, decision);
        }
        return decision.branchId();
    }

    /**
     * Authorizes an operation addressed to a branch by path, such as {@code /branches/{id}/analytics}.
     * The path names the resource branch, so a non-admin asking for another branch is refused
     * instead of being silently redirected to its home branch.
     */
    public Long authorizeBranchPath(ProtectedOperation operation, Actor actor, String pathBranchId) {
        AccessDecision decision = evaluateBranchPath(operation, actor, pathBranchId);
        if (!decision.isAllowed()) {
            throw denied(operation, actor, decision);
        }
        return decision.branchId();
    }

    public AccessDecision evaluateBranchPath(ProtectedOperation operation, Actor actor, String pathBranchId) {
        AccessDecision pre = precheck(operation, actor);
        if (pre != null) {
            return pre;
        }
        ParsedBranchId parsed = BranchIdParser.parse(pathBranchId);
        if (!parsed.isDefined()) {
            return AccessDecision.deny(AccessOutcome.BRANCH_REQUIRED, "invalid branch id");
        }
        return evaluateResource(operation, actor, parsed::value);
    }

    public AccessDecision evaluateBranchScope(ProtectedOperation operation, Actor actor, String requestedBranchId) {
        AccessDecision pre = precheck(operation, actor);
        if (pre != null) {
            return pre;
        }
        Long effective = branchResolver.resolveEffectiveBranch(actor, requestedBranchId).orElse(null);
        if (effective == null) {
            return AccessDecision.deny(AccessOutcome.BRANCH_REQUIRED, AccessDecision.REASON_BRANCH_REQUIRED);
        }
        return branchAccessEnforcer.checkBranchAccess(actor, effective, effective);
    }

    public AccessDecision evaluateResource(ProtectedOperation operation, Actor actor, ResourceBranchLookup lookup) {
        AccessDecision pre = precheck(operation, actor);
        if (pre != null) {
            return pre;
        }
        Long effective = branchResolver.resolveEffectiveBranch(actor, (Long) null).orElse(null);
        if (effective == null) {
            return AccessDecision.deny(AccessOutcome.BRANCH_REQUIRED, AccessDecision.REASON_BRANCH_REQUIRED);
        }
        Long resourceBranchId = lookup.loadBranchId();
        AccessDecision decision = branchAccessEnforcer.checkBranchAccess(actor, effective, resourceBranchId);
        if (decision.isAllowed() && actor.isTopRole()) {
            return AccessDecision.allow(resourceBranchId);
        }
        return decision;
    }

    private AccessDecision precheck(ProtectedOperation operation, Actor actor) {
        if (actor == null || actor.role() == null) {
            return AccessDecision.deny(AccessOutcome.UNAUTHENTICATED, "authentication required");
        }
        if (!rolePolicy.isRoleAllowed(actor.role(), operation.allowedRoles())) {
            return AccessDecision.deny(AccessOutcome.FORBIDDEN_ROLE, "role not permitted for " + operation.name());
        }
        if (!categoryPolicy.isResourceCategoryAllowed(actor.role(), operation.category())) {
            return AccessDecision.deny(AccessOutcome.FORBIDDEN_CATEGORY, AccessDecision.REASON_CATEGORY);
        }
        return null;
    }

    private AccessDeniedProblem denied(ProtectedOperation operation, Actor actor, AccessDecision decision) {
        log.debug("Access denied: operation={}, actor={}, outcome={}, reason={}",
                operation, actor == null ? null : actor.id(), decision.outcome(), decision.reason());
        return AccessDeniedProblem.from(decision);
    }
}
