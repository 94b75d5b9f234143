package com.steakz.backend.modules.access.application;

import java.util.Optional;

import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.BranchIdParser;
import com.steakz.backend.modules.access.domain.ParsedBranchId;

import org.springframework.stereotype.Component;

/**
 * Decides which branch an operation is scoped to.
 * Non-admin actors are pinned to their home branch; the top role may target any branch,
 * falling back to its active branch and then its home branch.
 */
@Component
public class BranchResolver {

    public Optional<Long> resolveEffectiveBranch(Actor actor, String requestedBranchId) {
        return resolveEffectiveBranch(actor, BranchIdParser.parse(requestedBranchId));
    }

    public Optional<Long> resolveEffectiveBranch(Actor actor, Long requestedBranchId) {
        return resolveEffectiveBranch(actor, BranchIdParser.of(requestedBranchId));
    }

    public Optional<Long> resolveEffectiveBranch(Actor actor, ParsedBranchId requested) {
        if (actor == null) {
            return Optional.empty();
        }
        if (!actor.isTopRole()) {
            return positive(actor.homeBranchId());
        }
        if (requested != null && requested.isDefined()) {
            return requested.asOptional();
        }
        return positive(actor.activeBranchId()).or(() -> positive(actor.homeBranchId()));
    }

    private static Optional<Long> positive(Long branchId) {
        return BranchIdParser.of(branchId).asOptional();
    }
}
