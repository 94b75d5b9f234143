package com.steakz.backend.modules.access.application;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.domain.AccessDecision;
import com.steakz.backend.modules.access.domain.AccessOutcome;

public class AccessDeniedProblem extends ProblemException {

    private final AccessOutcome outcome;

    public AccessDeniedProblem(AccessOutcome outcome, String detail) {
        super(outcome.status(), outcome.code(), detail);
        this.outcome = outcome;
    }

    public static AccessDeniedProblem from(AccessDecision decision) {
        return new AccessDeniedProblem(decision.outcome(), decision.reason());
    }

    public AccessOutcome getOutcome() {
        return outcome;
    }
}
