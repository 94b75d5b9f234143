package com.steakz.backend.modules.access.domain;

import org.springframework.http.HttpStatus;

/**
 * Result taxonomy of an access check. Each denial carries the status and the stable problem code
 * the web layer reports.
 */
public enum AccessOutcome {
    ALLOW(HttpStatus.OK, null),
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED, "auth.unauthenticated"),
    FORBIDDEN_ROLE(HttpStatus.FORBIDDEN, "access.forbidden_role"),
    FORBIDDEN_CATEGORY(HttpStatus.FORBIDDEN, "access.forbidden_category"),
    FORBIDDEN_BRANCH(HttpStatus.FORBIDDEN, "access.forbidden_branch"),
    BRANCH_REQUIRED(HttpStatus.BAD_REQUEST, "access.branch_required");

    private final HttpStatus status;
    private final String code;

    AccessOutcome(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus status() {
        return status;
    }

    public String code() {
        return code;
    }
}
