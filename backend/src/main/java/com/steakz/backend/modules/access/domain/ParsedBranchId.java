package com.steakz.backend.modules.access.domain;

import java.util.Optional;

/**
 * A branch id as it arrived at the boundary. ABSENT and INVALID are kept apart so a bad value is
 * never mistaken for "no value" or for zero.
 */
public record ParsedBranchId(Kind kind, Long value, String raw) {

    public enum Kind {
        ABSENT,
        INVALID,
        VALUE
    }

    private static final ParsedBranchId ABSENT = new ParsedBranchId(Kind.ABSENT, null, null);

    public static ParsedBranchId absent() {
        return ABSENT;
    }

    public static ParsedBranchId invalid(String raw) {
        return new ParsedBranchId(Kind.INVALID, null, raw);
    }

    public static ParsedBranchId of(long value) {
        return new ParsedBranchId(Kind.VALUE, value, Long.toString(value));
    }

    public boolean isDefined() {
        return kind == Kind.VALUE;
    }

    public Optional<Long> asOptional() {
        return isDefined() ? Optional.of(value) : Optional.empty();
    }
}
