package com.steakz.backend.modules.access.domain;

/**
 * Explicit parsing of branch ids supplied as text (query string, path, JSON).
 * Only positive base-10 integers that fit in a {@code long} are accepted.
 */
public final class BranchIdParser {

    private BranchIdParser() {
    }

    public static ParsedBranchId parse(String raw) {
        if (raw == null) {
            return ParsedBranchId.absent();
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return ParsedBranchId.absent();
        }
        for (int i = 0; i < trimmed.length(); i++) {
            char c = trimmed.charAt(i);
            if (c < '0' || c > '9') {
                return ParsedBranchId.invalid(raw);
            }
        }
        try {
            long value = Long.parseLong(trimmed);
            return value > 0 ? ParsedBranchId.of(value) : ParsedBranchId.invalid(raw);
        } catch (NumberFormatException ex) {
            return ParsedBranchId.invalid(raw);
        }
    }

    public static ParsedBranchId of(Long value) {
        if (value == null) {
            return ParsedBranchId.absent();
        }
        return value > 0 ? ParsedBranchId.of(value) : ParsedBranchId.invalid(value.toString());
    }
}
