package com.steakz.backend.modules.access.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class BranchIdParserTest {

    @Test
    void nullAndBlankAreAbsent() {
        assertThat(BranchIdParser.parse(null).kind()).isEqualTo(ParsedBranchId.Kind.ABSENT);
        assertThat(BranchIdParser.parse("  ").kind()).isEqualTo(ParsedBranchId.Kind.ABSENT);
        assertThat(BranchIdParser.of(null).kind()).isEqualTo(ParsedBranchId.Kind.ABSENT);
    }

    @Test
    void positiveIntegersAreAccepted() {
        ParsedBranchId parsed = BranchIdParser.parse(" 42 ");
        assertThat(parsed.isDefined()).isTrue();
        assertThat(parsed.value()).isEqualTo(42L);
        assertThat(BranchIdParser.of(7L).asOptional()).contains(7L);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-3", "abc", "1.5", "12a", "+4", "99999999999999999999"})
    void malformedValuesAreInvalid(String raw) {
        ParsedBranchId parsed = BranchIdParser.parse(raw);
        assertThat(parsed.kind()).isEqualTo(ParsedBranchId.Kind.INVALID);
        assertThat(parsed.raw()).isEqualTo(raw);
        assertThat(parsed.asOptional()).isEmpty();
    }

    @Test
    void nonPositiveLongIsInvalid() {
        assertThat(BranchIdParser.of(0L).kind()).isEqualTo(ParsedBranchId.Kind.INVALID);
        assertThat(BranchIdParser.of(-1L).kind()).isEqualTo(ParsedBranchId.Kind.INVALID);
    }
}
