package com.steakz.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import com.steakz.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.steakz.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "steakz-unit-test-signing-secret-0123456789";
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    private JwtTokenService serviceAt(Instant instant) {
        return new JwtTokenService(provider, 900_000L, 604_800_000L, Clock.fixed(instant, ZoneOffset.UTC));
    }

    @Test
    void issuedTokenCarriesSubjectEmailAndRole() {
        TokenPairResponse pair = serviceAt(NOW).issueTokenPair(12L, "chef@steakz.test", "KITCHEN_STAFF", "refresh-1");

        assertThat(pair.refreshToken()).isEqualTo("refresh-1");
        assertThat(pair.expiresIn()).isEqualTo(900L);

        JwtTokenService.ParsedToken parsed = serviceAt(NOW.plusSeconds(60)).parseAccessToken(pair.accessToken());
        assertThat(parsed.userId()).isEqualTo(12L);
        assertThat(parsed.email()).isEqualTo("chef@steakz.test");
        assertThat(parsed.role()).isEqualTo("KITCHEN_STAFF");
        assertThat(parsed.expiresAt().toInstant()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = serviceAt(NOW).issueTokenPair(1L, "a@steakz.test", "CUSTOMER", "r").accessToken();

        assertThatThrownBy(() -> serviceAt(NOW.plus(Duration.ofMinutes(16))).parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("a-completely-different-signing-secret-987654"),
                900_000L,
                604_800_000L,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
        String token = foreign.issueTokenPair(1L, "a@steakz.test", "OWNER_ADMIN", "r").accessToken();

        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken(token))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void garbageIsRejected() {
        assertThatThrownBy(() -> serviceAt(NOW).parseAccessToken("not-a-jwt"))
                .isInstanceOf(JwtTokenService.InvalidTokenException.class);
    }

    @Test
    void base64SecretIsDecoded() {
        String base64 = "c3RlYWt6LWJhc2U2NC1zaWduaW5nLXNlY3JldC0wMTIzNDU2Nzg5";
        byte[] key = new JwtTokenProvider(base64).getSecretKey().getEncoded();
        assertThat(new String(key, StandardCharsets.UTF_8)).isEqualTo("steakz-base64-signing-secret-0123456789");
    }
}
