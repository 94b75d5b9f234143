package com.steakz.backend.global.security;

/**
 * Identity carried by a verified access token. {@code role} is the raw claim value and may be
 * null or unknown when the token was minted for a malformed account.
 */
public record JwtAuthenticationPrincipal(Long userId, String email, String role) {
}
