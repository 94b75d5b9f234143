package com.steakz.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.regex.Pattern;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC signing key for access tokens. A Base64 secret is decoded, anything else is used as raw text.
 */
@Component
public class JwtTokenProvider {

    private static final Pattern BASE64 = Pattern.compile("^[A-Za-z0-9+/]+={0,2}$");

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        this.secretKey = new SecretKeySpec(keyBytes(secret), "HmacSHA256");
    }

    static byte[] keyBytes(String secret) {
        if (secret.length() % 4 == 0 && BASE64.matcher(secret).matches()) {
            byte[] decoded = Base64.getDecoder().decode(secret);
            if (decoded.length >= 32) {
                return decoded;
            }
        }
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
