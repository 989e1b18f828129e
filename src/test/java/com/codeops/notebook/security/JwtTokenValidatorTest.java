package com.codeops.notebook.security;

import com.codeops.notebook.config.JwtProperties;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for JwtTokenValidator covering token validation, claim extraction, and startup checks.
 */
class JwtTokenValidatorTest {

    private static final String SECRET = "test-secret-key-minimum-32-characters-long-for-hs256-testing";

    private JwtTokenValidator validator;

    @BeforeEach
    void setUp() {
        JwtProperties jwtProperties = new JwtProperties();
        jwtProperties.setSecret(SECRET);
        validator = new JwtTokenValidator(jwtProperties);
        validator.validateSecret();
    }

    @Test
    void validateToken_returnsTrueForValidToken() {
        String token = buildToken(SECRET, UUID.randomUUID(), List.of("MEMBER"), Instant.now().plusSeconds(3600));
        assertThat(validator.validateToken(token)).isTrue();
    }

    @Test
    void validateToken_returnsFalseForExpiredToken() {
        String token = buildToken(SECRET, UUID.randomUUID(), List.of("MEMBER"), Instant.now().minusSeconds(3600));
        assertThat(validator.validateToken(token)).isFalse();
    }

    @Test
    void validateToken_returnsFalseForInvalidSignature() {
        String token = buildToken("wrong-secret-key-minimum-32-characters-long-for-testing",
                UUID.randomUUID(), List.of(), Instant.now().plusSeconds(3600));
        assertThat(validator.validateToken(token)).isFalse();
    }

    @Test
    void validateToken_returnsFalseForMalformedToken() {
        assertThat(validator.validateToken("not.a.valid.jwt")).isFalse();
    }

    @Test
    void validateSecret_throwsForMissingSecret() {
        JwtTokenValidator unconfigured = new JwtTokenValidator(new JwtProperties());

        assertThatThrownBy(unconfigured::validateSecret)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("32 characters");
    }

    @Test
    void claims_areExtracted() {
        UUID userId = UUID.randomUUID();
        String token = buildToken(SECRET, userId, List.of("ADMIN", "MEMBER"), Instant.now().plusSeconds(3600));

        assertThat(validator.getUserIdFromToken(token)).isEqualTo(userId);
        assertThat(validator.getEmailFromToken(token)).isEqualTo("alice@codeops.dev");
        assertThat(validator.getRolesFromToken(token)).containsExactly("ADMIN", "MEMBER");
    }

    @Test
    void getRolesFromToken_missingClaimIsEmpty() {
        SecretKey key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
        String token = Jwts.builder()
                .subject(UUID.randomUUID().toString())
                .expiration(Date.from(Instant.now().plusSeconds(60)))
                .signWith(key)
                .compact();

        assertThat(validator.getRolesFromToken(token)).isEmpty();
    }

    private String buildToken(String secret, UUID userId, List<String> roles, Instant expiration) {
        SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        return Jwts.builder()
                .subject(userId.toString())
                .claim("email", "alice@codeops.dev")
                .claim("roles", roles)
                .issuedAt(new Date())
                .expiration(Date.from(expiration))
                .signWith(key)
                .compact();
    }
}
