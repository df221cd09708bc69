package com.taskboard.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.Objects;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.taskboard.backend.modules.auth.presentation.dto.AccessTokenResponse;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies HS256 access tokens. The secret is read as Base64 when it decodes,
 * otherwise its UTF-8 bytes are used, and must yield at least 256 bits.
 */
@Service
public class JwtTokenService {

    private static final String HMAC_SHA_256 = "HmacSHA256";
    private static final int MIN_KEY_BYTES = 32;

    private final SecretKey secretKey;
    private final long accessTokenTtlMillis;
    private final Clock clock;

    public JwtTokenService(
            @Value("${jwt.secret}") String secret,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            Clock clock
    ) {
        this.secretKey = toSecretKey(secret);
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.clock = clock;
    }

    public AccessTokenResponse issueAccessToken(Long userId, String username, List<String> roles) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);

        String accessToken = Jwts.builder()
                .subject(userId.toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim("username", username)
                .claim("roles", roles)
                .signWith(secretKey, SIG.HS256)
                .compact();

        return new AccessTokenResponse(
                accessToken,
                AccessTokenResponse.DEFAULT_TOKEN_TYPE,
                accessTokenTtlMillis / 1000L,
                OffsetDateTime.ofInstant(now, clock.getZone())
        );
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Long userId = Long.valueOf(claims.getSubject());
            String username = claims.get("username", String.class);
            List<?> rolesClaim = claims.get("roles", List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : clock.instant();

            return new ParsedToken(userId, username, roles, OffsetDateTime.ofInstant(expiresAt, clock.getZone()));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    private static SecretKey toSecretKey(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("jwt.secret must be configured");
        }
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        }
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must provide at least 256 bits of key material");
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    public record ParsedToken(Long userId, String username, List<String> roles, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
