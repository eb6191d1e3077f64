package com.notifyhub.gateway.service;

import com.notifyhub.gateway.model.TokenClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Bearer token extraction and verification. Verification fails closed: any problem yields an
 * empty result and a log line, never an exception.
 */
@Slf4j
public class JwtService {

    private static final String BEARER_SCHEME = "Bearer";
    private static final String BEARER_PREFIX = BEARER_SCHEME + " ";
    private static final String USER_ID_CLAIM = "user_id";
    private static final String ROLE_CLAIM = "role";

    private final SecretKey signingKey;

    public JwtService(String secret) {
        if (secret == null || secret.isBlank()) {
            log.warn("JWT secret is not configured; every token will be rejected");
            this.signingKey = null;
        } else {
            this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
            log.info("JWT signing key initialized");
        }
    }

    /**
     * Reads the bearer credential from the Authorization header. Header lookup is
     * case-insensitive; the {@code Bearer } prefix is optional.
     */
    public Optional<String> extractToken(HttpHeaders headers) {
        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || authHeader.isBlank()) {
            return Optional.empty();
        }
        String token = authHeader.strip();
        if (token.equalsIgnoreCase(BEARER_SCHEME)) {
            return Optional.empty();
        }
        if (token.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            token = token.substring(BEARER_PREFIX.length()).strip();
        }
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    public Optional<TokenClaims> validateToken(String token) {
        if (signingKey == null) {
            log.warn("JWT secret is not configured");
            return Optional.empty();
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(signingKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            return toTokenClaims(claims);
        } catch (ExpiredJwtException e) {
            log.warn("Token validation failed: token expired at {}", e.getClaims().getExpiration());
            return Optional.empty();
        } catch (SignatureException e) {
            log.warn("Token validation failed: {}", e.getMessage());
            log.error("JWT secret mismatch: the gateway secret must match the secret the user service signs tokens with");
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Token validation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<TokenClaims> toTokenClaims(Claims claims) {
        Object userId = claims.get(USER_ID_CLAIM);
        String subjectId = userId != null ? userId.toString() : claims.getSubject();
        if (subjectId == null || subjectId.isBlank()) {
            log.warn("Token validation failed: no {} or sub claim", USER_ID_CLAIM);
            return Optional.empty();
        }
        Object role = claims.get(ROLE_CLAIM);
        return Optional.of(new TokenClaims(
                subjectId,
                role != null ? role.toString() : null,
                toInstant(claims.getIssuedAt()),
                toInstant(claims.getExpiration())));
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }
}
