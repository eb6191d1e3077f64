package com.notifyhub.gateway.model;

import java.time.Instant;

/**
 * Verified payload of a caller's bearer token. Lives for one request only.
 */
public record TokenClaims(String subjectId, String role, Instant issuedAt, Instant expiresAt) {
}
