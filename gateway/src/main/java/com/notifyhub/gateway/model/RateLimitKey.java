package com.notifyhub.gateway.model;

/**
 * Identifies one rate-limit bucket: a throttler name plus the caller it counts.
 */
public record RateLimitKey(String throttlerName, String callerId) {

    public String value() {
        return throttlerName + ":" + callerId;
    }

    @Override
    public String toString() {
        return value();
    }
}
