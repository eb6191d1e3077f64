package com.notifyhub.gateway.dto;

import java.time.Duration;

/**
 * Outcome of one rate-limiter increment.
 *
 * @param totalHits         hits counted in the current window ({@code limit} while blocked)
 * @param blocked           whether the caller must back off
 * @param timeToExpire      remaining window time, zero while blocked by an earlier burst
 * @param timeToBlockExpire remaining block time, zero when not blocked
 * @param limit             configured hits per window
 */
public record RateLimitResult(long totalHits,
                              boolean blocked,
                              Duration timeToExpire,
                              Duration timeToBlockExpire,
                              int limit) {

    public long remaining() {
        return Math.max(0, limit - totalHits);
    }
}
