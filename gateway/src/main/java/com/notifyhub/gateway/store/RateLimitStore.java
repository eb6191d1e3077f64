package com.notifyhub.gateway.store;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Shared, TTL-capable key-value store behind the rate limiter. Every operation must be atomic
 * across all gateway instances that share the store.
 */
public interface RateLimitStore {

    /**
     * Increments the counter at {@code key}; when the result is 1 the key's TTL is set to
     * {@code ttl}. Returns the new count and the key's remaining TTL.
     */
    Mono<CounterRecord> incrementWithTtl(String key, Duration ttl);

    /**
     * Creates {@code key} with the given TTL unless it already exists.
     *
     * @return true if this call created the key
     */
    Mono<Boolean> setIfAbsentWithTtl(String key, Duration ttl);

    /**
     * Remaining TTL of {@code key}, or {@link Duration#ZERO} if it does not exist.
     */
    Mono<Duration> timeToLive(String key);
}
