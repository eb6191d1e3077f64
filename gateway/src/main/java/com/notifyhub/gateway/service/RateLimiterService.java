package com.notifyhub.gateway.service;

import com.notifyhub.gateway.config.GatewayProperties;
import com.notifyhub.gateway.dto.RateLimitResult;
import com.notifyhub.gateway.model.RateLimitKey;
import com.notifyhub.gateway.store.RateLimitStore;
import com.notifyhub.gateway.store.RedisKeys;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Fixed-window counter with a sticky block. Once a key exceeds its limit it stays blocked for
 * the block duration regardless of the counter's own window.
 */
@Slf4j
@RequiredArgsConstructor
public class RateLimiterService {

    private final RateLimitStore store;
    private final GatewayProperties.RateLimit settings;

    /**
     * Counts one hit for {@code callerId} with the configured throttler name, window, limit and
     * block duration.
     */
    public Mono<RateLimitResult> hit(String callerId) {
        RateLimitKey key = new RateLimitKey(settings.getThrottlerName(), callerId);
        return increment(key, settings.getWindow(), settings.getLimit(), settings.effectiveBlockDuration());
    }

    public Mono<RateLimitResult> increment(RateLimitKey key, Duration window, int limit, Duration blockDuration) {
        String counterKey = RedisKeys.counterKey(key);
        String blockKey = RedisKeys.blockKey(key);

        return store.timeToLive(blockKey)
                .flatMap(blockTtl -> {
                    if (isPositive(blockTtl)) {
                        log.debug("Key {} is blocked for another {}ms", key, blockTtl.toMillis());
                        return Mono.just(new RateLimitResult(limit, true, Duration.ZERO, blockTtl, limit));
                    }
                    return countHit(counterKey, blockKey, key, window, limit, blockDuration);
                });
    }

    private Mono<RateLimitResult> countHit(String counterKey,
                                           String blockKey,
                                           RateLimitKey key,
                                           Duration window,
                                           int limit,
                                           Duration blockDuration) {
        return store.incrementWithTtl(counterKey, window)
                .flatMap(counter -> {
                    if (counter.count() <= limit) {
                        return Mono.just(new RateLimitResult(
                                counter.count(), false, counter.timeToLive(), Duration.ZERO, limit));
                    }
                    return store.setIfAbsentWithTtl(blockKey, blockDuration)
                            .flatMap(created -> created
                                    ? Mono.just(blockDuration)
                                    : store.timeToLive(blockKey).filter(RateLimiterService::isPositive)
                                            .defaultIfEmpty(blockDuration))
                            .doOnNext(blockTtl -> log.warn("Rate limit exceeded for {}: {} hits in window (limit {}), blocked for {}s",
                                    key, counter.count(), limit, blockTtl.toSeconds()))
                            .map(blockTtl -> new RateLimitResult(
                                    counter.count(), true, counter.timeToLive(), blockTtl, limit));
                });
    }

    private static boolean isPositive(Duration duration) {
        return !duration.isNegative() && !duration.isZero();
    }
}
