package com.notifyhub.gateway.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local store with the same atomicity contract as the Redis store. Each entry carries
 * its own deadline; Caffeine's {@code compute} serializes updates per key.
 * Only correct for a single gateway instance.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private static final long DEFAULT_MAXIMUM_SIZE = 1_000_000;

    private final Ticker ticker;
    private final Cache<String, Entry> entries;

    public InMemoryRateLimitStore() {
        this(Ticker.systemTicker());
    }

    public InMemoryRateLimitStore(Ticker ticker) {
        this.ticker = ticker;
        this.entries = Caffeine.newBuilder()
                .ticker(ticker)
                .maximumSize(DEFAULT_MAXIMUM_SIZE)
                .expireAfter(new DeadlineExpiry())
                .build();
    }

    @Override
    public Mono<CounterRecord> incrementWithTtl(String key, Duration ttl) {
        return Mono.fromSupplier(() -> {
            long now = ticker.read();
            Entry updated = entries.asMap().compute(key, (k, current) -> {
                if (current == null || current.isExpired(now)) {
                    return new Entry(1, now + ttl.toNanos());
                }
                return new Entry(current.value() + 1, current.deadlineNanos());
            });
            return new CounterRecord(updated.value(), updated.remaining(now));
        });
    }

    @Override
    public Mono<Boolean> setIfAbsentWithTtl(String key, Duration ttl) {
        return Mono.fromSupplier(() -> {
            long now = ticker.read();
            AtomicBoolean created = new AtomicBoolean(false);
            entries.asMap().compute(key, (k, current) -> {
                if (current != null && !current.isExpired(now)) {
                    return current;
                }
                created.set(true);
                return new Entry(1, now + ttl.toNanos());
            });
            return created.get();
        });
    }

    @Override
    public Mono<Duration> timeToLive(String key) {
        return Mono.fromSupplier(() -> {
            long now = ticker.read();
            Entry entry = entries.getIfPresent(key);
            return entry == null ? Duration.ZERO : entry.remaining(now);
        });
    }

    private record Entry(long value, long deadlineNanos) {

        boolean isExpired(long now) {
            return deadlineNanos - now <= 0;
        }

        Duration remaining(long now) {
            return Duration.ofNanos(Math.max(0, deadlineNanos - now));
        }
    }

    private static final class DeadlineExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return Math.max(0, entry.deadlineNanos() - currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return Math.max(0, entry.deadlineNanos() - currentTime);
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
