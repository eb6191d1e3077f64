package com.notifyhub.gateway.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

@Slf4j
public class RedisRateLimitStore implements RateLimitStore {

    private static final String BLOCK_MARKER = "1";
    private static final String INCREMENT_SCRIPT = "scripts/rate_limit_increment.lua";

    private final ReactiveStringRedisTemplate redisTemplate;
    private final RedisScript<List<Long>> incrementScript;

    public RedisRateLimitStore(ReactiveStringRedisTemplate redisTemplate) {
        this(redisTemplate, loadIncrementScript());
    }

    RedisRateLimitStore(ReactiveStringRedisTemplate redisTemplate, RedisScript<List<Long>> incrementScript) {
        this.redisTemplate = redisTemplate;
        this.incrementScript = incrementScript;
    }

    static RedisScript<List<Long>> loadIncrementScript() {
        DefaultRedisScript<List<Long>> script = new DefaultRedisScript<>();
        script.setLocation(new ClassPathResource(INCREMENT_SCRIPT));
        script.setResultType(listOfLongs());
        return script;
    }

    // Lua multi-bulk replies come back as List<Long>; List.class cannot carry the element type.
    @SuppressWarnings("unchecked")
    private static Class<List<Long>> listOfLongs() {
        return (Class<List<Long>>) (Class<?>) List.class;
    }

    private ReactiveValueOperations<String, String> valueOps() {
        return redisTemplate.opsForValue();
    }

    @Override
    public Mono<CounterRecord> incrementWithTtl(String key, Duration ttl) {
        return redisTemplate.execute(incrementScript, List.of(key), List.of(String.valueOf(ttl.toMillis())))
                .next()
                .map(result -> toCounterRecord(key, result));
    }

    @Override
    public Mono<Boolean> setIfAbsentWithTtl(String key, Duration ttl) {
        return valueOps().setIfAbsent(key, BLOCK_MARKER, ttl)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Duration> timeToLive(String key) {
        return redisTemplate.getExpire(key)
                .filter(ttl -> !ttl.isNegative())
                .defaultIfEmpty(Duration.ZERO);
    }

    private CounterRecord toCounterRecord(String key, List<Long> result) {
        if (result == null || result.size() < 2) {
            throw new IllegalStateException("Unexpected increment script result for " + key + ": " + result);
        }
        long count = result.get(0);
        long ttlMillis = result.get(1);
        log.trace("Counter {} = {} (ttl {}ms)", key, count, ttlMillis);
        return new CounterRecord(count, Duration.ofMillis(Math.max(0, ttlMillis)));
    }
}
