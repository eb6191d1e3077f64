package com.notifyhub.gateway.store;

import com.notifyhub.gateway.model.RateLimitKey;

public final class RedisKeys {
    public static final String RATE_LIMIT_PREFIX = "rate_limit:";
    public static final String BLOCK_SUFFIX = ":block";

    private RedisKeys() {
    }

    public static String counterKey(RateLimitKey key) {
        return RATE_LIMIT_PREFIX + key.value();
    }

    public static String blockKey(RateLimitKey key) {
        return counterKey(key) + BLOCK_SUFFIX;
    }
}
