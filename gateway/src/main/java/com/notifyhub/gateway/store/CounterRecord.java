package com.notifyhub.gateway.store;

import java.time.Duration;

/**
 * Counter value and remaining TTL, read in the same atomic step as the increment.
 */
public record CounterRecord(long count, Duration timeToLive) {
}
