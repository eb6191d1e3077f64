package com.notifyhub.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class RateLimitExceededException extends GatewayException {

    private final long retryAfterSeconds;

    public RateLimitExceededException(long retryAfterSeconds) {
        super(HttpStatus.TOO_MANY_REQUESTS, "ThrottlerException: Too Many Requests");
        this.retryAfterSeconds = retryAfterSeconds;
    }
}
