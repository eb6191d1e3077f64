package com.notifyhub.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * The upstream could not be reached or did not answer in time.
 */
@Getter
public class UpstreamException extends GatewayException {

    private final String upstream;

    /**
     * Client-facing failure detail, e.g. the connection error. Never the raw cause message.
     */
    private final String error;

    public UpstreamException(String upstream, String message, String error, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
        this.upstream = upstream;
        this.error = error;
    }
}
