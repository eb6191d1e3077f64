package com.notifyhub.gateway.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Failure with a client-visible status. Converted to the error envelope by
 * {@link com.notifyhub.gateway.web.GatewayErrorWebExceptionHandler}.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final HttpStatus status;

    public GatewayException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public GatewayException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * Value of the envelope's {@code error} field. Defaults to the message.
     */
    public String getError() {
        return getMessage();
    }
}
