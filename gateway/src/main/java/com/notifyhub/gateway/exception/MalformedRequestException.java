package com.notifyhub.gateway.exception;

import org.springframework.http.HttpStatus;

public class MalformedRequestException extends GatewayException {

    public MalformedRequestException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, message, cause);
    }
}
