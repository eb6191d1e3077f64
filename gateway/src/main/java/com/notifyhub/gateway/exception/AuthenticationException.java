package com.notifyhub.gateway.exception;

import org.springframework.http.HttpStatus;

public class AuthenticationException extends GatewayException {

    public AuthenticationException() {
        super(HttpStatus.UNAUTHORIZED, "Unauthorized");
    }
}
