package com.notifyhub.gateway.exception;

import org.springframework.http.HttpStatus;

public class RouteNotFoundException extends GatewayException {

    public RouteNotFoundException(String method, String path) {
        super(HttpStatus.NOT_FOUND, "Cannot " + method + " " + path);
    }
}
