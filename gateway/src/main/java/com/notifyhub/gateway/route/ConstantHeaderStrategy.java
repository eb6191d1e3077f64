package com.notifyhub.gateway.route;

import com.notifyhub.gateway.model.RequestContext;

import java.util.Map;

/**
 * Same headers for every request on the route.
 */
public record ConstantHeaderStrategy(Map<String, String> headers) implements HeaderStrategy {

    static final ConstantHeaderStrategy EMPTY = new ConstantHeaderStrategy(Map.of());

    public ConstantHeaderStrategy {
        headers = Map.copyOf(headers);
    }

    @Override
    public Map<String, String> compute(RequestContext context) {
        return headers;
    }
}
