package com.notifyhub.gateway.route;

import com.notifyhub.gateway.model.RequestContext;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Headers derived from the request context, evaluated once per request.
 */
public final class DynamicHeaderStrategy implements HeaderStrategy {

    private final Function<RequestContext, Map<String, String>> generator;

    DynamicHeaderStrategy(Function<RequestContext, Map<String, String>> generator) {
        this.generator = Objects.requireNonNull(generator, "generator");
    }

    @Override
    public Map<String, String> compute(RequestContext context) {
        Map<String, String> headers = generator.apply(context);
        return headers != null ? headers : Map.of();
    }
}
