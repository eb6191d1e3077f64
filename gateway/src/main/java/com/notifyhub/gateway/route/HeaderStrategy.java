package com.notifyhub.gateway.route;

import com.notifyhub.gateway.model.RequestContext;

import java.util.Map;
import java.util.function.Function;

/**
 * Computes route-specific headers to send upstream. The forwarder only applies a computed
 * header when the caller did not already send a non-blank value for it.
 */
@FunctionalInterface
public interface HeaderStrategy {

    Map<String, String> compute(RequestContext context);

    static HeaderStrategy none() {
        return ConstantHeaderStrategy.EMPTY;
    }

    static HeaderStrategy constant(Map<String, String> headers) {
        return headers.isEmpty() ? none() : new ConstantHeaderStrategy(headers);
    }

    static HeaderStrategy dynamic(Function<RequestContext, Map<String, String>> generator) {
        return new DynamicHeaderStrategy(generator);
    }
}
