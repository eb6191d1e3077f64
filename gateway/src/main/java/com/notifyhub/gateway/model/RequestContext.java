package com.notifyhub.gateway.model;

import com.notifyhub.gateway.route.RouteMatch;
import lombok.Getter;
import lombok.Setter;
import org.springframework.http.HttpHeaders;
import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * Per-request scratch state, stored as an exchange attribute from request entry until the
 * response completes.
 */
@Getter
public class RequestContext {

    public static final String ATTRIBUTE = RequestContext.class.getName();

    private final String correlationId;
    private final String idempotencyKey;
    private final HttpHeaders inboundHeaders;
    private final long startNanos;

    @Setter
    private RouteMatch routeMatch;

    @Setter
    private TokenClaims claims;

    public RequestContext(String correlationId, String idempotencyKey, HttpHeaders inboundHeaders, long startNanos) {
        this.correlationId = correlationId;
        this.idempotencyKey = idempotencyKey;
        this.inboundHeaders = HttpHeaders.readOnlyHttpHeaders(inboundHeaders);
        this.startNanos = startNanos;
    }

    public Optional<RouteMatch> route() {
        return Optional.ofNullable(routeMatch);
    }

    public Optional<TokenClaims> identity() {
        return Optional.ofNullable(claims);
    }

    public static Optional<RequestContext> from(ServerWebExchange exchange) {
        return Optional.ofNullable(exchange.getAttribute(ATTRIBUTE));
    }

    public void attachTo(ServerWebExchange exchange) {
        exchange.getAttributes().put(ATTRIBUTE, this);
    }
}
