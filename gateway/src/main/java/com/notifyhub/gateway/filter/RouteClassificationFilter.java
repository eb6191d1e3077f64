package com.notifyhub.gateway.filter;

import com.notifyhub.gateway.model.RequestContext;
import com.notifyhub.gateway.route.RouteTable;
import lombok.RequiredArgsConstructor;
import org.springframework.core.Ordered;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Matches the request against the route table once and records the result on the
 * {@link RequestContext}. Unmatched requests continue without a route and end as 404.
 */
@Component
@RequiredArgsConstructor
public class RouteClassificationFilter implements WebFilter, Ordered {

    public static final int ORDER = RateLimitFilter.ORDER + 10;

    private final RouteTable routeTable;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        RequestContext.from(exchange).ifPresent(context ->
                routeTable.classify(request.getPath().pathWithinApplication().value(), request.getMethod().name())
                        .ifPresent(context::setRouteMatch));
        return chain.filter(exchange);
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
