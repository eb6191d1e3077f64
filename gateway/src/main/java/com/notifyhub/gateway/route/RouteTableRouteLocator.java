package com.notifyhub.gateway.route;

import com.notifyhub.gateway.model.RequestContext;
import lombok.RequiredArgsConstructor;
import org.springframework.cloud.gateway.route.Route;
import org.springframework.cloud.gateway.route.RouteLocator;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Publishes the route table to Spring Cloud Gateway. Each rule becomes a {@link Route} whose
 * predicate accepts the exchange only if {@code RouteClassificationFilter} classified it to that rule,
 * so classification happens exactly once per request.
 */
@RequiredArgsConstructor
public class RouteTableRouteLocator implements RouteLocator {

    private final RouteTable routeTable;

    @Override
    public Flux<Route> getRoutes() {
        List<RouteRule> rules = routeTable.getRules();
        return Flux.fromStream(IntStream.range(0, rules.size())
                .mapToObj(index -> buildRoute(rules.get(index), index)));
    }

    private Route buildRoute(RouteRule rule, int order) {
        return Route.async()
                .id(rule.getId())
                .uri(URI.create(rule.getUpstreamTarget()))
                .order(order)
                .predicate(exchange -> isClassifiedAs(exchange, rule))
                .build();
    }

    private static boolean isClassifiedAs(ServerWebExchange exchange, RouteRule rule) {
        return RequestContext.from(exchange)
                .flatMap(RequestContext::route)
                .map(match -> match.rule().getId().equals(rule.getId()))
                .orElse(false);
    }
}
