package com.notifyhub.gateway.route;

import com.notifyhub.gateway.config.GatewayProperties;
import com.notifyhub.gateway.model.RequestContext;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable list of route rules. Classification picks the first rule whose prefix
 * (and method restriction, if any) matches.
 */
@Slf4j
public class RouteTable {

    public static final String IDEMPOTENCY_KEY_HEADER = "X-Idempotency-Key";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private final List<RouteRule> rules;

    public RouteTable(List<RouteRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RouteTable fromProperties(GatewayProperties properties) {
        List<RouteRule> rules = properties.getRoutes().stream()
                .map(RouteTable::compile)
                .toList();
        rules.forEach(rule -> log.info("Route {} -> {} (prefix: {}, access: {}, public paths: {})",
                rule.getId(), rule.getUpstreamTarget(), rule.getPathPrefix(), rule.getAccess(), rule.getPublicPaths()));
        return new RouteTable(rules);
    }

    public List<RouteRule> getRules() {
        return rules;
    }

    public Optional<RouteMatch> classify(String path, String method) {
        for (RouteRule rule : rules) {
            if (rule.matchesPath(path) && rule.matchesMethod(method)) {
                RouteMatch match = new RouteMatch(rule, rule.accessFor(path));
                log.debug("Classified {} {} -> route {} ({})", method, path, rule.getId(), match.access());
                return Optional.of(match);
            }
        }
        log.debug("No route for {} {}", method, path);
        return Optional.empty();
    }

    static RouteRule compile(GatewayProperties.Route route) {
        return RouteRule.builder()
                .id(route.getId())
                .pathPrefix(route.getPathPrefix())
                .upstreamTarget(route.getUpstream())
                .access(route.getAccess())
                .publicPaths(route.getPublicPaths())
                .methods(route.getMethods())
                .propagateIdentity(route.isPropagateIdentity())
                .headerStrategy(headerStrategy(route))
                .build();
    }

    private static HeaderStrategy headerStrategy(GatewayProperties.Route route) {
        Map<String, String> staticHeaders = Map.copyOf(route.getStaticHeaders());
        List<String> generated = List.copyOf(route.getGeneratedHeaders());
        if (generated.isEmpty()) {
            return HeaderStrategy.constant(staticHeaders);
        }
        generated.forEach(RouteTable::requireSupportedGeneratedHeader);
        return HeaderStrategy.dynamic(context -> {
            Map<String, String> headers = new LinkedHashMap<>(staticHeaders);
            for (String name : generated) {
                headers.put(name, generatedValue(name, context));
            }
            return headers;
        });
    }

    private static String generatedValue(String header, RequestContext context) {
        return switch (header.toLowerCase(Locale.ROOT)) {
            case "x-idempotency-key" -> context.getIdempotencyKey();
            case "x-correlation-id" -> context.getCorrelationId();
            default -> throw new IllegalStateException("Unsupported generated header: " + header);
        };
    }

    private static void requireSupportedGeneratedHeader(String header) {
        String name = header.toLowerCase(Locale.ROOT);
        if (!name.equals(IDEMPOTENCY_KEY_HEADER.toLowerCase(Locale.ROOT))
                && !name.equals(CORRELATION_ID_HEADER.toLowerCase(Locale.ROOT))) {
            throw new IllegalArgumentException("Unsupported generated header: " + header);
        }
    }
}
