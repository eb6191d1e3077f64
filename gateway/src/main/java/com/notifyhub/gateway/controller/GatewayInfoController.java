package com.notifyhub.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.gateway.route.RouteRule;
import com.notifyhub.gateway.route.RouteTable;
import com.notifyhub.gateway.util.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

@RestController
@RequiredArgsConstructor
public class GatewayInfoController {

    private final RouteTable routeTable;
    private final ObjectMapper objectMapper;

    @GetMapping("/health")
    public Mono<JsonNode> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "ok");
        status.put("service", "api-gateway");
        status.put("timestamp", Instant.now().toString());
        return Mono.just(ResponseEnvelope.wrap(objectMapper.valueToTree(status)));
    }

    @GetMapping("/gateway/routes")
    public Mono<JsonNode> routes() {
        List<Map<String, Object>> routes = routeTable.getRules().stream()
                .map(GatewayInfoController::describe)
                .toList();
        return Mono.just(ResponseEnvelope.wrap(objectMapper.valueToTree(routes)));
    }

    private static Map<String, Object> describe(RouteRule rule) {
        Map<String, Object> route = new LinkedHashMap<>();
        route.put("id", rule.getId());
        route.put("pathPrefix", rule.getPathPrefix());
        route.put("upstream", rule.getUpstreamTarget());
        route.put("access", rule.getAccess());
        route.put("publicPaths", new TreeSet<>(rule.getPublicPaths()));
        route.put("methods", new TreeSet<>(rule.getMethods()));
        route.put("propagateIdentity", rule.isPropagateIdentity());
        return route;
    }
}
