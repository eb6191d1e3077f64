package com.notifyhub.gateway.filter;

import com.notifyhub.gateway.config.GatewayProperties;
import com.notifyhub.gateway.model.RequestContext;
import com.notifyhub.gateway.route.RouteTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RequestContextFilter and RouteClassificationFilter")
class RequestContextFilterTest {

    private final RequestContextFilter contextFilter = new RequestContextFilter();

    private final WebFilterChain terminal = exchange -> Mono.empty();

    private static RouteTable routeTable() {
        GatewayProperties.Route route = new GatewayProperties.Route();
        route.setId("notification-orchestrator");
        route.setPathPrefix("/notifications");
        route.setUpstream("http://orchestrator");
        route.setGeneratedHeaders(List.of("X-Idempotency-Key", "X-Correlation-ID"));
        GatewayProperties properties = new GatewayProperties();
        properties.setRoutes(List.of(route));
        return RouteTable.fromProperties(properties);
    }

    @Test
    @DisplayName("Should keep inbound correlation id and idempotency key unchanged")
    void shouldKeepInboundIds() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/notifications")
                .header("X-Correlation-ID", "corr-123")
                .header("X-Idempotency-Key", "idem-456")
                .build());

        StepVerifier.create(contextFilter.filter(exchange, terminal)).verifyComplete();

        RequestContext context = RequestContext.from(exchange).orElseThrow();
        assertThat(context.getCorrelationId()).isEqualTo("corr-123");
        assertThat(context.getIdempotencyKey()).isEqualTo("idem-456");
        assertThat(exchange.getResponse().getHeaders().getFirst("X-Correlation-ID")).isEqualTo("corr-123");
    }

    @Test
    @DisplayName("Should generate distinct ids for separate requests without headers")
    void shouldGenerateUniqueIds() {
        MockServerWebExchange first = MockServerWebExchange.from(MockServerHttpRequest.post("/notifications").build());
        MockServerWebExchange second = MockServerWebExchange.from(MockServerHttpRequest.post("/notifications").build());

        contextFilter.filter(first, terminal).block();
        contextFilter.filter(second, terminal).block();

        RequestContext a = RequestContext.from(first).orElseThrow();
        RequestContext b = RequestContext.from(second).orElseThrow();
        assertThat(a.getIdempotencyKey()).isNotBlank().isNotEqualTo(b.getIdempotencyKey());
        assertThat(a.getCorrelationId()).isNotBlank().isNotEqualTo(b.getCorrelationId());
    }

    @Test
    @DisplayName("Should treat a blank inbound header as missing")
    void shouldReplaceBlankHeader() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.post("/notifications")
                .header("X-Idempotency-Key", "  ")
                .build());

        contextFilter.filter(exchange, terminal).block();

        assertThat(RequestContext.from(exchange).orElseThrow().getIdempotencyKey()).isNotBlank();
    }

    @Test
    @DisplayName("Should record the route match once classified")
    void shouldClassify() {
        RouteClassificationFilter classificationFilter = new RouteClassificationFilter(routeTable());
        MockServerWebExchange matched = MockServerWebExchange.from(MockServerHttpRequest.post("/notifications/send").build());
        MockServerWebExchange unmatched = MockServerWebExchange.from(MockServerHttpRequest.get("/nowhere").build());

        contextFilter.filter(matched, exchange -> classificationFilter.filter(exchange, terminal)).block();
        contextFilter.filter(unmatched, exchange -> classificationFilter.filter(exchange, terminal)).block();

        assertThat(RequestContext.from(matched).flatMap(RequestContext::route))
                .hasValueSatisfying(match -> assertThat(match.rule().getId()).isEqualTo("notification-orchestrator"));
        assertThat(RequestContext.from(unmatched).flatMap(RequestContext::route)).isEmpty();
    }
}
