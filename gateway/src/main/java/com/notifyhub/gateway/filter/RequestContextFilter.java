package com.notifyhub.gateway.filter;

import com.notifyhub.gateway.model.RequestContext;
import com.notifyhub.gateway.route.RouteTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Creates the {@link RequestContext} at request entry: inbound correlation id and idempotency
 * key are kept, missing ones are generated. Logs receipt and final status.
 */
@Component
@Slf4j
public class RequestContextFilter implements WebFilter, Ordered {

    public static final int ORDER = Ordered.HIGHEST_PRECEDENCE;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        HttpHeaders headers = request.getHeaders();

        RequestContext context = new RequestContext(
                headerOrGenerated(headers, RouteTable.CORRELATION_ID_HEADER),
                headerOrGenerated(headers, RouteTable.IDEMPOTENCY_KEY_HEADER),
                headers,
                System.nanoTime());
        context.attachTo(exchange);

        String method = request.getMethod().name();
        String path = request.getURI().getRawPath();
        log.info("Received: {} {} | CorrelationId: {} | RemoteAddr: {}",
                method, path, context.getCorrelationId(), request.getRemoteAddress());

        exchange.getResponse().getHeaders().set(RouteTable.CORRELATION_ID_HEADER, context.getCorrelationId());
        exchange.getResponse().beforeCommit(() -> {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - context.getStartNanos());
            log.info("Response: {} {} - Status: {} | Duration: {}ms | CorrelationId: {}",
                    method, path, exchange.getResponse().getStatusCode(), durationMs, context.getCorrelationId());
            return Mono.empty();
        });

        return chain.filter(exchange);
    }

    static String headerOrGenerated(HttpHeaders headers, String name) {
        String value = firstNonBlank(headers, name);
        return value != null ? value : UUID.randomUUID().toString();
    }

    static String firstNonBlank(HttpHeaders headers, String name) {
        var values = headers.get(name);
        if (values == null) {
            return null;
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
