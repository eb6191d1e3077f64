package com.notifyhub.gateway.filter;

import com.notifyhub.gateway.exception.RouteNotFoundException;
import com.notifyhub.gateway.model.RequestContext;
import com.notifyhub.gateway.service.ReverseProxyForwarder;
import lombok.RequiredArgsConstructor;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.cloud.gateway.support.ServerWebExchangeUtils;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Terminal filter: hands the exchange to {@link ReverseProxyForwarder} and marks it routed so
 * the built-in Netty routing filter stays out of the way.
 */
@Component
@RequiredArgsConstructor
public class ProxyRoutingFilter implements GlobalFilter, Ordered {

    private final ReverseProxyForwarder forwarder;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        if (ServerWebExchangeUtils.isAlreadyRouted(exchange)) {
            return chain.filter(exchange);
        }
        RequestContext context = RequestContext.from(exchange)
                .filter(ctx -> ctx.route().isPresent())
                .orElse(null);
        if (context == null) {
            return Mono.error(new RouteNotFoundException(
                    exchange.getRequest().getMethod().name(), exchange.getRequest().getURI().getRawPath()));
        }
        ServerWebExchangeUtils.setAlreadyRouted(exchange);
        return forwarder.forward(exchange, context);
    }

    @Override
    public int getOrder() {
        return Ordered.LOWEST_PRECEDENCE - 1;
    }
}
