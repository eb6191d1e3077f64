package com.notifyhub.gateway.filter;

import com.notifyhub.gateway.exception.AuthenticationException;
import com.notifyhub.gateway.model.RequestContext;
import com.notifyhub.gateway.model.TokenClaims;
import com.notifyhub.gateway.route.RouteMatch;
import com.notifyhub.gateway.service.JwtService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.cloud.gateway.filter.GlobalFilter;
import org.springframework.core.Ordered;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Bearer-token gate for protected routes. Public routes and public paths pass without
 * touching the token.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AuthenticationFilter implements GlobalFilter, Ordered {

    private final JwtService jwtService;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        Optional<RequestContext> context = RequestContext.from(exchange);
        boolean required = context.flatMap(RequestContext::route)
                .map(RouteMatch::requiresAuth)
                .orElse(true);
        if (!required) {
            return chain.filter(exchange);
        }

        Optional<TokenClaims> claims = jwtService.extractToken(exchange.getRequest().getHeaders())
                .flatMap(jwtService::validateToken);
        if (claims.isEmpty() || context.isEmpty()) {
            log.warn("Unauthorized {} {} | CorrelationId: {}",
                    exchange.getRequest().getMethod(), exchange.getRequest().getURI().getRawPath(),
                    context.map(RequestContext::getCorrelationId).orElse("-"));
            return Mono.error(new AuthenticationException());
        }

        context.get().setClaims(claims.get());
        log.debug("Authenticated subject {} (role: {})", claims.get().subjectId(), claims.get().role());
        return chain.filter(exchange);
    }

    @Override
    public int getOrder() {
        return -100;
    }
}
