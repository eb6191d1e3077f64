package com.notifyhub.gateway.filter;

import com.notifyhub.gateway.config.GatewayProperties;
import com.notifyhub.gateway.dto.RateLimitResult;
import com.notifyhub.gateway.exception.GatewayException;
import com.notifyhub.gateway.exception.RateLimitExceededException;
import com.notifyhub.gateway.service.RateLimiterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.net.InetSocketAddress;
import java.time.Duration;

/**
 * First gate of every request: counts the hit against the caller's bucket and rejects with 429
 * while the caller is blocked. Runs before route classification, so unmatched paths are
 * counted too.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RateLimitFilter implements WebFilter, Ordered {

    public static final int ORDER = RequestContextFilter.ORDER + 10;

    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";

    private final RateLimiterService rateLimiterService;
    private final GatewayProperties properties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        GatewayProperties.RateLimit settings = properties.getRateLimit();
        if (!settings.isEnabled()) {
            return chain.filter(exchange);
        }

        String clientIp = getClientIp(exchange.getRequest());
        return rateLimiterService.hit(clientIp)
                .map(Decision::of)
                .onErrorResume(e -> {
                    if (settings.isFailOpen()) {
                        log.warn("Rate limit store unavailable, letting {} through: {}", clientIp, e.getMessage());
                        return Mono.just(Decision.unmetered());
                    }
                    log.error("Rate limit store unavailable, rejecting {}: {}", clientIp, e.getMessage());
                    return Mono.error(new GatewayException(HttpStatus.INTERNAL_SERVER_ERROR, "Rate limiter unavailable", e));
                })
                .flatMap(decision -> {
                    if (decision.result() == null) {
                        return chain.filter(exchange);
                    }
                    RateLimitResult result = decision.result();
                    applyHeaders(exchange.getResponse().getHeaders(), result);
                    if (result.blocked()) {
                        log.warn("Rejecting {} {} from {}: rate limited for another {}s",
                                exchange.getRequest().getMethod(), exchange.getRequest().getURI().getRawPath(),
                                clientIp, seconds(result.timeToBlockExpire()));
                        return Mono.error(new RateLimitExceededException(seconds(result.timeToBlockExpire())));
                    }
                    return chain.filter(exchange);
                });
    }

    private void applyHeaders(HttpHeaders headers, RateLimitResult result) {
        headers.set(LIMIT_HEADER, String.valueOf(result.limit()));
        headers.set(REMAINING_HEADER, String.valueOf(result.blocked() ? 0 : result.remaining()));
        Duration reset = result.blocked() ? result.timeToBlockExpire() : result.timeToExpire();
        headers.set(RESET_HEADER, String.valueOf(seconds(reset)));
    }

    /**
     * Remote address, or the first X-Forwarded-For hop when the gateway sits behind a trusted proxy.
     */
    String getClientIp(ServerHttpRequest request) {
        if (properties.getRateLimit().isTrustForwardedFor()) {
            String forwardedFor = request.getHeaders().getFirst("X-Forwarded-For");
            if (StringUtils.hasText(forwardedFor)) {
                String clientIp = forwardedFor.split(",")[0].trim();
                if (StringUtils.hasText(clientIp)) {
                    return clientIp;
                }
            }
        }

        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return "unknown";
    }

    private static long seconds(Duration duration) {
        long millis = Math.max(0, duration.toMillis());
        return (millis + 999) / 1000;
    }

    @Override
    public int getOrder() {
        return ORDER;
    }

    private record Decision(RateLimitResult result) {

        static Decision of(RateLimitResult result) {
            return new Decision(result);
        }

        static Decision unmetered() {
            return new Decision(null);
        }
    }
}
