package com.notifyhub.gateway.config;

import com.notifyhub.gateway.route.RouteTable;
import com.notifyhub.gateway.route.RouteTableRouteLocator;
import com.notifyhub.gateway.service.JwtService;
import com.notifyhub.gateway.service.RateLimiterService;
import com.notifyhub.gateway.store.InMemoryRateLimitStore;
import com.notifyhub.gateway.store.RateLimitStore;
import com.notifyhub.gateway.store.RedisRateLimitStore;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Slf4j
@Configuration
@EnableConfigurationProperties(GatewayProperties.class)
public class GatewayConfig {

    @Bean
    public RouteTable routeTable(GatewayProperties properties) {
        return RouteTable.fromProperties(properties);
    }

    @Bean
    public RouteTableRouteLocator routeTableRouteLocator(RouteTable routeTable) {
        return new RouteTableRouteLocator(routeTable);
    }

    @Bean
    public JwtService jwtService(GatewayProperties properties) {
        return new JwtService(properties.getJwt().getSecret());
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.rate-limit", name = "store", havingValue = "redis", matchIfMissing = true)
    public RateLimitStore redisRateLimitStore(ReactiveStringRedisTemplate redisTemplate) {
        log.info("Rate limit counters stored in Redis");
        return new RedisRateLimitStore(redisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "gateway.rate-limit", name = "store", havingValue = "memory")
    public RateLimitStore inMemoryRateLimitStore() {
        log.warn("Rate limit counters kept in process memory; limits are per instance");
        return new InMemoryRateLimitStore();
    }

    @Bean
    public RateLimiterService rateLimiterService(RateLimitStore store, GatewayProperties properties) {
        GatewayProperties.RateLimit settings = properties.getRateLimit();
        if (settings.effectiveBlockDuration().compareTo(settings.getWindow()) < 0) {
            log.warn("Rate limit block duration {} is shorter than the window {}; a caller may be re-blocked "
                    + "by its stale counter once the block lapses", settings.effectiveBlockDuration(), settings.getWindow());
        }
        log.info("Rate limit: {} requests per {} (block {}, throttler '{}')",
                settings.getLimit(), settings.getWindow(), settings.effectiveBlockDuration(), settings.getThrottlerName());
        return new RateLimiterService(store, settings);
    }

    @Bean
    public WebClient upstreamWebClient(WebClient.Builder builder, GatewayProperties properties) {
        GatewayProperties.Proxy proxy = properties.getProxy();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) proxy.getConnectTimeout().toMillis())
                .responseTimeout(proxy.getTimeout());

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs()
                        .maxInMemorySize((int) Math.min(proxy.getMaxResponseSize().toBytes(), Integer.MAX_VALUE)))
                .build();
    }
}
