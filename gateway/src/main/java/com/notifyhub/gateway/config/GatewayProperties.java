package com.notifyhub.gateway.config;

import com.notifyhub.gateway.model.Access;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway configuration, bound once at startup from {@code application.yml} and the environment.
 * Startup fails if any constraint below is violated.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "gateway")
public class GatewayProperties {

    @Valid
    @NotNull
    private Jwt jwt = new Jwt();

    @Valid
    @NotNull
    private RateLimit rateLimit = new RateLimit();

    @Valid
    @NotNull
    private Proxy proxy = new Proxy();

    /**
     * Header carrying the authenticated subject id towards upstreams.
     */
    @NotBlank
    private String identityHeader = "x-user-id";

    /**
     * Ordered route table; the first matching prefix wins.
     */
    @Valid
    @NotEmpty
    private List<Route> routes = new ArrayList<>();

    @Data
    public static class Jwt {
        /**
         * HMAC secret shared with the user service that signs tokens.
         */
        @NotBlank(message = "JWT_SECRET must be configured")
        private String secret;

        @AssertTrue(message = "JWT_SECRET must be at least 32 bytes for HMAC-SHA256")
        public boolean isSecretLongEnough() {
            return secret == null || secret.isBlank()
                    || secret.getBytes(StandardCharsets.UTF_8).length >= 32;
        }
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;

        @NotBlank
        private String throttlerName = "default";

        @Min(1)
        private int limit = 100;

        @NotNull
        private Duration window = Duration.ofSeconds(60);

        /**
         * Defaults to {@link #window} when unset.
         */
        private Duration blockDuration;

        @NotNull
        private StoreType store = StoreType.REDIS;

        /**
         * Let requests through when the store cannot be reached.
         */
        private boolean failOpen = false;

        /**
         * Use the first X-Forwarded-For hop as caller id. Only enable behind a trusted proxy.
         */
        private boolean trustForwardedFor = false;

        public Duration effectiveBlockDuration() {
            return blockDuration != null ? blockDuration : window;
        }

        @AssertTrue(message = "rate-limit window and block-duration must be positive")
        public boolean isDurationsPositive() {
            return window != null && !window.isNegative() && !window.isZero()
                    && (blockDuration == null || (!blockDuration.isNegative() && !blockDuration.isZero()));
        }
    }

    public enum StoreType {
        REDIS,
        MEMORY
    }

    @Data
    public static class Proxy {
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(5);

        @NotNull
        private DataSize maxRequestSize = DataSize.ofMegabytes(10);

        @NotNull
        private DataSize maxResponseSize = DataSize.ofMegabytes(16);
    }

    @Data
    public static class Route {
        @NotBlank
        private String id;

        @NotBlank
        private String pathPrefix;

        @NotBlank
        private String upstream;

        @NotNull
        private Access access = Access.PROTECTED;

        /**
         * Exact paths under this prefix that never require a token.
         */
        private List<String> publicPaths = new ArrayList<>();

        /**
         * HTTP methods this route accepts; empty means any.
         */
        private List<String> methods = new ArrayList<>();

        private boolean propagateIdentity = true;

        /**
         * Headers always sent upstream unless the caller supplied a value.
         */
        private Map<String, String> staticHeaders = new LinkedHashMap<>();

        /**
         * Headers filled with the request's generated ids unless the caller supplied a value.
         * Supported: X-Idempotency-Key, X-Correlation-ID.
         */
        private List<String> generatedHeaders = new ArrayList<>();
    }
}
