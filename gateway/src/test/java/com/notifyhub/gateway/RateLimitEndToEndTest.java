package com.notifyhub.gateway;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "gateway.rate-limit.limit=3",
                "gateway.rate-limit.window=60s",
                "gateway.rate-limit.block-duration=120s"
        })
@ActiveProfiles("test")
@DisplayName("Rate limiting end to end")
class RateLimitEndToEndTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    @DisplayName("Should reject the caller with 429 once the limit is exceeded, on any path")
    void shouldBlockAfterLimit() {
        for (int i = 0; i < 3; i++) {
            webTestClient.get().uri("/health")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().valueEquals("X-RateLimit-Remaining", String.valueOf(2 - i));
        }

        webTestClient.get().uri("/health")
                .exchange()
                .expectStatus().isEqualTo(429)
                .expectHeader().valueEquals(HttpHeaders.RETRY_AFTER, "120")
                .expectBody()
                .jsonPath("$.success").isEqualTo(false)
                .jsonPath("$.message").isEqualTo("ThrottlerException: Too Many Requests");

        webTestClient.get().uri("/unknown/route")
                .exchange()
                .expectStatus().isEqualTo(429);
    }
}
