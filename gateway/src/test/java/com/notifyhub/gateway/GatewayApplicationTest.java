package com.notifyhub.gateway;

import com.notifyhub.gateway.support.FakeUpstream;
import com.notifyhub.gateway.support.TestTokens;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DisplayName("Gateway end to end")
class GatewayApplicationTest {

    private static final FakeUpstream UPSTREAM = FakeUpstream.start();
    private static final String UNREACHABLE = FakeUpstream.unreachableUrl();

    @Autowired
    private WebTestClient webTestClient;

    @DynamicPropertySource
    static void upstreams(DynamicPropertyRegistry registry) {
        registry.add("USER_SERVICE_URL", UPSTREAM::url);
        registry.add("ORCHESTRATOR_SERVICE_URL", UPSTREAM::url);
        registry.add("TEMPLATE_SERVICE_URL", () -> UNREACHABLE);
    }

    @AfterAll
    static void stopUpstream() {
        UPSTREAM.stop();
    }

    @BeforeEach
    void resetUpstream() {
        UPSTREAM.reset();
    }

    private static String bearer(String userId) {
        return "Bearer " + TestTokens.valid(userId);
    }

    @Nested
    @DisplayName("Authentication")
    class Authentication {

        @Test
        @DisplayName("Should forward a public path without a token")
        void shouldForwardPublicPath() {
            webTestClient.get().uri("/user/signin")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.data.access_token").isEqualTo("issued-by-user-service")
                    .jsonPath("$.message").isEqualTo("Request successful");

            assertThat(UPSTREAM.receivedFor("/user/signin")).hasSize(1);
        }

        @Test
        @DisplayName("Should reject a protected path without a token and never call upstream")
        void shouldRejectWithoutToken() {
            webTestClient.get().uri("/user/42")
                    .exchange()
                    .expectStatus().isUnauthorized()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.message").isEqualTo("Unauthorized")
                    .jsonPath("$.error").isEqualTo("Unauthorized");

            assertThat(UPSTREAM.received()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a token signed with another secret")
        void shouldRejectForeignToken() {
            webTestClient.get().uri("/user/42")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.signedWithOtherSecret("user-42"))
                    .exchange()
                    .expectStatus().isUnauthorized();

            assertThat(UPSTREAM.received()).isEmpty();
        }

        @Test
        @DisplayName("Should forward the verified identity and drop a spoofed one")
        void shouldPropagateIdentity() {
            String authorization = bearer("user-42");
            webTestClient.get().uri("/user/42?fields=email")
                    .header(HttpHeaders.AUTHORIZATION, authorization)
                    .header("x-user-id", "admin")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.userId").isEqualTo("user-42");

            List<FakeUpstream.Recorded> calls = UPSTREAM.receivedFor("/user/42");
            assertThat(calls).hasSize(1);
            assertThat(calls.get(0).uri()).isEqualTo("/user/42?fields=email");
            assertThat(calls.get(0).headers())
                    .containsEntry("authorization", authorization)
                    .containsEntry("x-user-id", "user-42");
        }

        @Test
        @DisplayName("Should keep the upstream status for upstream errors")
        void shouldKeepUpstreamErrorStatus() {
            webTestClient.post().uri("/user/conflict")
                    .header(HttpHeaders.AUTHORIZATION, bearer("user-42"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"email\":\"a@b.c\"}")
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.message").isEqualTo("Email already registered");
        }
    }

    @Nested
    @DisplayName("Notifications")
    class Notifications {

        @Test
        @DisplayName("Should generate a distinct idempotency key per request when absent")
        void shouldGenerateIdempotencyKeys() {
            for (int i = 0; i < 2; i++) {
                webTestClient.post().uri("/notifications")
                        .header(HttpHeaders.AUTHORIZATION, bearer("user-1"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue("{\"template\":\"welcome\"}")
                        .exchange()
                        .expectStatus().isOk();
            }

            List<FakeUpstream.Recorded> calls = UPSTREAM.receivedFor("/notifications");
            assertThat(calls).hasSize(2);
            String first = calls.get(0).headers().get("x-idempotency-key");
            String second = calls.get(1).headers().get("x-idempotency-key");
            assertThat(first).isNotBlank();
            assertThat(second).isNotBlank().isNotEqualTo(first);
            assertThat(calls.get(0).headers().get("x-correlation-id")).isNotBlank();
            assertThat(calls.get(0).body()).isEqualTo("{\"template\":\"welcome\"}");
        }

        @Test
        @DisplayName("Should forward a caller-supplied idempotency key unchanged")
        void shouldKeepIdempotencyKey() {
            webTestClient.post().uri("/notifications")
                    .header(HttpHeaders.AUTHORIZATION, bearer("user-1"))
                    .header("X-Idempotency-Key", "order-5521")
                    .header("X-Correlation-ID", "trace-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"template\":\"welcome\"}")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().valueEquals("X-Correlation-ID", "trace-1");

            FakeUpstream.Recorded call = UPSTREAM.receivedFor("/notifications").get(0);
            assertThat(call.headers()).containsEntry("x-idempotency-key", "order-5521");
            assertThat(call.headers()).containsEntry("x-correlation-id", "trace-1");
            assertThat(call.headers()).containsEntry("x-user-id", "user-1");
        }

        @Test
        @DisplayName("Should require a token for notifications")
        void shouldProtectNotifications() {
            webTestClient.post().uri("/notifications")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{}")
                    .exchange()
                    .expectStatus().isUnauthorized();

            assertThat(UPSTREAM.received()).isEmpty();
        }

        @Test
        @DisplayName("Should reject a body over the size cap")
        void shouldRejectOversizedBody() {
            webTestClient.post().uri("/notifications")
                    .header(HttpHeaders.AUTHORIZATION, bearer("user-1"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{\"payload\":\"" + "x".repeat(4096) + "\"}")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false);

            assertThat(UPSTREAM.received()).isEmpty();
        }

        @Test
        @DisplayName("Should reject malformed JSON")
        void shouldRejectMalformedJson() {
            webTestClient.post().uri("/notifications")
                    .header(HttpHeaders.AUTHORIZATION, bearer("user-1"))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("{broken")
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").isEqualTo("Invalid JSON body");

            assertThat(UPSTREAM.received()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Gateway responses")
    class GatewayResponses {

        @Test
        @DisplayName("Should answer unmatched paths with a 404 envelope")
        void shouldRejectUnknownRoute() {
            webTestClient.get().uri("/unknown/route")
                    .exchange()
                    .expectStatus().isNotFound()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.message").isEqualTo("Cannot GET /unknown/route")
                    .jsonPath("$.data").isEmpty()
                    .jsonPath("$.meta").isEmpty();
        }

        @Test
        @DisplayName("Should not route a path that only shares a prefix's characters")
        void shouldBeSegmentAware() {
            webTestClient.get().uri("/username")
                    .header(HttpHeaders.AUTHORIZATION, bearer("user-1"))
                    .exchange()
                    .expectStatus().isNotFound();

            assertThat(UPSTREAM.received()).isEmpty();
        }

        @Test
        @DisplayName("Should answer an unreachable upstream with a single 500 envelope")
        void shouldReportUnreachableUpstream() {
            webTestClient.get().uri("/template/welcome")
                    .header(HttpHeaders.AUTHORIZATION, bearer("user-1"))
                    .exchange()
                    .expectStatus().is5xxServerError()
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(false)
                    .jsonPath("$.message").isEqualTo("Proxy server error")
                    .jsonPath("$.error").isNotEmpty()
                    .jsonPath("$.data").isEmpty()
                    .jsonPath("$.meta").isEmpty();
        }

        @Test
        @DisplayName("Should expose health and rate limit headers")
        void shouldServeHealth() {
            webTestClient.get().uri("/health")
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().exists("X-RateLimit-Limit")
                    .expectHeader().exists("X-Correlation-ID")
                    .expectBody()
                    .jsonPath("$.success").isEqualTo(true)
                    .jsonPath("$.data.status").isEqualTo("ok");
        }

        @Test
        @DisplayName("Should list the compiled route table")
        void shouldListRoutes() {
            webTestClient.get().uri("/gateway/routes")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.data.length()").isEqualTo(3)
                    .jsonPath("$.data[0].id").isEqualTo("user-service")
                    .jsonPath("$.data[0].publicPaths[0]").isEqualTo("/user/signin")
                    .jsonPath("$.data[2].access").isEqualTo("PROTECTED");
        }
    }
}
