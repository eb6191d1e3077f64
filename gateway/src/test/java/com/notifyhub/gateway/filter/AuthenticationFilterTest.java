package com.notifyhub.gateway.filter;

import com.notifyhub.gateway.exception.AuthenticationException;
import com.notifyhub.gateway.model.Access;
import com.notifyhub.gateway.model.RequestContext;
import com.notifyhub.gateway.route.RouteMatch;
import com.notifyhub.gateway.route.RouteRule;
import com.notifyhub.gateway.service.JwtService;
import com.notifyhub.gateway.support.TestTokens;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AuthenticationFilter")
class AuthenticationFilterTest {

    private static final RouteRule USER_RULE = RouteRule.builder()
            .id("user-service")
            .pathPrefix("/user")
            .upstreamTarget("http://users")
            .publicPath("/user/signin")
            .publicPath("/user/signup")
            .build();

    @Mock
    private GatewayFilterChain chain;

    private JwtService jwtService;
    private AuthenticationFilter filter;

    @BeforeEach
    void setUp() {
        jwtService = spy(new JwtService(TestTokens.SECRET));
        filter = new AuthenticationFilter(jwtService);
    }

    private MockServerWebExchange classifiedExchange(MockServerHttpRequest request) {
        MockServerWebExchange exchange = MockServerWebExchange.from(request);
        RequestContext context = new RequestContext("corr", "idem", request.getHeaders(), System.nanoTime());
        String path = request.getURI().getPath();
        context.setRouteMatch(new RouteMatch(USER_RULE, USER_RULE.accessFor(path)));
        context.attachTo(exchange);
        return exchange;
    }

    @Test
    @DisplayName("Should pass public paths without touching the token service")
    void shouldSkipPublicPaths() {
        MockServerWebExchange exchange = classifiedExchange(MockServerHttpRequest.post("/user/signin")
                .header(HttpHeaders.AUTHORIZATION, "Bearer garbage").build());
        when(chain.filter(exchange)).thenReturn(Mono.empty());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        verifyNoInteractions(jwtService);
        assertThat(RequestContext.from(exchange).orElseThrow().identity()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a protected path without a token")
    void shouldRejectMissingToken() {
        MockServerWebExchange exchange = classifiedExchange(MockServerHttpRequest.get("/user/42").build());

        StepVerifier.create(filter.filter(exchange, chain))
                .expectError(AuthenticationException.class)
                .verify();

        verify(chain, never()).filter(any());
    }

    @Test
    @DisplayName("Should reject a protected path with an expired token")
    void shouldRejectExpiredToken() {
        MockServerWebExchange exchange = classifiedExchange(MockServerHttpRequest.get("/user/42")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.expired("user-42")).build());

        StepVerifier.create(filter.filter(exchange, chain))
                .expectErrorSatisfies(error -> assertThat(error)
                        .isInstanceOf(AuthenticationException.class)
                        .hasMessage("Unauthorized"))
                .verify();
    }

    @Test
    @DisplayName("Should attach the caller identity for a valid token")
    void shouldAttachIdentity() {
        MockServerWebExchange exchange = classifiedExchange(MockServerHttpRequest.get("/user/42")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.valid("user-42")).build());
        when(chain.filter(exchange)).thenReturn(Mono.empty());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        assertThat(RequestContext.from(exchange).flatMap(RequestContext::identity))
                .hasValueSatisfying(claims -> assertThat(claims.subjectId()).isEqualTo("user-42"));
    }

    @Test
    @DisplayName("Should fail closed when the request was never classified")
    void shouldRejectUnclassified() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/user/42")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + TestTokens.valid("user-42")).build());

        StepVerifier.create(filter.filter(exchange, chain))
                .expectError(AuthenticationException.class)
                .verify();
    }

    @Test
    @DisplayName("Should pass every path of a public route")
    void shouldPassPublicRoute() {
        RouteRule docs = RouteRule.builder().id("docs").pathPrefix("/docs").upstreamTarget("http://docs")
                .access(Access.PUBLIC).build();
        MockServerHttpRequest request = MockServerHttpRequest.get("/docs/index").build();
        MockServerWebExchange exchange = MockServerWebExchange.from(request);
        RequestContext context = new RequestContext("c", "i", request.getHeaders(), System.nanoTime());
        context.setRouteMatch(new RouteMatch(docs, docs.accessFor("/docs/index")));
        context.attachTo(exchange);
        when(chain.filter(exchange)).thenReturn(Mono.empty());

        StepVerifier.create(filter.filter(exchange, chain)).verifyComplete();

        verifyNoInteractions(jwtService);
    }
}
