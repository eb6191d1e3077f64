package com.notifyhub.gateway.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.notifyhub.gateway.config.GatewayProperties;
import com.notifyhub.gateway.exception.MalformedRequestException;
import com.notifyhub.gateway.exception.RouteNotFoundException;
import com.notifyhub.gateway.exception.UpstreamException;
import com.notifyhub.gateway.model.RequestContext;
import com.notifyhub.gateway.route.RouteMatch;
import com.notifyhub.gateway.route.RouteRule;
import com.notifyhub.gateway.util.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Executes the outbound call for a matched route and writes the upstream answer back,
 * normalizing JSON bodies into the response envelope.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReverseProxyForwarder {

    static final Set<String> HOP_BY_HOP_HEADERS = Set.of(
            "connection",
            "keep-alive",
            "te",
            "trailer",
            "transfer-encoding",
            "upgrade",
            "proxy-authenticate",
            "proxy-authorization");

    private static final String PROXY_ERROR_MESSAGE = "Proxy server error";

    private final WebClient webClient;
    private final GatewayProperties properties;
    private final ObjectMapper objectMapper;

    public Mono<Void> forward(ServerWebExchange exchange, RequestContext context) {
        ServerHttpRequest request = exchange.getRequest();
        RouteMatch match = context.route().orElse(null);
        if (match == null) {
            return Mono.error(new RouteNotFoundException(request.getMethod().name(), request.getURI().getRawPath()));
        }
        RouteRule rule = match.rule();
        URI target = buildTargetUri(rule.getUpstreamTarget(), request.getURI());

        return readBody(request)
                .flatMap(body -> {
                    HttpHeaders outbound = buildOutboundHeaders(request.getHeaders(), context, match, body.length > 0);
                    if (body.length > 0 && isJson(outbound.getFirst(HttpHeaders.CONTENT_TYPE))) {
                        try {
                            objectMapper.readTree(body);
                        } catch (IOException e) {
                            log.warn("Rejecting {} {}: body is not valid JSON ({})",
                                    request.getMethod(), request.getURI().getRawPath(), e.getMessage());
                            return Mono.error(new MalformedRequestException("Invalid JSON body", e));
                        }
                    }
                    return callUpstream(request, context, rule, target, outbound, body);
                })
                .flatMap(upstream -> writeResponse(exchange, upstream));
    }

    private Mono<ResponseEntity<byte[]>> callUpstream(ServerHttpRequest request,
                                                      RequestContext context,
                                                      RouteRule rule,
                                                      URI target,
                                                      HttpHeaders outbound,
                                                      byte[] body) {
        long started = System.nanoTime();
        log.info("Proxying {} {} to {} | CorrelationId: {}",
                request.getMethod(), request.getURI().getRawPath(), target, context.getCorrelationId());

        WebClient.RequestBodySpec spec = webClient.method(request.getMethod())
                .uri(target)
                .headers(headers -> headers.addAll(outbound));
        WebClient.RequestHeadersSpec<?> ready = body.length > 0 ? spec.bodyValue(body) : spec;

        return ready.exchangeToMono(response -> response.toEntity(byte[].class))
                .timeout(properties.getProxy().getTimeout())
                .doOnNext(response -> log.info("Response from {}: {} for {} {} in {}ms",
                        rule.getUpstreamTarget(), response.getStatusCode().value(),
                        request.getMethod(), request.getURI().getRawPath(), elapsedMillis(started)))
                .onErrorMap(ReverseProxyForwarder::isUpstreamFailure, e -> {
                    String detail = describe(e);
                    log.error("Proxy error to {}: {}", rule.getUpstreamTarget(), detail);
                    return new UpstreamException(rule.getUpstreamTarget(), PROXY_ERROR_MESSAGE, detail, e);
                })
                .doOnCancel(() -> log.warn("Client went away, cancelled {} {} to {} after {}ms",
                        request.getMethod(), request.getURI().getRawPath(), rule.getUpstreamTarget(),
                        elapsedMillis(started)));
    }

    private Mono<byte[]> readBody(ServerHttpRequest request) {
        long maxBytes = properties.getProxy().getMaxRequestSize().toBytes();
        long declared = request.getHeaders().getContentLength();
        if (declared > maxBytes) {
            return Mono.error(new MalformedRequestException("Request body exceeds " + maxBytes + " bytes"));
        }
        return DataBufferUtils.join(request.getBody(), (int) Math.min(maxBytes, Integer.MAX_VALUE))
                .map(buffer -> {
                    byte[] bytes = new byte[buffer.readableByteCount()];
                    buffer.read(bytes);
                    DataBufferUtils.release(buffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .onErrorMap(DataBufferLimitException.class,
                        e -> new MalformedRequestException("Request body exceeds " + maxBytes + " bytes", e));
    }

    HttpHeaders buildOutboundHeaders(HttpHeaders inbound, RequestContext context, RouteMatch match, boolean hasBody) {
        RouteRule rule = match.rule();
        String identityHeader = properties.getIdentityHeader();
        Set<String> connectionTokens = connectionTokens(inbound);

        HttpHeaders outbound = new HttpHeaders();
        inbound.forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lower)
                    || connectionTokens.contains(lower)
                    || lower.equals("host")
                    || lower.equals("content-length")
                    || lower.equals(identityHeader.toLowerCase(Locale.ROOT))) {
                return;
            }
            outbound.put(name, new ArrayList<>(values));
        });

        rule.getHeaderStrategy().compute(context).forEach((name, value) -> {
            if (value != null && !value.isBlank() && firstNonBlank(outbound, name) == null) {
                outbound.set(name, value);
            }
        });

        if (rule.isPropagateIdentity() && match.requiresAuth()) {
            context.identity().ifPresent(claims -> outbound.set(identityHeader, claims.subjectId()));
        }

        if (hasBody && !outbound.containsKey(HttpHeaders.CONTENT_TYPE)) {
            outbound.setContentType(MediaType.APPLICATION_JSON);
        }
        return outbound;
    }

    static URI buildTargetUri(String upstream, URI inbound) {
        return UriComponentsBuilder.fromUriString(upstream)
                .path(inbound.getRawPath())
                .query(inbound.getRawQuery())
                .build(true)
                .toUri();
    }

    private Mono<Void> writeResponse(ServerWebExchange exchange, ResponseEntity<byte[]> upstream) {
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            log.warn("Response already committed, dropping upstream answer for {}", exchange.getRequest().getURI().getRawPath());
            return Mono.empty();
        }

        HttpHeaders headers = response.getHeaders();
        Set<String> gatewayOwned = headers.keySet().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
        Set<String> connectionTokens = connectionTokens(upstream.getHeaders());
        upstream.getHeaders().forEach((name, values) -> {
            String lower = name.toLowerCase(Locale.ROOT);
            if (HOP_BY_HOP_HEADERS.contains(lower)
                    || connectionTokens.contains(lower)
                    || lower.equals("content-length")
                    || gatewayOwned.contains(lower)) {
                return;
            }
            headers.put(name, new ArrayList<>(values));
        });

        byte[] body;
        try {
            body = normalizeBody(upstream);
        } catch (IOException e) {
            return Mono.error(new IllegalStateException("Failed to serialize response envelope", e));
        }

        response.setStatusCode(upstream.getStatusCode());
        headers.setContentLength(body.length);
        if (body.length == 0) {
            return response.setComplete();
        }
        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }

    /**
     * JSON bodies go through the envelope; everything else passes through byte for byte.
     */
    byte[] normalizeBody(ResponseEntity<byte[]> upstream) throws IOException {
        byte[] body = upstream.getBody() != null ? upstream.getBody() : new byte[0];
        MediaType contentType = upstream.getHeaders().getContentType();
        if (body.length == 0 || contentType == null || !isJson(contentType)) {
            return body;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(body);
        } catch (IOException e) {
            log.debug("Upstream declared JSON but sent something else, passing through: {}", e.getMessage());
            return body;
        }

        HttpStatusCode status = upstream.getStatusCode();
        if (status.is2xxSuccessful()) {
            return objectMapper.writeValueAsBytes(ResponseEnvelope.wrap(node));
        }
        if (ResponseEnvelope.isEnvelope(node)) {
            return body;
        }
        return objectMapper.writeValueAsBytes(failureFromUpstream(status, node));
    }

    private static ObjectNode failureFromUpstream(HttpStatusCode status, JsonNode node) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String message = textOf(node, "message");
        if (message == null) {
            message = resolved != null ? resolved.getReasonPhrase() : "Upstream error";
        }
        String error = textOf(node, "error");
        return ResponseEnvelope.failure(error != null ? error : message, message);
    }

    private static String textOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isArray() && !value.isEmpty()) {
            List<String> parts = new ArrayList<>();
            value.forEach(part -> parts.add(part.asText()));
            return String.join(", ", parts);
        }
        return value.toString();
    }

    private static boolean isUpstreamFailure(Throwable e) {
        return e instanceof TimeoutException
                || e instanceof WebClientRequestException
                || e instanceof DataBufferLimitException;
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "no response within timeout";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    static boolean isJson(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return false;
        }
        try {
            return isJson(MediaType.parseMediaType(contentType));
        } catch (InvalidMediaTypeException e) {
            log.debug("Unparseable Content-Type '{}', skipping JSON validation", contentType);
            return false;
        }
    }

    private static boolean isJson(MediaType mediaType) {
        return MediaType.APPLICATION_JSON.isCompatibleWith(mediaType)
                || mediaType.getSubtype().toLowerCase(Locale.ROOT).endsWith("+json");
    }

    private static Set<String> connectionTokens(HttpHeaders headers) {
        List<String> connection = headers.getConnection();
        return connection.stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(token -> token.trim().toLowerCase(Locale.ROOT))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.toSet());
    }

    private static String firstNonBlank(HttpHeaders headers, String name) {
        List<String> values = headers.get(name);
        if (values == null) {
            return null;
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .findFirst()
                .orElse(null);
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
