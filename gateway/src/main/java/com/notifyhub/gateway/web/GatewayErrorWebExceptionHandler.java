package com.notifyhub.gateway.web;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.notifyhub.gateway.exception.GatewayException;
import com.notifyhub.gateway.exception.RateLimitExceededException;
import com.notifyhub.gateway.model.RequestContext;
import com.notifyhub.gateway.route.RouteTable;
import com.notifyhub.gateway.util.ResponseEnvelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.reactive.error.ErrorWebExceptionHandler;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Turns every failure into the error envelope {@code {success:false, error, message, data:{}, meta:{}}}.
 * Registered ahead of Boot's default handler.
 */
@Slf4j
@Component
@Order(-2)
@RequiredArgsConstructor
public class GatewayErrorWebExceptionHandler implements ErrorWebExceptionHandler {

    static final String INTERNAL_ERROR_MESSAGE = "Internal server error";

    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(ServerWebExchange exchange, Throwable ex) {
        ServerHttpRequest request = exchange.getRequest();
        ServerHttpResponse response = exchange.getResponse();
        if (response.isCommitted()) {
            log.warn("Response already sent for {} {}, cannot send error response: {}",
                    request.getMethod(), request.getURI().getRawPath(), ex.getMessage());
            return Mono.empty();
        }

        ErrorDescriptor descriptor = describe(request, ex);
        if (descriptor.status().is5xxServerError()) {
            log.error("{} {} - Error: {}", request.getMethod(), request.getURI().getRawPath(), descriptor.message(), ex);
        } else {
            log.warn("{} {} - Error: {}", request.getMethod(), request.getURI().getRawPath(), descriptor.message());
        }

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(ResponseEnvelope.failure(descriptor.error(), descriptor.message()));
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }

        response.setStatusCode(descriptor.status());
        HttpHeaders headers = response.getHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setContentLength(body.length);
        RequestContext.from(exchange)
                .ifPresent(context -> headers.set(RouteTable.CORRELATION_ID_HEADER, context.getCorrelationId()));
        if (ex instanceof RateLimitExceededException limited) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(0, limited.getRetryAfterSeconds())));
        }

        DataBuffer buffer = response.bufferFactory().wrap(body);
        return response.writeWith(Mono.just(buffer));
    }

    ErrorDescriptor describe(ServerHttpRequest request, Throwable ex) {
        if (ex instanceof GatewayException gatewayException) {
            return new ErrorDescriptor(gatewayException.getStatus(), gatewayException.getError(), gatewayException.getMessage());
        }
        if (ex instanceof ResponseStatusException statusException) {
            HttpStatusCode status = statusException.getStatusCode();
            String message;
            if (status.value() == HttpStatus.NOT_FOUND.value()) {
                message = "Cannot " + request.getMethod().name() + " " + request.getURI().getRawPath();
            } else if (statusException.getReason() != null && !statusException.getReason().isBlank()) {
                message = statusException.getReason();
            } else {
                HttpStatus resolved = HttpStatus.resolve(status.value());
                message = resolved != null ? resolved.getReasonPhrase() : "Error";
            }
            return new ErrorDescriptor(status, message, message);
        }
        return new ErrorDescriptor(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR_MESSAGE, INTERNAL_ERROR_MESSAGE);
    }

    record ErrorDescriptor(HttpStatusCode status, String error, String message) {
    }
}
