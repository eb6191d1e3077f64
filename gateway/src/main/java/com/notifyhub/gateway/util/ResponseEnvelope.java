package com.notifyhub.gateway.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Builds the single JSON shape every gateway response uses:
 * {@code {success, data, message, error?, meta}}.
 */
public final class ResponseEnvelope {

    public static final String DEFAULT_SUCCESS_MESSAGE = "Request successful";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private ResponseEnvelope() {
    }

    /**
     * Wraps a successful payload. Payloads that already carry {@code success} are returned
     * unchanged, so wrapping twice is a no-op; payloads carrying {@code meta} keep it.
     */
    public static JsonNode wrap(JsonNode body) {
        if (isEnvelope(body)) {
            return body;
        }
        ObjectNode envelope = NODES.objectNode();
        envelope.put("success", true);
        if (body != null && body.isObject() && body.hasNonNull("meta")) {
            envelope.set("data", body.hasNonNull("data") ? body.get("data") : NODES.objectNode());
            envelope.set("message", body.hasNonNull("message") ? body.get("message") : NODES.textNode(DEFAULT_SUCCESS_MESSAGE));
            envelope.set("meta", body.get("meta"));
            return envelope;
        }
        envelope.set("data", body != null ? body : NODES.nullNode());
        envelope.put("message", DEFAULT_SUCCESS_MESSAGE);
        envelope.set("meta", NODES.objectNode());
        return envelope;
    }

    public static ObjectNode failure(String error, String message) {
        ObjectNode envelope = NODES.objectNode();
        envelope.put("success", false);
        envelope.put("error", error);
        envelope.put("message", message);
        envelope.set("data", NODES.objectNode());
        envelope.set("meta", NODES.objectNode());
        return envelope;
    }

    public static ObjectNode failure(String message) {
        return failure(message, message);
    }

    public static boolean isEnvelope(JsonNode body) {
        return body != null && body.isObject() && body.has("success");
    }
}
