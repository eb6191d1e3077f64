package com.notifyhub.gateway.model;

/**
 * Whether a compiled route entry requires a verified bearer token.
 */
public enum Access {
    PUBLIC,
    PROTECTED
}
