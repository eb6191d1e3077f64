package com.notifyhub.gateway.route;

import com.notifyhub.gateway.model.Access;

/**
 * Result of classifying a request: the winning rule and the access tag resolved for the path.
 */
public record RouteMatch(RouteRule rule, Access access) {

    public boolean requiresAuth() {
        return access == Access.PROTECTED;
    }
}
