package com.notifyhub.gateway.route;

import com.notifyhub.gateway.model.Access;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One compiled entry of the route table. Immutable once built.
 */
@Getter
@ToString(exclude = "headerStrategy")
public final class RouteRule {

    private final String id;
    private final String pathPrefix;
    private final String upstreamTarget;
    private final Access access;
    private final Set<String> publicPaths;
    private final Set<String> methods;
    private final boolean propagateIdentity;
    private final HeaderStrategy headerStrategy;

    @Builder
    private RouteRule(String id,
                      String pathPrefix,
                      String upstreamTarget,
                      Access access,
                      @Singular Set<String> publicPaths,
                      @Singular Set<String> methods,
                      Boolean propagateIdentity,
                      HeaderStrategy headerStrategy) {
        this.id = id;
        this.pathPrefix = normalize(pathPrefix);
        this.upstreamTarget = stripTrailingSlash(upstreamTarget);
        this.access = access != null ? access : Access.PROTECTED;
        this.publicPaths = publicPaths.stream()
                .map(RouteRule::normalize)
                .map(path -> path.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.methods = methods.stream()
                .map(method -> method.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.propagateIdentity = propagateIdentity == null || propagateIdentity;
        this.headerStrategy = headerStrategy != null ? headerStrategy : HeaderStrategy.none();
    }

    /**
     * Segment-aware prefix test: {@code /user} matches {@code /user} and {@code /user/42}
     * but not {@code /username}.
     */
    public boolean matchesPath(String path) {
        if ("/".equals(pathPrefix)) {
            return true;
        }
        return path.equals(pathPrefix) || path.startsWith(pathPrefix + "/");
    }

    public boolean matchesMethod(String method) {
        return methods.isEmpty() || (method != null && methods.contains(method.toUpperCase(Locale.ROOT)));
    }

    /**
     * Resolves the access tag for a concrete path under this rule.
     */
    public Access accessFor(String path) {
        if (access == Access.PUBLIC) {
            return Access.PUBLIC;
        }
        return publicPaths.contains(normalize(path).toLowerCase(Locale.ROOT)) ? Access.PUBLIC : Access.PROTECTED;
    }

    static String normalize(String path) {
        if (path == null || path.isBlank()) {
            return "/";
        }
        String normalized = path.trim();
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        return normalized.length() > 1 ? stripTrailingSlash(normalized) : normalized;
    }

    private static String stripTrailingSlash(String value) {
        if (value == null) {
            return null;
        }
        String result = value;
        while (result.length() > 1 && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }
}
