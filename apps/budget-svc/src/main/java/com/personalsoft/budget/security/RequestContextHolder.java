package com.personalsoft.budget.security;

import java.util.Optional;
import java.util.UUID;

/**
 * Per-request tenant and trace id, bound by {@link TenantContextFilter} for the lifetime of one
 * servlet request.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<RequestContext> CONTEXT = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    static void bind(RequestContext context) {
        CONTEXT.set(context);
    }

    static void clear() {
        CONTEXT.remove();
    }

    public static Optional<RequestContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    public static Optional<UUID> userId() {
        return get().map(RequestContext::userId);
    }

    public static Optional<String> traceId() {
        return get().map(RequestContext::traceId);
    }

    /** {@code userId} is null when the caller did not identify a tenant. */
    public record RequestContext(UUID userId, String traceId) {
    }
}
