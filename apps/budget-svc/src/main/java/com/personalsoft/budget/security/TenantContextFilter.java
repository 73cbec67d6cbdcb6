package com.personalsoft.budget.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Reads the tenant and trace id forwarded by the gateway. Authentication happens upstream; a
 * request without a usable {@value #USER_HEADER} still passes through and is rejected by the first
 * budget operation that needs a tenant.
 */
@Component
public class TenantContextFilter extends OncePerRequestFilter {

    public static final String TRACE_HEADER = "X-Request-Trace";
    public static final String USER_HEADER = "X-User-Id";

    static final String MDC_TRACE = "trace_id";
    static final String MDC_USER = "user_id";

    private static final Logger log = LoggerFactory.getLogger(TenantContextFilter.class);

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request);
        UUID userId = resolveUserId(request);
        RequestContextHolder.bind(new RequestContextHolder.RequestContext(userId, traceId));
        MDC.put(MDC_TRACE, traceId);
        if (userId != null) {
            MDC.put(MDC_USER, userId.toString());
        }
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_TRACE);
            MDC.remove(MDC_USER);
            RequestContextHolder.clear();
        }
    }

    private static String resolveTraceId(HttpServletRequest request) {
        String forwarded = request.getHeader(TRACE_HEADER);
        return forwarded == null || forwarded.isBlank() ? UUID.randomUUID().toString() : forwarded.trim();
    }

    private static UUID resolveUserId(HttpServletRequest request) {
        String header = request.getHeader(USER_HEADER);
        if (header == null || header.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(header.trim());
        } catch (IllegalArgumentException ex) {
            log.debug("Ignoring malformed {} header on {}", USER_HEADER, request.getRequestURI());
            return null;
        }
    }
}
