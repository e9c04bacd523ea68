package com.leasehold.service.infrastructure.web;

import com.leasehold.observability.CorrelationContext;
import com.leasehold.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is kept, otherwise a UUID is generated. The ID is
 * placed in {@link CorrelationContextHolder} (and so in the MDC) for the whole request, together
 * with the {@code X-Leasehold-Caller} address when present, and echoed on the response. The router
 * continues this correlation when it derives the per-action context, so audit events carry it too.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CALLER_HEADER = "X-Leasehold-Caller";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        String caller = request.getHeader(CALLER_HEADER);

        var context = new CorrelationContext(
                correlationId, null, caller, UUID.randomUUID().toString(), null, null);
        CorrelationContextHolder.set(context);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            // Tomcat reuses threads
            CorrelationContextHolder.clear();
        }
    }
}
