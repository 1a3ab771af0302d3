package com.flagship.settlement_engine.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Tags every log line of a request with its correlation ID and caller.
 *
 * The correlation ID comes from X-Correlation-ID when the client sent one
 * and is echoed on the response. Keys the services add during the request
 * (fingerprint, listing id) are removed with the others afterwards.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final List<String> REQUEST_MDC_KEYS = List.of(
            CorrelationContext.CORRELATION_ID_MDC_KEY,
            CorrelationContext.CALLER_MDC_KEY,
            CorrelationContext.FINGERPRINT_MDC_KEY,
            CorrelationContext.LISTING_ID_MDC_KEY);

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = CorrelationContext.newCorrelationId();
        }
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);

        String caller = request.getHeader(CorrelationContext.CALLER_HEADER);
        if (caller != null && !caller.isBlank()) {
            MDC.put(CorrelationContext.CALLER_MDC_KEY, caller);
        }

        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            REQUEST_MDC_KEYS.forEach(MDC::remove);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
