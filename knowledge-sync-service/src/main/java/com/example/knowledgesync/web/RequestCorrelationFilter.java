package com.example.knowledgesync.web;

import com.example.knowledgesync.logging.CorrelationIds;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Binds the X-Request-ID of an API call to the MDC.
 *
 * A POST /sync without a usable caller id gets a SYNC- id, which then becomes the run's
 * correlation id: the synchronous report carries it, and background runs inherit it
 * through the MDC task decorator. Other endpoints get HTTP- ids. Actuator calls are
 * not filtered.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@Slf4j
public class RequestCorrelationFilter extends OncePerRequestFilter {

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return path(request).startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String supplied = request.getHeader(CorrelationIds.HEADER);
        String correlationId = CorrelationIds.accept(supplied)
                .orElseGet(() -> CorrelationIds.newId(startsSyncRun(request) ? "SYNC" : "HTTP"));
        if (supplied != null && !supplied.equals(correlationId)) {
            log.debug("Ignoring malformed {} header, using {}", CorrelationIds.HEADER, correlationId);
        }

        MDC.put(CorrelationIds.MDC_KEY, correlationId);
        response.setHeader(CorrelationIds.HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CorrelationIds.MDC_KEY);
        }
    }

    private static boolean startsSyncRun(HttpServletRequest request) {
        return HttpMethod.POST.matches(request.getMethod()) && "/sync".equals(path(request));
    }

    private static String path(HttpServletRequest request) {
        return request.getRequestURI().substring(request.getContextPath().length());
    }
}
