package com.cityhive.service.infrastructure.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Logs the start and outcome of every HTTP request with its method, path, status and duration.
 *
 * <p>Runs right after {@link CorrelationIdFilter}, so every line carries the correlation ID. The
 * method and path are added to the MDC for the duration of the request. A request whose handler
 * chain throws is logged at ERROR and the exception is rethrown.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    static final String MDC_METHOD = "method";
    static final String MDC_PATH = "path";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String method = request.getMethod();
        String path = request.getRequestURI();
        long startNanos = System.nanoTime();
        MDC.put(MDC_METHOD, method);
        MDC.put(MDC_PATH, path);
        log.info("Request started: method={}, path={}, remote={}", method, path, request.getRemoteAddr());

        try {
            filterChain.doFilter(request, response);
            log.info("Request completed: method={}, path={}, status={}, durationMs={}",
                    method, path, response.getStatus(), elapsedMs(startNanos));
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("Request failed: method={}, path={}, durationMs={}, errorType={}",
                    method, path, elapsedMs(startNanos), e.getClass().getSimpleName());
            throw e;
        } finally {
            MDC.remove(MDC_METHOD);
            MDC.remove(MDC_PATH);
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
