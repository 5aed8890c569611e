package com.cityhive.service.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cityhive.observability.CorrelationContext;
import com.cityhive.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Pure servlet mock tests, no Spring context.
 */
@DisplayName("CorrelationIdFilter")
class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("generates correlation and request IDs when none provided")
    void generatesIdsWhenNoneProvided() throws Exception {
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(new MockHttpServletRequest(), response, chain);

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank();
        assertThat(response.getHeader("X-Request-ID")).isNotBlank()
                .isNotEqualTo(response.getHeader("X-Correlation-ID"));
    }

    @Test
    @DisplayName("propagates existing correlation ID from header")
    void propagatesExistingCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "test-abc-123");
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isEqualTo("test-abc-123");
    }

    @Test
    @DisplayName("replaces an over-long correlation ID")
    void replacesOverLongCorrelationId() throws Exception {
        var request = new MockHttpServletRequest();
        String tooLong = "x".repeat(CorrelationIdFilter.MAX_ID_LENGTH + 1);
        request.addHeader("X-Correlation-ID", tooLong);
        var response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> {});

        assertThat(response.getHeader("X-Correlation-ID")).isNotBlank().isNotEqualTo(tooLong);
    }

    @Test
    @DisplayName("populates the holder and MDC while the chain runs")
    void setsContextDuringFilterChain() throws Exception {
        var capturedId = new AtomicReference<String>();
        var capturedMdc = new AtomicReference<String>();
        FilterChain capturingChain = (req, resp) -> {
            capturedId.set(CorrelationContextHolder.get()
                    .map(CorrelationContext::correlationId)
                    .orElse(null));
            capturedMdc.set(MDC.get(CorrelationContext.MDC_CORRELATION_ID));
        };
        var request = new MockHttpServletRequest();
        request.addHeader("X-Correlation-ID", "during-chain-123");

        filter.doFilter(request, new MockHttpServletResponse(), capturingChain);

        assertThat(capturedId.get()).isEqualTo("during-chain-123");
        assertThat(capturedMdc.get()).isEqualTo("during-chain-123");
    }

    @Test
    @DisplayName("clears the holder after the request, even when the chain throws")
    void clearsContextAfterRequest() {
        FilterChain failing = (req, resp) -> {
            throw new IllegalStateException("boom");
        };

        assertThatThrownBy(() ->
                        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), failing))
                .hasMessage("boom");

        assertThat(CorrelationContextHolder.get()).isEmpty();
    }
}
