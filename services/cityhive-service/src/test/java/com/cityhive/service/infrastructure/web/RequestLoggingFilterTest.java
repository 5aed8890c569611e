package com.cityhive.service.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.MDC;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(OutputCaptureExtension.class)
@DisplayName("RequestLoggingFilter")
class RequestLoggingFilterTest {

    private final RequestLoggingFilter filter = new RequestLoggingFilter();

    @Test
    @DisplayName("logs start and completion with status and duration")
    void logsCompletedRequest(CapturedOutput output) throws Exception {
        var request = new MockHttpServletRequest("POST", "/api/hives");
        FilterChain chain = (req, resp) -> ((HttpServletResponse) resp).setStatus(201);

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(output).contains("Request started: method=POST, path=/api/hives");
        assertThat(output).containsPattern("Request completed: method=POST, path=/api/hives, status=201, durationMs=\\d+");
    }

    @Test
    @DisplayName("exposes method and path in the MDC while the chain runs")
    void populatesMdc() throws Exception {
        var method = new AtomicReference<String>();
        var path = new AtomicReference<String>();
        FilterChain chain = (req, resp) -> {
            method.set(MDC.get(RequestLoggingFilter.MDC_METHOD));
            path.set(MDC.get(RequestLoggingFilter.MDC_PATH));
        };

        filter.doFilter(new MockHttpServletRequest("GET", "/health/ready"), new MockHttpServletResponse(), chain);

        assertThat(method.get()).isEqualTo("GET");
        assertThat(path.get()).isEqualTo("/health/ready");
        assertThat(MDC.get(RequestLoggingFilter.MDC_METHOD)).isNull();
        assertThat(MDC.get(RequestLoggingFilter.MDC_PATH)).isNull();
    }

    @Test
    @DisplayName("logs a failed request and rethrows")
    void logsFailedRequest(CapturedOutput output) {
        FilterChain failing = (req, resp) -> {
            throw new IllegalStateException("handler blew up");
        };

        assertThatThrownBy(() -> filter.doFilter(
                        new MockHttpServletRequest("GET", "/api/users"), new MockHttpServletResponse(), failing))
                .isInstanceOf(IllegalStateException.class);

        assertThat(output).contains("Request failed: method=GET, path=/api/users");
        assertThat(output).contains("errorType=IllegalStateException");
        assertThat(MDC.get(RequestLoggingFilter.MDC_PATH)).isNull();
    }
}
