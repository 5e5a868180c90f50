package com.github.dimitryivaniuta.querycache.web;

import com.github.dimitryivaniuta.querycache.cache.CachingProperties;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter(new CachingProperties());

    private MockHttpServletResponse run(MockHttpServletRequest req, AtomicReference<String> seenInChain) throws Exception {
        MockHttpServletResponse res = new MockHttpServletResponse();
        filter.doFilter(req, res, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest r, HttpServletResponse s) {
                seenInChain.set(MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY));
            }
        }));
        return res;
    }

    @Test
    void suppliedIdShouldBeEchoedAndVisibleDownstream() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/employees");
        req.addHeader(RequestContextKeys.CORRELATION_ID_HEADER, "corr-123");
        AtomicReference<String> seen = new AtomicReference<>();

        MockHttpServletResponse res = run(req, seen);

        assertThat(res.getHeader(RequestContextKeys.CORRELATION_ID_HEADER)).isEqualTo("corr-123");
        assertThat(seen.get()).isEqualTo("corr-123");
        assertThat(req.getAttribute(RequestContextKeys.CORRELATION_ID_ATTRIBUTE)).isEqualTo("corr-123");
        assertThat(MDC.get(RequestContextKeys.CORRELATION_ID_MDC_KEY)).isNull();
    }

    @Test
    void idThatCouldForgeLogLinesShouldBeReplaced() throws Exception {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", "/api/employees");
        req.addHeader(RequestContextKeys.CORRELATION_ID_HEADER, "abc\nINFO fake entry");

        MockHttpServletResponse res = run(req, new AtomicReference<>());

        String issued = res.getHeader(RequestContextKeys.CORRELATION_ID_HEADER);
        assertThat(issued).doesNotContain("fake");
        assertThatCode(() -> UUID.fromString(issued)).doesNotThrowAnyException();
    }

    @Test
    void resolveShouldTrimAndCapLength() {
        assertThat(CorrelationIdFilter.resolve("  trace-1  ")).isEqualTo("trace-1");
        assertThat(CorrelationIdFilter.resolve("x".repeat(128))).hasSize(128);
        assertThat(CorrelationIdFilter.resolve("x".repeat(129))).hasSize(36);
        assertThat(CorrelationIdFilter.resolve(null)).hasSize(36);
        assertThat(CorrelationIdFilter.resolve("   ")).hasSize(36);
    }
}
