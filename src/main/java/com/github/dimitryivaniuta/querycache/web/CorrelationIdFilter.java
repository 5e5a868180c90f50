package com.github.dimitryivaniuta.querycache.web;

import com.github.dimitryivaniuta.querycache.cache.CachingProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Puts a correlation id in the MDC for the whole request, so cache hit/miss and
 * invalidation log lines can be tied to the call that caused them.
 *
 * <p>A caller-supplied id is kept only if it is a short token of safe characters;
 * anything else is replaced, since the id is echoed into every log line.
 * When the request completes, one DEBUG line records its cache outcome as reported
 * by the diagnostics status header.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

    private final CachingProperties properties;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String corr = resolve(request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER));

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, corr);
        request.setAttribute(RequestContextKeys.CORRELATION_ID_ATTRIBUTE, corr);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, corr);

        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            if (log.isDebugEnabled()) {
                log.debug("{} {} -> {} cache={} in {}ms",
                        request.getMethod(), request.getRequestURI(), response.getStatus(),
                        cacheOutcome(response), (System.nanoTime() - start) / 1_000_000);
            }
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }

    static String resolve(String supplied) {
        if (supplied != null) {
            String trimmed = supplied.trim();
            if (SAFE_ID.matcher(trimmed).matches()) return trimmed;
        }
        return UUID.randomUUID().toString();
    }

    private String cacheOutcome(HttpServletResponse response) {
        String header = properties.getDiagnostics().getHeaderName();
        String status = header == null ? null : response.getHeader(header);
        return status == null ? "-" : status;
    }
}
