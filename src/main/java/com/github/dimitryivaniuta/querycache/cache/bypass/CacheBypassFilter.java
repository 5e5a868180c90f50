package com.github.dimitryivaniuta.querycache.cache.bypass;

import com.github.dimitryivaniuta.querycache.cache.CachingProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Turns on {@link RequestCacheBypassContext} for requests carrying the configured debug header.
 *
 * <p>The header is honoured only when {@code caching.bypass.enabled} is set and its value
 * matches {@code caching.bypass.token}; anything else is ignored silently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Order(Ordered.HIGHEST_PRECEDENCE + 20) // after CorrelationIdFilter
public class CacheBypassFilter extends OncePerRequestFilter {

    private final CachingProperties properties;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        CachingProperties.Bypass bypass = properties.getBypass();
        if (bypass != null && bypass.isEnabled() && authorized(request, bypass)) {
            // request attribute, not RequestContextHolder: this filter may run before it is populated
            RequestCacheBypassContext.enable(request, "header:" + bypass.getHeaderName());
            log.debug("Cache bypass enabled for {} {}", request.getMethod(), request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }

    private static boolean authorized(HttpServletRequest req, CachingProperties.Bypass bypass) {
        String token = bypass.getToken();
        if (token == null || token.isBlank() || bypass.getHeaderName() == null) return false;

        String v = req.getHeader(bypass.getHeaderName());
        if (v == null || v.isBlank()) return false;

        return MessageDigest.isEqual(
                v.trim().getBytes(StandardCharsets.UTF_8),
                token.getBytes(StandardCharsets.UTF_8));
    }
}
