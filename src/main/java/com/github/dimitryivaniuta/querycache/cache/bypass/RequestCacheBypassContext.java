package com.github.dimitryivaniuta.querycache.cache.bypass;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

import java.util.Optional;

/**
 * Bypass flag stored as an attribute of the current request, so it dies with the request.
 * Outside a request the cache is never bypassed.
 */
@Component
public final class RequestCacheBypassContext implements CacheBypassContext {

    static final String ATTRIBUTE = RequestCacheBypassContext.class.getName() + ".reason";

    @Override
    public boolean shouldBypass() {
        return reason() != null;
    }

    @Override
    public String reason() {
        return currentRequest()
                .map(a -> (String) a.getAttribute(ATTRIBUTE, RequestAttributes.SCOPE_REQUEST))
                .orElse(null);
    }

    @Override
    public void enable(String reason) {
        String value = (reason == null || reason.isBlank()) ? "unspecified" : reason;
        currentRequest().ifPresent(a -> a.setAttribute(ATTRIBUTE, value, RequestAttributes.SCOPE_REQUEST));
    }

    static void enable(HttpServletRequest request, String reason) {
        request.setAttribute(ATTRIBUTE, reason);
    }

    @Override
    public void reset() {
        currentRequest().ifPresent(a -> a.removeAttribute(ATTRIBUTE, RequestAttributes.SCOPE_REQUEST));
    }

    private static Optional<RequestAttributes> currentRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes());
    }
}
