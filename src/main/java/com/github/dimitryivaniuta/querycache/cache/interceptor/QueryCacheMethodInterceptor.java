package com.github.dimitryivaniuta.querycache.cache.interceptor;

import com.github.dimitryivaniuta.querycache.cache.CacheEntryOptionsFactory;
import com.github.dimitryivaniuta.querycache.cache.diagnostics.CacheDiagnosticsPublisher;
import com.github.dimitryivaniuta.querycache.cache.diagnostics.QueryCacheMetrics;
import com.github.dimitryivaniuta.querycache.cache.provider.CacheProvider;
import com.github.dimitryivaniuta.querycache.cache.provider.CachedValue;
import lombok.RequiredArgsConstructor;
import org.aopalliance.intercept.MethodInterceptor;
import org.aopalliance.intercept.MethodInvocation;
import org.springframework.aop.support.AopUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;

import java.lang.reflect.Method;
import java.util.Optional;

/**
 * Get-or-compute around {@link QueryCached} methods: lookup, on miss proceed and store.
 * Null results and void methods are never cached.
 */
@RequiredArgsConstructor
public class QueryCacheMethodInterceptor implements MethodInterceptor {

    private final CacheProvider cacheProvider;
    private final CacheEntryOptionsFactory entryOptionsFactory;
    private final CacheDiagnosticsPublisher diagnostics;
    private final QueryCacheMetrics metrics;

    @Override
    public Object invoke(MethodInvocation inv) throws Throwable {
        Method method = inv.getMethod();
        QueryCached ann = find(resolveTargetClass(inv), method);
        if (ann == null || !ann.enabled()) return inv.proceed();
        if (method.getReturnType() == void.class) return inv.proceed();

        String endpoint = ann.endpoint();
        String key = QueryKeySupport.buildKey(endpoint, method, inv.getArguments());

        Optional<CachedValue<Object>> hit = cacheProvider.lookup(key, method.getGenericReturnType());
        if (hit.isPresent()) {
            diagnostics.reportHit(key, hit.get().remainingTtl());
            return hit.get().value();
        }

        long startNs = System.nanoTime();
        Object result = inv.proceed();
        metrics.recordCompute(endpoint, System.nanoTime() - startNs);

        diagnostics.reportMiss(key);
        if (result != null) {
            cacheProvider.set(key, result, entryOptionsFactory.create(endpoint));
        }
        return result;
    }

    private static Class<?> resolveTargetClass(MethodInvocation inv) {
        Object target = inv.getThis();
        Class<?> c = (target != null) ? AopUtils.getTargetClass(target) : null;
        return (c != null) ? c : inv.getMethod().getDeclaringClass();
    }

    private static QueryCached find(Class<?> cls, Method m) {
        QueryCached onMethod = AnnotatedElementUtils.findMergedAnnotation(m, QueryCached.class);
        return onMethod != null ? onMethod : AnnotatedElementUtils.findMergedAnnotation(cls, QueryCached.class);
    }
}
