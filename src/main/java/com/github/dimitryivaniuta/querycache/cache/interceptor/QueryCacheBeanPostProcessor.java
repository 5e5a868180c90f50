package com.github.dimitryivaniuta.querycache.cache.interceptor;

import lombok.RequiredArgsConstructor;
import org.aopalliance.intercept.MethodInterceptor;
import org.springframework.aop.framework.Advised;
import org.springframework.aop.framework.ProxyFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.ClassUtils;

import java.lang.reflect.Method;

/**
 * Wraps beans that use {@link QueryCached} in a runtime proxy (ProxyFactory) carrying
 * {@link QueryCacheMethodInterceptor}.
 *
 * <p>The interceptor is looked up lazily on first call so this post-processor does not
 * force early creation of the cache store and meter registry.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
public final class QueryCacheBeanPostProcessor implements BeanPostProcessor {

    private final ObjectProvider<QueryCacheMethodInterceptor> interceptor;

    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) throws BeansException {
        Class<?> targetClass = ClassUtils.getUserClass(bean);
        if (isExcluded(targetClass)) return bean;
        if (!needsProxy(targetClass)) return bean;

        MethodInterceptor advice = inv -> interceptor.getObject().invoke(inv);

        // If already proxied (e.g., @Transactional), add advice to existing proxy
        if (bean instanceof Advised advised) {
            advised.addAdvice(0, advice);
            return bean;
        }

        ProxyFactory pf = new ProxyFactory(bean);
        // allow class-based proxying for beans without interfaces
        pf.setProxyTargetClass(true);
        pf.addAdvice(advice);
        return pf.getProxy();
    }

    private static boolean needsProxy(Class<?> targetClass) {
        if (AnnotatedElementUtils.hasAnnotation(targetClass, QueryCached.class)) return true;
        for (Method m : targetClass.getMethods()) {
            if (AnnotatedElementUtils.hasAnnotation(m, QueryCached.class)) return true;
        }
        return false;
    }

    private static boolean isExcluded(Class<?> targetClass) {
        String name = targetClass.getName();
        return name.startsWith("org.springframework.") || name.startsWith("jakarta.") || name.startsWith("java.");
    }
}
