package com.github.dimitryivaniuta.querycache.cache.interceptor;

import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;

import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Locale;

/**
 * Builds logical cache keys from a method call.
 *
 * <pre>
 *   search(EmployeeQuery[page=1, size=10, lastName=" Smith "])  ->  Employees:page=1:size=10:lastname=smith
 * </pre>
 *
 * Record arguments are flattened into their components; null and blank values are skipped;
 * segment names and string values are trimmed and lowercased.
 */
public final class QueryKeySupport {
    private QueryKeySupport() {}

    private static final ParameterNameDiscoverer NAMES = new DefaultParameterNameDiscoverer();

    public static String buildKey(String endpoint, Method method, Object[] args) {
        StringBuilder sb = new StringBuilder(endpoint);
        if (args == null || args.length == 0) {
            return sb.toString();
        }

        String[] names = NAMES.getParameterNames(method);
        for (int i = 0; i < args.length; i++) {
            String name = (names != null && i < names.length) ? names[i] : "arg" + i;
            append(sb, name, args[i]);
        }
        return sb.toString();
    }

    private static void append(StringBuilder sb, String name, Object value) {
        if (value == null) return;

        if (value.getClass().isRecord()) {
            for (RecordComponent c : value.getClass().getRecordComponents()) {
                append(sb, c.getName(), read(c, value));
            }
            return;
        }

        String text = String.valueOf(value).trim();
        if (text.isEmpty()) return;

        sb.append(':')
                .append(name.toLowerCase(Locale.ROOT))
                .append('=')
                .append(value instanceof CharSequence ? text.toLowerCase(Locale.ROOT) : text);
    }

    private static Object read(RecordComponent c, Object record) {
        try {
            Method accessor = c.getAccessor();
            accessor.trySetAccessible();
            return accessor.invoke(record);
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Unable to read record component " + c.getName(), e);
        }
    }
}
