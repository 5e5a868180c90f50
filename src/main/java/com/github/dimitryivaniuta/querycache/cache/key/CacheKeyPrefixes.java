package com.github.dimitryivaniuta.querycache.cache.key;

/**
 * Derives the aggregate prefix of a logical key from its shape.
 *
 * <p>The prefix is everything before the first colon whose segment carries a filter
 * ({@code name=value}); a key without filter segments is its own prefix:
 *
 * <pre>
 *   Employees:page=1:size=10:last=smith  -> Employees
 *   Employees:GetAll:page=1              -> Employees:GetAll
 *   Dashboard:Metrics                    -> Dashboard:Metrics
 * </pre>
 */
public final class CacheKeyPrefixes {
    private CacheKeyPrefixes() {}

    /** Returns "" for blank keys: nothing to track. */
    public static String extractPrefix(String logicalKey) {
        if (logicalKey == null || logicalKey.isBlank()) {
            return "";
        }

        int searchFrom = 0;
        while (searchFrom < logicalKey.length()) {
            int colon = logicalKey.indexOf(':', searchFrom);
            if (colon < 0) break;

            int nextColon = logicalKey.indexOf(':', colon + 1);
            int segmentEnd = nextColon < 0 ? logicalKey.length() : nextColon;
            int equals = logicalKey.indexOf('=', colon + 1);
            if (equals >= 0 && equals < segmentEnd) {
                return logicalKey.substring(0, colon);
            }

            searchFrom = colon + 1;
        }
        return logicalKey;
    }
}
