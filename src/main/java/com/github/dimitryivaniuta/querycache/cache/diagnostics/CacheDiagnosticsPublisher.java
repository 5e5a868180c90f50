package com.github.dimitryivaniuta.querycache.cache.diagnostics;

import java.time.Duration;

/**
 * Receives hit/miss signals for a logical key. Implementations decide how the key is shown.
 */
public interface CacheDiagnosticsPublisher {

    void reportHit(String logicalKey, Duration remainingTtl);

    void reportMiss(String logicalKey);
}
