package com.mirrorswarm.mirror;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;

/**
 * Remembers recently handled message ids so a gateway redelivery after a
 * reconnect is not replicated twice.
 */
public class ReplayGuard {

    public static final Duration DEFAULT_WINDOW = Duration.ofHours(1);

    private final Cache<String, Boolean> seen;

    public ReplayGuard() {
        this(DEFAULT_WINDOW, 50_000);
    }

    public ReplayGuard(Duration window, long maximumSize) {
        this.seen = Caffeine.newBuilder()
                .expireAfterWrite(window)
                .maximumSize(maximumSize)
                .build();
    }

    /**
     * @return true the first time an id is offered within the window
     */
    public boolean firstSighting(String messageId) {
        return seen.asMap().putIfAbsent(messageId, Boolean.TRUE) == null;
    }
}
