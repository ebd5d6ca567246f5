package com.mirrorswarm.mirror.stats;

import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of which thread holds each counter.
 */
public final class CounterThreadIndex {

    private static final CounterThreadIndex EMPTY = new CounterThreadIndex(Map.of());

    private final Map<CounterKey, String> threads;

    public CounterThreadIndex(Map<CounterKey, String> threads) {
        this.threads = Map.copyOf(threads);
    }

    public static CounterThreadIndex empty() {
        return EMPTY;
    }

    public Optional<String> threadId(String channelId, String topic) {
        return Optional.ofNullable(threads.get(new CounterKey(channelId, topic)));
    }

    public Map<CounterKey, String> asMap() {
        return threads;
    }

    public int size() {
        return threads.size();
    }
}
