package com.mirrorswarm.mirror.stats;

/**
 * One counter: a backup channel and a topic title.
 */
public record CounterKey(String channelId, String topic) {
}
