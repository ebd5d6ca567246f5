package com.mirrorswarm.mirror.stats;

import com.mirrorswarm.channel.discord.DiscordTypes.Message;

import java.util.function.Function;

/**
 * A counted statistic: the thread title prefix and the classifier giving the
 * increment a message contributes, or null for none.
 */
public record StatTopic(String title, Function<Message, Integer> classifier) {

    public StatTopic {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Topic title is required");
        }
        if (title.contains(CounterTitle.SEPARATOR)) {
            throw new IllegalArgumentException("Topic title must not contain '" + CounterTitle.SEPARATOR + "'");
        }
    }

    public Integer classify(Message message) {
        return classifier.apply(message);
    }
}
