package com.mirrorswarm.mirror.stats;

import java.util.List;

/**
 * Built-in counters.
 */
public final class StatTopics {

    private StatTopics() {
    }

    public static final StatTopic MESSAGES_SENT = new StatTopic("Total Messages Sent", m -> 1);

    public static final StatTopic ATTACHMENTS_SENT = new StatTopic("Total Attachments Sent",
            m -> m.getAttachments() != null && !m.getAttachments().isEmpty() ? m.getAttachments().size() : null);

    public static List<StatTopic> defaults() {
        return List.of(MESSAGES_SENT, ATTACHMENTS_SENT);
    }
}
