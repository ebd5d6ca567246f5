package com.mirrorswarm.mirror.replication;

import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Replays a source channel's history after a given message, oldest first,
 * through the live replication path.
 */
@Slf4j
public class BatchImportController {

    static final int PAGE_SIZE = 100;

    private final DiscordClient source;
    private final MessageReplicator replicator;

    public BatchImportController(DiscordClient source, MessageReplicator replicator) {
        this.source = source;
        this.replicator = replicator;
    }

    /**
     * Replicate every message after {@code startMessageId} (exclusive) up to
     * the newest one. The first failure aborts the import.
     *
     * @return number of messages replicated
     */
    public int importAfter(Channel sourceChannel, String startMessageId) {
        log.info("Batch import of #{} after {} started", sourceChannel.getName(), startMessageId);
        int count = 0;
        String cursor = startMessageId;
        while (true) {
            List<Message> page = source.fetchMessagesAfter(sourceChannel.getId(), cursor, PAGE_SIZE);
            for (Message message : page) {
                if (MessageReplicator.isReplicable(message)) {
                    if (replicator.replicate(message, sourceChannel.getName(), true).delivered()) {
                        count++;
                    }
                }
                cursor = message.getId();
            }
            if (page.size() < PAGE_SIZE) {
                break;
            }
        }
        log.info("Batch import of #{} finished: {} messages", sourceChannel.getName(), count);
        return count;
    }
}
