package com.mirrorswarm.mirror.replication;

import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.mirror.identity.ProxyIdentity;
import com.mirrorswarm.mirror.reaction.UnknownReactionTally;

import java.util.List;

/**
 * Outcome of replicating one source message.
 *
 * @param sent backup messages in send order, empty when there was nothing to send
 */
public record ReplicationResult(ProxyIdentity identity, List<Message> sent, UnknownReactionTally unknownReactions) {

    public boolean delivered() {
        return !sent.isEmpty();
    }

    /** The message reactions were applied to. */
    public Message last() {
        return sent.isEmpty() ? null : sent.get(sent.size() - 1);
    }
}
