package com.mirrorswarm.mirror.replication;

import com.mirrorswarm.channel.discord.DiscordTypes;
import com.mirrorswarm.channel.discord.DiscordTypes.Attachment;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.OutboundMessage;
import com.mirrorswarm.channel.discord.MessageSplitter;
import com.mirrorswarm.mirror.identity.IdentityRouter;
import com.mirrorswarm.mirror.identity.ProxyIdentity;
import com.mirrorswarm.mirror.reaction.ReactionReplicator;
import com.mirrorswarm.mirror.reaction.UnknownReactionTally;
import com.mirrorswarm.mirror.stats.ThreadCounterStore;
import com.mirrorswarm.mirror.transform.ContentTransformer;
import com.mirrorswarm.mirror.transform.MentionDirectory;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * The replication path shared by live traffic and batch import: route the
 * author, transform the text, send, replicate reactions, count.
 * <p>
 * Each call completes the whole path for one message before returning, so
 * callers that replicate sequentially keep source order in the backup.
 */
@Slf4j
public class MessageReplicator {

    private final IdentityRouter router;
    private final ContentTransformer transformer;
    private final ReactionReplicator reactions;
    private final Supplier<MentionDirectory> mentions;
    @Nullable
    private final ThreadCounterStore counters;

    /**
     * @param mentions current mention tables, read once per message
     * @param counters counter store fed with every replicated message, or null
     *                 when statistics are disabled
     */
    public MessageReplicator(IdentityRouter router, ContentTransformer transformer, ReactionReplicator reactions,
            Supplier<MentionDirectory> mentions, @Nullable ThreadCounterStore counters) {
        this.router = router;
        this.transformer = transformer;
        this.reactions = reactions;
        this.mentions = mentions;
        this.counters = counters;
    }

    /**
     * Whether a message is user content; system messages (joins, pins, thread
     * announcements) are not replicated.
     */
    public static boolean isReplicable(Message message) {
        return message.getType() == DiscordTypes.MESSAGE_DEFAULT || message.getType() == DiscordTypes.MESSAGE_REPLY;
    }

    /**
     * Replicate {@code source} into the backup channel named {@code channelName}.
     *
     * @param batchImport historical replay: timestamp prefix and every embed
     */
    public ReplicationResult replicate(Message source, String channelName, boolean batchImport) {
        String authorId = source.getAuthor() != null ? source.getAuthor().getId() : null;
        ProxyIdentity identity = router.route(authorId);
        String raw = appendAttachments(source.getContent(), source.getAttachments());
        List<Map<String, Object>> embeds = forwardedEmbeds(source, batchImport);
        if ((raw == null || raw.isBlank()) && embeds.isEmpty()) {
            // stickers, polls and the like: nothing the backup can show, nothing counted
            log.debug("Message {} in #{} has no forwardable content, skipped", source.getId(), channelName);
            return new ReplicationResult(identity, List.of(), new UnknownReactionTally());
        }
        Channel backupChannel = identity.requireChannel(channelName);
        String text = transformer.transform(raw, batchImport, source.getTimestamp(),
                source.getAuthor(), identity.isDefault(), mentions.get());

        List<String> parts = new ArrayList<>(MessageSplitter.split(text));
        if (parts.isEmpty() && !embeds.isEmpty()) {
            parts.add(null);
        }
        List<Message> sent = new ArrayList<>(parts.size());
        for (int i = 0; i < parts.size(); i++) {
            OutboundMessage outbound = OutboundMessage.silent(parts.get(i));
            if (i == parts.size() - 1 && !embeds.isEmpty()) {
                outbound.setEmbeds(embeds);
            }
            sent.add(identity.send(channelName, outbound));
        }

        UnknownReactionTally tally = reactions.replicate(source, sent.get(sent.size() - 1), identity);
        log.debug("[{}] Replicated {} into #{} as {} message(s)", identity.key(), source.getId(),
                channelName, sent.size());
        if (counters != null) {
            counters.check(backupChannel.getId(), source);
        }
        return new ReplicationResult(identity, sent, tally);
    }

    private static String appendAttachments(String text, List<Attachment> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text != null ? text : "");
        for (Attachment attachment : attachments) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(attachment.getUrl());
        }
        return sb.toString();
    }

    /**
     * Live messages carry only rich embeds, link previews are rebuilt by the
     * platform from the URL. Batch imports forward every embed.
     */
    static List<Map<String, Object>> forwardedEmbeds(Message source, boolean batchImport) {
        if (source.getEmbeds() == null || source.getEmbeds().isEmpty()) {
            return List.of();
        }
        if (batchImport) {
            return List.copyOf(source.getEmbeds());
        }
        return source.getEmbeds().stream()
                .filter(embed -> "rich".equals(DiscordTypes.embedType(embed)))
                .toList();
    }
}
