package com.mirrorswarm.mirror.reaction;

import com.mirrorswarm.channel.discord.DiscordApi;
import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordEmojis;
import com.mirrorswarm.channel.discord.DiscordTypes.Emoji;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.OutboundMessage;
import com.mirrorswarm.channel.discord.DiscordTypes.Reaction;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import com.mirrorswarm.channel.discord.MessageSplitter;
import com.mirrorswarm.mirror.identity.IdentityRouter;
import com.mirrorswarm.mirror.identity.ProxyIdentity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Copies the reactions of a source message onto its backup, each reaction
 * made by the identity routed for the reacting user.
 * <p>
 * Every (emoji, identity) pair is attempted once per message. When the
 * platform rejects an emoji, the identity reacts with the placeholder instead
 * (once per identity per message) and the miss is tallied. A non-empty tally
 * is appended to the backup message as an "Unknown Reactions" footnote.
 * Reactions are processed sequentially.
 */
@Slf4j
public class ReactionReplicator {

    static final int USER_PAGE_SIZE = 100;

    private final IdentityRouter router;
    private final DiscordClient source;
    private final Emoji placeholder;

    /**
     * @param source      client that can read the source channel
     * @param placeholder emoji used when the original cannot be applied
     */
    public ReactionReplicator(IdentityRouter router, DiscordClient source, Emoji placeholder) {
        this.router = router;
        this.source = source;
        this.placeholder = placeholder;
    }

    /**
     * @param sourceMessage message carrying the reactions
     * @param backup        the already-sent backup message to react on
     * @param sender        identity that sent {@code backup}, used for an
     *                      overflow footnote
     * @return what could not be attributed
     */
    public UnknownReactionTally replicate(Message sourceMessage, Message backup, ProxyIdentity sender) {
        UnknownReactionTally tally = new UnknownReactionTally();
        if (sourceMessage.getReactions() == null || sourceMessage.getReactions().isEmpty()) {
            return tally;
        }
        Set<String> attempted = new HashSet<>();
        Set<String> placeholderUsed = new HashSet<>();
        String placeholderKey = DiscordEmojis.reactionKey(placeholder);

        for (Reaction reaction : sourceMessage.getReactions()) {
            Emoji emoji = reaction.getEmoji();
            String emojiKey = DiscordEmojis.reactionKey(emoji);
            for (User user : reactingUsers(sourceMessage, emojiKey)) {
                ProxyIdentity identity = router.route(user.getId());
                if (!attempted.add(emojiKey + "\u0000" + identity.key())) {
                    continue;
                }
                try {
                    identity.react(backup, emojiKey);
                    if (identity.isDefault()) {
                        tally.recordUnknown(emoji);
                    }
                } catch (DiscordApi.ApiError e) {
                    log.debug("[{}] Cannot react with {} on {}: {}", identity.key(), emojiKey,
                            backup.getId(), e.getMessage());
                    if (placeholderUsed.add(identity.key())) {
                        reactWithPlaceholder(identity, backup, placeholderKey);
                    }
                    if (identity.isDefault()) {
                        tally.recordUnknown(emoji);
                    } else {
                        tally.recordFallback(emoji, identity.mention());
                    }
                }
            }
        }

        if (!tally.isEmpty()) {
            appendFootnote(backup, sender, tally.renderFootnote());
        }
        return tally;
    }

    private void reactWithPlaceholder(ProxyIdentity identity, Message backup, String placeholderKey) {
        try {
            identity.react(backup, placeholderKey);
        } catch (DiscordApi.ApiError e) {
            log.warn("[{}] Placeholder reaction failed on {}: {}", identity.key(), backup.getId(), e.getMessage());
        }
    }

    private void appendFootnote(Message backup, ProxyIdentity sender, String footnote) {
        String content = backup.getContent() != null ? backup.getContent() : "";
        String edited = content.isEmpty() ? footnote : content + "\n\n" + footnote;
        if (edited.length() <= MessageSplitter.TEXT_LIMIT) {
            sender.edit(backup, edited);
        } else {
            for (String part : MessageSplitter.split(footnote)) {
                sender.client().sendMessage(backup.getChannelId(), OutboundMessage.silent(part));
            }
        }
    }

    /** All users who applied {@code emojiKey}, following the id cursor. */
    private List<User> reactingUsers(Message sourceMessage, String emojiKey) {
        List<User> users = new ArrayList<>();
        String after = null;
        while (true) {
            List<User> page = source.listReactionUsers(sourceMessage.getChannelId(), sourceMessage.getId(),
                    emojiKey, after, USER_PAGE_SIZE);
            users.addAll(page);
            if (page.size() < USER_PAGE_SIZE) {
                return users;
            }
            after = page.get(page.size() - 1).getId();
        }
    }
}
