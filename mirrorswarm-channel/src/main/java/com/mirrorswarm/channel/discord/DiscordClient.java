package com.mirrorswarm.channel.discord;

import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Emoji;
import com.mirrorswarm.channel.discord.DiscordTypes.Member;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.OutboundMessage;
import com.mirrorswarm.channel.discord.DiscordTypes.Role;
import com.mirrorswarm.channel.discord.DiscordTypes.User;

import java.util.List;

/**
 * The platform operations one identity can perform, authenticated as that
 * identity.
 * <p>
 * Calls block until the platform answered. Failures surface as
 * {@link DiscordApi.ApiError}; rate limits are retried inside the
 * implementation and never reach callers unless retries are exhausted.
 */
public interface DiscordClient {

    /** The user this client is authenticated as. */
    User getCurrentUser();

    // --- Guild structure ---

    List<Channel> listGuildChannels(String guildId);

    Channel createTextChannel(String guildId, String name);

    Channel getChannel(String channelId);

    List<Role> listRoles(String guildId);

    Role createRole(String guildId, String name, int color);

    List<Emoji> listEmojis(String guildId);

    /**
     * Upload a custom emoji.
     *
     * @param image PNG/GIF bytes
     */
    Emoji createEmoji(String guildId, String name, byte[] image, String mimeType);

    // --- Members and profile ---

    Member getMember(String guildId, String userId);

    void addMemberRole(String guildId, String userId, String roleId);

    /**
     * Change this identity's account username and avatar. Null arguments are
     * left unchanged.
     */
    void modifyCurrentUser(String username, byte[] avatar, String mimeType);

    /** Change this identity's nickname in a guild; null clears it. */
    void modifyCurrentMemberNick(String guildId, String nick);

    // --- Messages ---

    Message sendMessage(String channelId, OutboundMessage message);

    Message editMessage(String channelId, String messageId, String content);

    /**
     * @throws DiscordApi.ApiError with status 404 when the message does not
     *                             exist in that channel
     */
    Message fetchMessage(String channelId, String messageId);

    /**
     * Messages strictly after {@code afterId}, oldest first.
     */
    List<Message> fetchMessagesAfter(String channelId, String afterId, int limit);

    /**
     * The most recent messages of a channel, newest first.
     */
    List<Message> fetchRecentMessages(String channelId, int limit);

    void deleteMessage(String channelId, String messageId);

    // --- Reactions ---

    /**
     * @param emojiKey {@code name:id} for custom emoji, the raw character for
     *                 unicode emoji; see {@link DiscordEmojis#reactionKey}
     */
    void addReaction(String channelId, String messageId, String emojiKey);

    /**
     * One page of users who reacted with an emoji, ordered by user id.
     *
     * @param afterUserId paging cursor, null for the first page
     */
    List<User> listReactionUsers(String channelId, String messageId, String emojiKey,
            String afterUserId, int limit);

    // --- Threads ---

    List<Channel> listActiveThreads(String guildId);

    List<Channel> listPublicArchivedThreads(String channelId);

    Channel createThread(String channelId, String name, int autoArchiveMinutes);

    /** Rename a thread, unarchiving it if the platform archived it. */
    Channel renameThread(String threadId, String name);

    // --- Files ---

    /** Fetch raw bytes from a CDN URL. */
    byte[] download(String url);
}
