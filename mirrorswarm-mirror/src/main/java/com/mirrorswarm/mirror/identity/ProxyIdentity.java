package com.mirrorswarm.mirror.identity;

import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.OutboundMessage;
import com.mirrorswarm.channel.discord.DiscordTypes.Role;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One outbound account of the swarm, acting in the backup guild either for a
 * specific source user or as the default ("master") identity.
 * <p>
 * The channel and role directories are immutable snapshots of the backup
 * guild, replaced wholesale by {@link #refreshDirectories()}. The token is
 * held only by the {@link DiscordClient}.
 */
@Slf4j
public final class ProxyIdentity {

    /** Identity key of the default identity. */
    public static final String DEFAULT_KEY = "master";

    private final String key;
    private final boolean isDefault;
    private final DiscordClient client;
    private final String backupGuildId;

    private volatile User self;
    private volatile Map<String, Channel> channels = Map.of();
    private volatile Map<String, Role> roles = Map.of();

    private ProxyIdentity(String key, boolean isDefault, DiscordClient client, String backupGuildId) {
        this.key = key;
        this.isDefault = isDefault;
        this.client = client;
        this.backupGuildId = backupGuildId;
    }

    public static ProxyIdentity master(DiscordClient client, String backupGuildId) {
        return new ProxyIdentity(DEFAULT_KEY, true, client, backupGuildId);
    }

    /**
     * @param sourceUserId the source user this identity speaks for
     */
    public static ProxyIdentity dedicated(String sourceUserId, DiscordClient client, String backupGuildId) {
        if (DEFAULT_KEY.equals(sourceUserId)) {
            throw new IllegalArgumentException("'" + DEFAULT_KEY + "' is reserved for the default identity");
        }
        return new ProxyIdentity(sourceUserId, false, client, backupGuildId);
    }

    public String key() {
        return key;
    }

    public boolean isDefault() {
        return isDefault;
    }

    public DiscordClient client() {
        return client;
    }

    public String backupGuildId() {
        return backupGuildId;
    }

    /**
     * The account behind this identity, loaded on the first directory refresh.
     */
    public User self() {
        User current = self;
        if (current == null) {
            current = client.getCurrentUser();
            self = current;
        }
        return current;
    }

    public String mention() {
        return self().mention();
    }

    // =========================================================================
    // Directories
    // =========================================================================

    /**
     * Reload the account, text channels and roles of the backup guild. The
     * first entry wins when names collide.
     */
    public void refreshDirectories() {
        self = client.getCurrentUser();
        Map<String, Channel> nextChannels = new LinkedHashMap<>();
        for (Channel channel : client.listGuildChannels(backupGuildId)) {
            if (channel.getType() == DiscordTypes.GUILD_TEXT) {
                nextChannels.putIfAbsent(channel.getName(), channel);
            }
        }
        Map<String, Role> nextRoles = new LinkedHashMap<>();
        for (Role role : client.listRoles(backupGuildId)) {
            nextRoles.putIfAbsent(role.getName(), role);
        }
        channels = Collections.unmodifiableMap(nextChannels);
        roles = Collections.unmodifiableMap(nextRoles);
        log.debug("[{}] Directories refreshed: {} channels, {} roles", key, nextChannels.size(), nextRoles.size());
    }

    public Optional<Channel> channel(String name) {
        return Optional.ofNullable(channels.get(name));
    }

    public Optional<Role> role(String name) {
        return Optional.ofNullable(roles.get(name));
    }

    public Map<String, Channel> channels() {
        return channels;
    }

    public Map<String, Role> roles() {
        return roles;
    }

    /**
     * Backup channel with the given name. A miss triggers one directory
     * refresh, since another identity may have created the channel since.
     *
     * @throws IllegalStateException when the channel does not exist
     */
    public Channel requireChannel(String name) {
        Optional<Channel> found = channel(name);
        if (found.isEmpty()) {
            refreshDirectories();
            found = channel(name);
        }
        return found.orElseThrow(() -> new IllegalStateException(
                "Backup channel #" + name + " is not visible to identity " + key));
    }

    // =========================================================================
    // Capabilities
    // =========================================================================

    public Message send(String channelName, OutboundMessage message) {
        return client.sendMessage(requireChannel(channelName).getId(), message);
    }

    public Message edit(Message message, String content) {
        return client.editMessage(message.getChannelId(), message.getId(), content);
    }

    public void react(Message message, String emojiKey) {
        client.addReaction(message.getChannelId(), message.getId(), emojiKey);
    }

    @Override
    public String toString() {
        return "ProxyIdentity[" + key + (isDefault ? ", default" : "") + "]";
    }
}
