package com.mirrorswarm.mirror.console;

import com.mirrorswarm.channel.discord.DiscordApi;
import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.Snowflakes;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Finds a message by id across the monitored source channels.
 * Errors are not reported here; the interpreter reports them.
 */
@Slf4j
public class MessageLocator {

    private final DiscordClient source;
    private final List<String> monitoredChannelIds;

    public MessageLocator(DiscordClient source, List<String> monitoredChannelIds) {
        this.source = source;
        this.monitoredChannelIds = List.copyOf(monitoredChannelIds);
    }

    /**
     * @throws CommandException FORMAT when {@code rawId} is not all digits
     *                          (checked before any lookup), NOT_FOUND when no
     *                          monitored channel holds the message
     */
    public LocatedMessage locate(String rawId) {
        String id = rawId != null ? rawId.trim() : "";
        if (!Snowflakes.isSnowflake(id)) {
            throw new CommandException(CommandException.Kind.FORMAT,
                    "'" + id + "' is not a message id (digits only)");
        }
        for (String channelId : monitoredChannelIds) {
            try {
                Message message = source.fetchMessage(channelId, id);
                Channel channel = source.getChannel(channelId);
                return new LocatedMessage(channel, message);
            } catch (DiscordApi.ApiError e) {
                if (!e.isNotFound()) {
                    throw new CommandException(CommandException.Kind.FAILED,
                            "Lookup of " + id + " in channel " + channelId + " failed: " + e.getMessage(), e);
                }
                log.debug("Message {} not in channel {}", id, channelId);
            }
        }
        throw new CommandException(CommandException.Kind.NOT_FOUND,
                "Message " + id + " was not found in any monitored channel");
    }
}
