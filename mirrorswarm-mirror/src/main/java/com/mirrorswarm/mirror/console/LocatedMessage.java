package com.mirrorswarm.mirror.console;

import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;

/**
 * A source message and the monitored channel it was found in.
 */
public record LocatedMessage(Channel channel, Message message) {
}
