package com.mirrorswarm.channel.discord;

import com.mirrorswarm.channel.discord.DiscordTypes.Member;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.User;

/**
 * Receives gateway dispatches. All callbacks of one {@link DiscordGateway}
 * run on that gateway's dispatch thread, one at a time, in arrival order.
 */
public interface GatewayListener {

    default void onReady(User self) {
    }

    default void onMessageCreate(Message message) {
    }

    default void onGuildMemberUpdate(Member member) {
    }
}
