package com.mirrorswarm.app.config;

import com.mirrorswarm.channel.discord.DiscordTypes.Member;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import com.mirrorswarm.channel.discord.GatewayListener;
import lombok.extern.slf4j.Slf4j;

/**
 * Listener handed to the master gateway before the engine exists. The engine
 * needs the gateway's dispatch thread, the gateway needs a listener; the relay
 * breaks the cycle and drops events until {@link #bind} is called.
 */
@Slf4j
public class GatewayRelay implements GatewayListener {

    private volatile GatewayListener target;

    public void bind(GatewayListener target) {
        this.target = target;
    }

    @Override
    public void onReady(User self) {
        GatewayListener current = target;
        if (current != null) {
            current.onReady(self);
        } else {
            log.info("Gateway ready as {} before the engine was bound", self.getUsername());
        }
    }

    @Override
    public void onMessageCreate(Message message) {
        GatewayListener current = target;
        if (current != null) {
            current.onMessageCreate(message);
        }
    }

    @Override
    public void onGuildMemberUpdate(Member member) {
        GatewayListener current = target;
        if (current != null) {
            current.onGuildMemberUpdate(member);
        }
    }
}
