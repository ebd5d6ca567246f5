package com.mirrorswarm.app.config;

import com.mirrorswarm.channel.discord.DiscordGateway;
import com.mirrorswarm.common.infra.DailyScheduler;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;

import java.util.List;

/**
 * Owns the running connections and the daily counter flush, and closes them
 * when the application stops.
 */
@Slf4j
public class SwarmLifecycle implements DisposableBean {

    private final List<DiscordGateway> gateways;
    @Nullable
    private final DailyScheduler flushScheduler;

    public SwarmLifecycle(List<DiscordGateway> gateways, @Nullable DailyScheduler flushScheduler) {
        this.gateways = List.copyOf(gateways);
        this.flushScheduler = flushScheduler;
    }

    /** Connect every gateway and start the flush schedule. */
    public void start() {
        gateways.forEach(DiscordGateway::connect);
        if (flushScheduler != null) {
            flushScheduler.start();
        }
    }

    public List<DiscordGateway> gateways() {
        return gateways;
    }

    @Override
    public void destroy() {
        if (flushScheduler != null) {
            flushScheduler.close();
        }
        for (DiscordGateway gateway : gateways) {
            try {
                gateway.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close gateway: {}", e.getMessage());
            }
        }
        log.info("MirrorSwarm stopped");
    }
}
