package com.mirrorswarm.app.config;

import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordGateway;
import com.mirrorswarm.channel.discord.DiscordRestClient;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import com.mirrorswarm.channel.discord.GatewayListener;
import com.mirrorswarm.common.config.ConfigService;
import com.mirrorswarm.common.config.MirrorSwarmConfig;
import com.mirrorswarm.common.infra.DailyScheduler;
import com.mirrorswarm.common.logging.TokenRedact;
import com.mirrorswarm.mirror.MirrorSwarm;
import com.mirrorswarm.mirror.identity.IdentityRouter;
import com.mirrorswarm.mirror.identity.ProxyIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Spring configuration wiring the swarm: config, one REST client per
 * identity, the master gateway feeding the engine, presence gateways for the
 * dedicated identities, and the daily counter flush.
 */
@Slf4j
@Configuration
public class SwarmBeanConfig {

    @Bean
    public ConfigService configService(@Value("${mirrorswarm.config}") String configPath) {
        return new ConfigService(Path.of(configPath));
    }

    /**
     * The validated configuration. Also applies the configured log level.
     */
    @Bean
    public MirrorSwarmConfig mirrorSwarmConfig(ConfigService configService, LoggingSystem loggingSystem) {
        MirrorSwarmConfig config = validated(configService.loadConfig());
        loggingSystem.setLogLevel("com.mirrorswarm", parseLevel(config.getLogging().getLevel()));
        return config;
    }

    @Bean
    public IdentityRouter identityRouter(MirrorSwarmConfig config) {
        String apiBaseUrl = config.getDiscord().getApiBaseUrl();
        return buildRouter(config, token -> new DiscordRestClient(token, apiBaseUrl));
    }

    @Bean
    public GatewayRelay gatewayRelay() {
        return new GatewayRelay();
    }

    @Bean
    public DiscordGateway masterGateway(MirrorSwarmConfig config, GatewayRelay gatewayRelay) {
        return new DiscordGateway(ProxyIdentity.DEFAULT_KEY, config.getMasterToken(),
                config.getDiscord().getGatewayUrl(), gatewayRelay);
    }

    /**
     * The engine, started against the backup guild. Its console continuations
     * run on the master gateway's dispatch thread.
     */
    @Bean
    public MirrorSwarm mirrorSwarm(MirrorSwarmConfig config, IdentityRouter identityRouter,
            DiscordGateway masterGateway, GatewayRelay gatewayRelay) {
        MirrorSwarm swarm = new MirrorSwarm(config, identityRouter, masterGateway.dispatchExecutor());
        swarm.start();
        gatewayRelay.bind(swarm);
        return swarm;
    }

    @Bean
    public SwarmLifecycle swarmLifecycle(MirrorSwarmConfig config, IdentityRouter identityRouter,
            DiscordGateway masterGateway, MirrorSwarm mirrorSwarm) {
        List<DiscordGateway> gateways = new ArrayList<>();
        gateways.add(masterGateway);
        for (ProxyIdentity identity : identityRouter.dedicated()) {
            String token = config.getSwarm().get(identity.key());
            gateways.add(new DiscordGateway(identity.key(), token, config.getDiscord().getGatewayUrl(),
                    DiscordGateway.INTENT_GUILDS, presenceListener(identity.key())));
        }

        DailyScheduler flush = null;
        if (config.getStats().isEnabled()) {
            flush = new DailyScheduler("counter-flush", LocalTime.parse(config.getStats().getFlushTime()),
                    Clock.system(ZoneOffset.of(config.getTimezoneOffset())), mirrorSwarm::flushCounters);
        }

        SwarmLifecycle lifecycle = new SwarmLifecycle(gateways, flush);
        lifecycle.start();
        log.info("MirrorSwarm running: {} connections, counters {}", gateways.size(),
                flush != null ? "flushed daily at " + config.getStats().getFlushTime() : "disabled");
        return lifecycle;
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    static MirrorSwarmConfig validated(MirrorSwarmConfig config) {
        List<String> issues = ConfigService.validate(config);
        if (!issues.isEmpty()) {
            throw new IllegalStateException("Invalid MirrorSwarm config:\n- " + String.join("\n- ", issues));
        }
        return config;
    }

    /**
     * Build the identities: the master from {@code masterToken}, one dedicated
     * identity per swarm entry.
     */
    static IdentityRouter buildRouter(MirrorSwarmConfig config, Function<String, DiscordClient> clients) {
        ProxyIdentity master = ProxyIdentity.master(clients.apply(config.getMasterToken()),
                config.getBackupGuildId());
        List<ProxyIdentity> dedicated = new ArrayList<>();
        config.getSwarm().forEach((sourceUserId, token) -> {
            dedicated.add(ProxyIdentity.dedicated(sourceUserId, clients.apply(token), config.getBackupGuildId()));
            log.debug("Dedicated identity for {} ({})", sourceUserId, TokenRedact.maskToken(token));
        });
        return new IdentityRouter(master, dedicated);
    }

    static LogLevel parseLevel(String level) {
        if (level == null || level.isBlank()) {
            return LogLevel.INFO;
        }
        try {
            return LogLevel.valueOf(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown log level '{}', using INFO", level);
            return LogLevel.INFO;
        }
    }

    private static GatewayListener presenceListener(String key) {
        return new GatewayListener() {
            @Override
            public void onReady(User self) {
                log.info("[{}] Connected as {}", key, self.getUsername());
            }
        };
    }
}
