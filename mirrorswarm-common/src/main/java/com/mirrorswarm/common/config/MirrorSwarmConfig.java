package com.mirrorswarm.common.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration type for MirrorSwarm.
 * Bound from the JSON config file by {@link ConfigService}.
 */
@Data
public class MirrorSwarmConfig {

    /** Token of the master (default) identity. */
    private String masterToken;

    /** Guild whose channels are monitored. */
    private String sourceGuildId;

    /** Guild receiving the replicated messages. */
    private String backupGuildId;

    /** Source channel ids to replicate. */
    private List<String> monitoredChannelIds = new ArrayList<>();

    /** Channel read as the operator console. */
    private String consoleChannelId;

    /** Dedicated identities: source user id -> bot token. */
    private Map<String, String> swarm = new LinkedHashMap<>();

    /** Offset used for batch import timestamps, e.g. "-05:00". */
    private String timezoneOffset = "Z";

    /** How long "manual import" waits for the operator to confirm. */
    private int confirmTimeoutSeconds = 60;

    private StatsConfig stats;

    private UnknownEmojiConfig unknownEmoji;

    private DiscordConfig discord;

    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class StatsConfig {
        private boolean enabled = true;
        /** Local time of the daily counter flush, "HH:mm". */
        private String flushTime = "00:00";
    }

    @Data
    public static class UnknownEmojiConfig {
        private String name = "unknown_emoji";
        /** PNG used when the placeholder has to be created; bundled image when null. */
        private String imagePath;
    }

    @Data
    public static class DiscordConfig {
        private String apiBaseUrl = "https://discord.com/api/v10";
        private String gatewayUrl = "wss://gateway.discord.gg/?v=10&encoding=json";
    }

    @Data
    public static class LoggingConfig {
        /** Level of the com.mirrorswarm loggers. */
        private String level = "info";
    }
}
