package com.mirrorswarm.common.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.mirrorswarm.common.logging.TokenRedact;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads, validates and caches the MirrorSwarm configuration.
 */
@Slf4j
public class ConfigService {

    public static final String SWARM_ENV = "MIRRORSWARM_SWARM";

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");
    private static final Pattern SNOWFLAKE = Pattern.compile("\\d{15,21}");

    private final ObjectMapper objectMapper;
    private final Cache<String, MirrorSwarmConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        String pathStr = configPath.toString();
        if (pathStr.startsWith("~")) {
            pathStr = System.getProperty("user.home") + pathStr.substring(1);
            configPath = Path.of(pathStr);
        }
        this.configPath = configPath;
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public MirrorSwarmConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public MirrorSwarmConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    private MirrorSwarmConfig doLoadConfig() {
        MirrorSwarmConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            config = new MirrorSwarmConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, MirrorSwarmConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                throw new ConfigException("Failed to read config " + configPath + ": "
                        + TokenRedact.redact(e.getMessage()), e);
            }
        }
        applySwarmEnv(config);
        return applyDefaults(config);
    }

    /**
     * Merge the swarm token table from {@value #SWARM_ENV}; entries in the file win.
     */
    void applySwarmEnv(MirrorSwarmConfig config) {
        String raw = env.apply(SWARM_ENV);
        if (raw == null || raw.isBlank()) {
            return;
        }
        try {
            Map<String, String> fromEnv = objectMapper.readValue(raw, new TypeReference<LinkedHashMap<String, String>>() {
            });
            Map<String, String> merged = new LinkedHashMap<>(fromEnv);
            if (config.getSwarm() != null) {
                merged.putAll(config.getSwarm());
            }
            config.setSwarm(merged);
            log.debug("Merged {} swarm identities from {}", fromEnv.size(), SWARM_ENV);
        } catch (IOException e) {
            throw new ConfigException(SWARM_ENV + " is not a JSON object of user id to token", e);
        }
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String value = env.apply(matcher.group(1));
            if (value == null) {
                value = matcher.group(2) != null ? matcher.group(2) : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    MirrorSwarmConfig applyDefaults(MirrorSwarmConfig config) {
        if (config.getMonitoredChannelIds() == null) {
            config.setMonitoredChannelIds(new ArrayList<>());
        }
        if (config.getSwarm() == null) {
            config.setSwarm(new LinkedHashMap<>());
        }
        if (config.getTimezoneOffset() == null || config.getTimezoneOffset().isBlank()) {
            config.setTimezoneOffset("Z");
        }
        if (config.getConfirmTimeoutSeconds() <= 0) {
            config.setConfirmTimeoutSeconds(60);
        }
        if (config.getStats() == null) {
            config.setStats(new MirrorSwarmConfig.StatsConfig());
        }
        if (config.getUnknownEmoji() == null) {
            config.setUnknownEmoji(new MirrorSwarmConfig.UnknownEmojiConfig());
        }
        if (config.getDiscord() == null) {
            config.setDiscord(new MirrorSwarmConfig.DiscordConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new MirrorSwarmConfig.LoggingConfig());
        }
        return config;
    }

    /**
     * Check the loaded config for problems that would prevent the swarm from
     * starting.
     *
     * @return human-readable issues, empty when the config is usable
     */
    public static List<String> validate(MirrorSwarmConfig config) {
        List<String> issues = new ArrayList<>();
        if (config.getMasterToken() == null || config.getMasterToken().isBlank()) {
            issues.add("masterToken is required");
        }
        requireSnowflake(issues, "sourceGuildId", config.getSourceGuildId());
        requireSnowflake(issues, "backupGuildId", config.getBackupGuildId());
        requireSnowflake(issues, "consoleChannelId", config.getConsoleChannelId());
        if (config.getMonitoredChannelIds() == null || config.getMonitoredChannelIds().isEmpty()) {
            issues.add("monitoredChannelIds must list at least one channel");
        } else {
            for (String id : config.getMonitoredChannelIds()) {
                requireSnowflake(issues, "monitoredChannelIds[" + id + "]", id);
            }
        }
        if (config.getSwarm() != null) {
            config.getSwarm().forEach((userId, token) -> {
                requireSnowflake(issues, "swarm key", userId);
                if (token == null || token.isBlank()) {
                    issues.add("swarm token for " + userId + " is empty");
                }
            });
        }
        String offset = config.getTimezoneOffset();
        try {
            if (offset == null) {
                throw new DateTimeException("missing");
            }
            ZoneOffset.of(offset);
        } catch (DateTimeException e) {
            issues.add("timezoneOffset is not a valid offset: " + offset);
        }
        if (config.getStats() != null) {
            String flushTime = config.getStats().getFlushTime();
            try {
                if (flushTime == null) {
                    throw new DateTimeException("missing");
                }
                LocalTime.parse(flushTime);
            } catch (DateTimeException e) {
                issues.add("stats.flushTime must be HH:mm: " + flushTime);
            }
        }
        return issues;
    }

    private static void requireSnowflake(List<String> issues, String field, String value) {
        if (value == null || !SNOWFLAKE.matcher(value).matches()) {
            issues.add(field + " must be a Discord id, got: " + value);
        }
    }

    /**
     * Raised when the config file cannot be read or parsed.
     */
    public static class ConfigException extends RuntimeException {
        public ConfigException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
