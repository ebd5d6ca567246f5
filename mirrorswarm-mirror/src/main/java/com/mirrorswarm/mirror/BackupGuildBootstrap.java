package com.mirrorswarm.mirror;

import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordEmojis;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Emoji;
import com.mirrorswarm.mirror.identity.IdentityRouter;
import com.mirrorswarm.mirror.identity.ProxyIdentity;
import com.mirrorswarm.mirror.stats.ThreadCounterStore;
import com.mirrorswarm.mirror.sync.RoleSynchronizer;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Prepares the backup guild before replication starts: one backup channel per
 * monitored source channel, the placeholder emoji, the role mapping, fresh
 * identity directories and the counter threads.
 */
@Slf4j
public class BackupGuildBootstrap {

    /** Bundled placeholder image on the classpath. */
    public static final String PLACEHOLDER_RESOURCE = "/unknown-emoji.png";

    private final IdentityRouter router;
    private final List<String> monitoredChannelIds;
    private final RoleSynchronizer roles;
    private final String placeholderName;
    @Nullable
    private final Path placeholderImage;

    /**
     * @param placeholderImage image file for the placeholder emoji, null for
     *                         the bundled one
     */
    public BackupGuildBootstrap(IdentityRouter router, List<String> monitoredChannelIds, RoleSynchronizer roles,
            String placeholderName, @Nullable Path placeholderImage) {
        this.router = router;
        this.monitoredChannelIds = List.copyOf(monitoredChannelIds);
        this.roles = roles;
        this.placeholderName = DiscordEmojis.normalizeEmojiName(placeholderName);
        this.placeholderImage = placeholderImage;
    }

    /**
     * Result of bootstrapping.
     *
     * @param sourceChannels monitored channels in configuration order
     * @param backupChannels their backup counterparts, same order
     */
    public record Result(List<Channel> sourceChannels, List<Channel> backupChannels, Emoji placeholder) {
    }

    public Result run(@Nullable ThreadCounterStore counters) {
        ProxyIdentity master = router.master();
        DiscordClient client = master.client();

        List<Channel> sourceChannels = new ArrayList<>();
        for (String channelId : monitoredChannelIds) {
            sourceChannels.add(client.getChannel(channelId));
        }

        master.refreshDirectories();
        List<Channel> backupChannels = new ArrayList<>();
        for (Channel source : sourceChannels) {
            backupChannels.add(ensureBackupChannel(source));
        }

        Emoji placeholder = ensurePlaceholder(master);
        roles.rebuildMapping();
        for (ProxyIdentity identity : router.all()) {
            identity.refreshDirectories();
        }
        if (counters != null) {
            counters.reconcile(backupChannels);
        }
        log.info("Backup guild ready: {} channels, placeholder {}, {} identities",
                backupChannels.size(), DiscordEmojis.render(placeholder), router.all().size());
        return new Result(List.copyOf(sourceChannels), List.copyOf(backupChannels), placeholder);
    }

    /**
     * The backup channel named like {@code source}, created when missing.
     */
    public Channel ensureBackupChannel(Channel source) {
        ProxyIdentity master = router.master();
        return master.channel(source.getName()).orElseGet(() -> {
            Channel created = master.client().createTextChannel(master.backupGuildId(), source.getName());
            log.info("Created backup channel #{}", created.getName());
            master.refreshDirectories();
            return created;
        });
    }

    /**
     * Bring back a backup channel deleted while running. Every identity drops
     * its stale directory, the channel is created again and the counter store
     * provisions its threads.
     */
    public Channel recreateBackupChannel(Channel source, @Nullable ThreadCounterStore counters) {
        router.master().refreshDirectories();
        Channel backup = ensureBackupChannel(source);
        for (ProxyIdentity identity : router.dedicated()) {
            identity.refreshDirectories();
        }
        if (counters != null) {
            counters.track(backup);
        }
        return backup;
    }

    private Emoji ensurePlaceholder(ProxyIdentity master) {
        DiscordClient client = master.client();
        for (Emoji emoji : client.listEmojis(master.backupGuildId())) {
            if (placeholderName.equals(emoji.getName())) {
                return emoji;
            }
        }
        Emoji created = client.createEmoji(master.backupGuildId(), placeholderName, placeholderBytes(), "image/png");
        log.info("Uploaded placeholder emoji :{}:", created.getName());
        return created;
    }

    byte[] placeholderBytes() {
        try {
            if (placeholderImage != null) {
                return Files.readAllBytes(placeholderImage);
            }
            try (InputStream in = BackupGuildBootstrap.class.getResourceAsStream(PLACEHOLDER_RESOURCE)) {
                if (in == null) {
                    throw new IllegalStateException("Missing classpath resource " + PLACEHOLDER_RESOURCE);
                }
                return in.readAllBytes();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read placeholder emoji image", e);
        }
    }
}
