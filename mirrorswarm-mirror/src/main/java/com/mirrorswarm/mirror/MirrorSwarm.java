package com.mirrorswarm.mirror;

import com.mirrorswarm.channel.discord.DiscordApi;
import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Member;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import com.mirrorswarm.channel.discord.GatewayListener;
import com.mirrorswarm.common.config.MirrorSwarmConfig;
import com.mirrorswarm.mirror.console.CommandException;
import com.mirrorswarm.mirror.console.ConfirmationGate;
import com.mirrorswarm.mirror.console.ConsoleCommandInterpreter;
import com.mirrorswarm.mirror.console.MessageLocator;
import com.mirrorswarm.mirror.identity.IdentityRouter;
import com.mirrorswarm.mirror.identity.ProxyIdentity;
import com.mirrorswarm.mirror.reaction.ReactionReplicator;
import com.mirrorswarm.mirror.replication.BatchImportController;
import com.mirrorswarm.mirror.replication.MessageReplicator;
import com.mirrorswarm.mirror.stats.StatTopics;
import com.mirrorswarm.mirror.stats.ThreadCounterStore;
import com.mirrorswarm.mirror.sync.ProfileSynchronizer;
import com.mirrorswarm.mirror.sync.RoleSynchronizer;
import com.mirrorswarm.mirror.transform.ContentTransformer;
import com.mirrorswarm.mirror.transform.MentionDirectory;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * The replication engine. Composes the identities with the router, the
 * transform, reaction replication, the console, batch import and the counter
 * store, and receives the master connection's gateway events.
 * <p>
 * Only the master connection delivers source messages, and all of its events
 * arrive on one dispatch thread, so messages are replicated one at a time in
 * arrival order.
 */
@Slf4j
public class MirrorSwarm implements GatewayListener {

    private final MirrorSwarmConfig config;
    private final IdentityRouter router;
    private final Executor masterLoop;
    private final ContentTransformer transformer;
    private final RoleSynchronizer roles;
    private final ProfileSynchronizer profiles;
    private final ThreadCounterStore counters;
    private final BackupGuildBootstrap bootstrap;
    private final ReplayGuard replayGuard;
    private final ConfirmationGate gate = new ConfirmationGate();

    private volatile boolean started;
    private volatile Map<String, Channel> sourceChannels = Map.of();
    private volatile Set<String> swarmAccounts = Set.of();
    private volatile MessageReplicator replicator;
    private volatile BatchImportController importer;
    private volatile ConsoleCommandInterpreter console;

    /**
     * @param masterLoop executor of the master connection's dispatch thread
     */
    public MirrorSwarm(MirrorSwarmConfig config, IdentityRouter router, Executor masterLoop) {
        this(config, router, masterLoop, new ReplayGuard());
    }

    MirrorSwarm(MirrorSwarmConfig config, IdentityRouter router, Executor masterLoop, ReplayGuard replayGuard) {
        this.config = config;
        this.router = router;
        this.masterLoop = masterLoop;
        this.replayGuard = replayGuard;

        DiscordClient master = router.master().client();
        this.transformer = new ContentTransformer(ZoneOffset.of(config.getTimezoneOffset()));
        this.roles = new RoleSynchronizer(router, master, master, config.getSourceGuildId(),
                config.getBackupGuildId());
        this.profiles = new ProfileSynchronizer(router, master, config.getSourceGuildId());
        this.counters = config.getStats().isEnabled()
                ? new ThreadCounterStore(master, config.getBackupGuildId(), StatTopics.defaults())
                : null;
        String imagePath = config.getUnknownEmoji().getImagePath();
        this.bootstrap = new BackupGuildBootstrap(router, config.getMonitoredChannelIds(), roles,
                config.getUnknownEmoji().getName(), imagePath != null ? Path.of(imagePath) : null);
    }

    /**
     * Prepare the backup guild and build the replication path. Events that
     * arrive before this completes are ignored.
     */
    public synchronized void start() {
        if (started) {
            return;
        }
        BackupGuildBootstrap.Result ready = bootstrap.run(counters);
        DiscordClient master = router.master().client();

        Map<String, Channel> channels = new LinkedHashMap<>();
        ready.sourceChannels().forEach(c -> channels.put(c.getId(), c));
        sourceChannels = channels;
        swarmAccounts = router.accountIds();

        ReactionReplicator reactions = new ReactionReplicator(router, master, ready.placeholder());
        replicator = new MessageReplicator(router, transformer, reactions, this::mentionDirectory, counters);
        importer = new BatchImportController(master, replicator);
        console = new ConsoleCommandInterpreter(master, config.getConsoleChannelId(),
                new MessageLocator(master, config.getMonitoredChannelIds()), importer, profiles, roles, gate,
                Duration.ofSeconds(config.getConfirmTimeoutSeconds()), masterLoop);
        started = true;
        log.info("MirrorSwarm started: {} monitored channels, {} dedicated identities",
                channels.size(), router.dedicated().size());
    }

    public boolean isStarted() {
        return started;
    }

    // =========================================================================
    // Gateway events (master connection)
    // =========================================================================

    @Override
    public void onReady(User self) {
        log.info("Master connection ready as {}", self.getUsername());
    }

    @Override
    public void onMessageCreate(Message message) {
        if (!started || message.getAuthor() == null || swarmAccounts.contains(message.getAuthor().getId())) {
            return;
        }
        if (message.getChannelId() != null && message.getChannelId().equals(config.getConsoleChannelId())) {
            handleConsole(message);
            return;
        }
        Channel sourceChannel = sourceChannels.get(message.getChannelId());
        if (sourceChannel == null || !MessageReplicator.isReplicable(message)) {
            return;
        }
        if (!replayGuard.firstSighting(message.getId())) {
            log.debug("Skipping redelivered message {}", message.getId());
            return;
        }
        try {
            bootstrap.ensureBackupChannel(sourceChannel);
            replicateLive(message, sourceChannel);
        } catch (RuntimeException e) {
            log.error("Replication of message {} in #{} failed: {}", message.getId(), sourceChannel.getName(),
                    e.getMessage(), e);
        }
    }

    /**
     * A send into a deleted backup channel recreates it and retries once.
     */
    private void replicateLive(Message message, Channel sourceChannel) {
        try {
            replicator.replicate(message, sourceChannel.getName(), false);
        } catch (DiscordApi.ApiError e) {
            if (e.getCode() != DiscordApi.UNKNOWN_CHANNEL) {
                throw e;
            }
            log.warn("Backup channel #{} is gone, recreating it", sourceChannel.getName());
            bootstrap.recreateBackupChannel(sourceChannel, counters);
            replicator.replicate(message, sourceChannel.getName(), false);
        }
    }

    @Override
    public void onGuildMemberUpdate(Member member) {
        if (!started || member.getUser() == null || !config.getSourceGuildId().equals(member.getGuildId())) {
            return;
        }
        String userId = member.getUser().getId();
        if (!router.hasDedicated(userId)) {
            return;
        }
        ProxyIdentity identity = router.route(userId);
        try {
            profiles.sync(identity);
        } catch (DiscordApi.ApiError e) {
            log.warn("[{}] Profile resync after member update failed: {}", identity.key(), e.getMessage());
        }
    }

    private void handleConsole(Message message) {
        console.handle(message).whenComplete((ignored, error) -> {
            if (error == null) {
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof CommandException ce) {
                log.debug("Console command ended with {} (reported)", ce.getKind());
            } else {
                log.error("Console command failed: {}", cause.getMessage(), cause);
            }
        });
    }

    // =========================================================================
    // Components
    // =========================================================================

    MentionDirectory mentionDirectory() {
        return new MentionDirectory(router.mentionUsers(), roles.roleMapping());
    }

    public IdentityRouter router() {
        return router;
    }

    public Optional<ThreadCounterStore> counters() {
        return Optional.ofNullable(counters);
    }

    public MessageReplicator replicator() {
        return requireStarted(replicator);
    }

    public BatchImportController importer() {
        return requireStarted(importer);
    }

    public ConsoleCommandInterpreter console() {
        return requireStarted(console);
    }

    public List<Channel> sourceChannels() {
        return List.copyOf(sourceChannels.values());
    }

    /**
     * Write pending counter deltas; no-op when statistics are disabled.
     */
    public int flushCounters() {
        return counters != null ? counters.flush() : 0;
    }

    private <T> T requireStarted(T component) {
        if (component == null) {
            throw new IllegalStateException("MirrorSwarm has not been started");
        }
        return component;
    }
}
