package com.mirrorswarm.mirror.console;

import com.mirrorswarm.channel.discord.DiscordApi;
import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes.Attachment;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.OutboundMessage;
import com.mirrorswarm.channel.discord.MessageSplitter;
import com.mirrorswarm.mirror.replication.BatchImportController;
import com.mirrorswarm.mirror.sync.ProfileSynchronizer;
import com.mirrorswarm.mirror.sync.RoleSynchronizer;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Operator commands read from the console channel, one message per turn.
 * <p>
 * Commands: {@code help}, {@code sync profiles}, {@code sync roles},
 * {@code get message <id>}, {@code manual import <id>}. Anything else is
 * ignored. A pending import confirmation consumes the next console message
 * as its answer; only exactly {@code yes} confirms.
 * <p>
 * Failures are posted to the console and then raised as
 * {@link CommandException} through the returned future.
 */
@Slf4j
public class ConsoleCommandInterpreter {

    /**
     * A console command. The future yields the text to post when the command
     * is done, or null for nothing.
     */
    @FunctionalInterface
    public interface ConsoleCommand {
        CompletableFuture<String> run(String args);
    }

    private final Map<String, ConsoleCommand> commands = new LinkedHashMap<>();
    private final DiscordClient console;
    private final String consoleChannelId;
    private final MessageLocator locator;
    private final BatchImportController importer;
    private final ConfirmationGate gate;
    private final Duration confirmTimeout;
    private final Executor loop;

    /**
     * @param console        client that posts to the console channel
     * @param confirmTimeout how long {@code manual import} waits for {@code yes}
     * @param loop           executor the confirmation continuation runs on
     */
    public ConsoleCommandInterpreter(DiscordClient console, String consoleChannelId, MessageLocator locator,
            BatchImportController importer, ProfileSynchronizer profiles, RoleSynchronizer roles,
            ConfirmationGate gate, Duration confirmTimeout, Executor loop) {
        this.console = console;
        this.consoleChannelId = consoleChannelId;
        this.locator = locator;
        this.importer = importer;
        this.gate = gate;
        this.confirmTimeout = confirmTimeout;
        this.loop = loop;

        commands.put("help", args -> CompletableFuture.completedFuture(help()));
        commands.put("sync profiles", args -> CompletableFuture.completedFuture(
                profiles.syncAll().summary("profiles")));
        commands.put("sync roles", args -> CompletableFuture.completedFuture(
                roles.syncRoles().summary("role changes")));
        commands.put("get message", this::getMessage);
        commands.put("manual import", this::manualImport);
    }

    /**
     * Handle one console message.
     *
     * @return completes when the command is done; fails with a
     *         {@link CommandException} that was already posted
     */
    public CompletableFuture<Void> handle(Message message) {
        String content = message.getContent() != null ? message.getContent() : "";
        if (gate.offer(content)) {
            log.debug("Console message {} taken as confirmation answer", message.getId());
            return CompletableFuture.completedFuture(null);
        }

        String normalized = content.strip();
        String lower = normalized.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, ConsoleCommand> entry : commands.entrySet()) {
            String name = entry.getKey();
            if (lower.equals(name) || lower.startsWith(name + " ")) {
                String args = normalized.substring(name.length()).trim();
                log.info("Console command: {} {}", name, args);
                return run(name, entry.getValue(), args);
            }
        }
        log.debug("Ignoring console message {}", message.getId());
        return CompletableFuture.completedFuture(null);
    }

    public boolean isAwaitingConfirmation() {
        return gate.isPending();
    }

    private CompletableFuture<Void> run(String name, ConsoleCommand command, String args) {
        CompletableFuture<String> result;
        try {
            result = command.run(args);
        } catch (CommandException e) {
            return CompletableFuture.failedFuture(report(e));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(report(new CommandException(CommandException.Kind.FAILED,
                    "`" + name + "` failed: " + e.getMessage(), e)));
        }
        return result.thenAccept(reply -> {
            if (reply != null) {
                post(reply);
            }
        });
    }

    // =========================================================================
    // Commands
    // =========================================================================

    private CompletableFuture<String> getMessage(String args) {
        LocatedMessage found = locator.locate(args);
        post(describe(found), found.message().getEmbeds());
        return CompletableFuture.completedFuture(null);
    }

    private CompletableFuture<String> manualImport(String args) {
        LocatedMessage found = locator.locate(args);
        Message start = found.message();
        post("Found message " + start.getId() + " in #" + found.channel().getName() + " by "
                + authorName(start) + ".\nImport every message after it into the backup? Reply `yes` within "
                + confirmTimeout.toSeconds() + " seconds to confirm.");

        return gate.open(confirmTimeout).handleAsync((answer, error) -> {
            if (error != null) {
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                    throw report(new CommandException(CommandException.Kind.CANCELLED,
                            "Import cancelled: no confirmation within " + confirmTimeout.toSeconds() + " seconds."));
                }
                throw report(new CommandException(CommandException.Kind.FAILED,
                        "Import aborted: " + cause.getMessage(), cause));
            }
            if (!"yes".equals(answer)) {
                throw report(new CommandException(CommandException.Kind.CANCELLED, "Import cancelled."));
            }
            try {
                int count = importer.importAfter(found.channel(), start.getId());
                return "Imported " + count + " messages from #" + found.channel().getName() + ".";
            } catch (RuntimeException e) {
                throw report(new CommandException(CommandException.Kind.FAILED,
                        "Import from #" + found.channel().getName() + " failed: " + e.getMessage(), e));
            }
        }, loop);
    }

    private String help() {
        return String.join("\n", List.of(
                "**Console commands**",
                "`sync profiles` copy avatars, usernames and nicknames onto the proxy accounts",
                "`sync roles` create missing roles and colour the proxy accounts",
                "`get message <id>` show a message from a monitored channel",
                "`manual import <id>` replicate everything after a message (asks for `yes`)"));
    }

    static String describe(LocatedMessage found) {
        Message m = found.message();
        StringBuilder sb = new StringBuilder();
        sb.append("Message ").append(m.getId()).append(" in #").append(found.channel().getName())
                .append(" by ").append(authorName(m));
        if (m.getTimestamp() != null) {
            sb.append(" at ").append(m.getTimestamp());
        }
        sb.append('\n');
        String content = m.getContent();
        sb.append(content == null || content.isEmpty() ? "(no text)" : content);
        if (m.getEmbeds() != null && !m.getEmbeds().isEmpty()) {
            sb.append("\nEmbeds: ").append(m.getEmbeds().size()).append(" (attached)");
        }
        if (m.getAttachments() != null && !m.getAttachments().isEmpty()) {
            sb.append("\nAttachments:");
            for (Attachment attachment : m.getAttachments()) {
                sb.append("\n- ").append(attachment.getFilename()).append(": ").append(attachment.getUrl());
            }
        }
        return sb.toString();
    }

    // =========================================================================
    // Console output
    // =========================================================================

    private void post(String text) {
        post(text, null);
    }

    /**
     * Post text, with {@code embeds} on the last part.
     */
    private void post(String text, @Nullable List<Map<String, Object>> embeds) {
        List<String> parts = MessageSplitter.split(text);
        for (int i = 0; i < parts.size(); i++) {
            OutboundMessage outbound = OutboundMessage.silent(parts.get(i));
            if (i == parts.size() - 1 && embeds != null && !embeds.isEmpty()) {
                outbound.setEmbeds(List.copyOf(embeds));
            }
            console.sendMessage(consoleChannelId, outbound);
        }
    }

    /**
     * Log and post a failure, then hand it back for throwing.
     */
    private CommandException report(CommandException e) {
        log.warn("Console command {}: {}", e.getKind(), e.getMessage());
        try {
            post("❌ " + e.getMessage());
        } catch (DiscordApi.ApiError postError) {
            log.error("Could not post command failure to console: {}", postError.getMessage(), postError);
        }
        return e;
    }

    private static String authorName(Message m) {
        return m.getAuthor() != null ? m.getAuthor().getDisplayName() : "unknown author";
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }
}
