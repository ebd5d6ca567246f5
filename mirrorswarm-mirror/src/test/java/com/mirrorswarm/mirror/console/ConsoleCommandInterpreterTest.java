package com.mirrorswarm.mirror.console;

import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.mirror.reaction.ReactionReplicator;
import com.mirrorswarm.mirror.replication.BatchImportController;
import com.mirrorswarm.mirror.replication.MessageReplicator;
import com.mirrorswarm.mirror.support.SwarmWorld;
import com.mirrorswarm.mirror.sync.ProfileSynchronizer;
import com.mirrorswarm.mirror.sync.RoleSynchronizer;
import com.mirrorswarm.mirror.transform.ContentTransformer;
import com.mirrorswarm.mirror.transform.MentionDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleCommandInterpreterTest {

    private SwarmWorld world;
    private Channel backup;
    private BatchImportController importer;
    private ProfileSynchronizer profiles;
    private RoleSynchronizer roles;

    @BeforeEach
    void setUp() {
        world = new SwarmWorld();
        backup = world.mirrorChannel(world.general);
        DiscordClient master = world.discord.client(world.masterAccount);
        ReactionReplicator reactions = new ReactionReplicator(world.router, master,
                world.discord.emoji(SwarmWorld.BACKUP_GUILD, "unknown_emoji"));
        MessageReplicator replicator = new MessageReplicator(world.router, new ContentTransformer(ZoneOffset.UTC),
                reactions, MentionDirectory::empty, null);
        importer = new BatchImportController(master, replicator);
        profiles = new ProfileSynchronizer(world.router, master, SwarmWorld.SOURCE_GUILD);
        roles = new RoleSynchronizer(world.router, master, master, SwarmWorld.SOURCE_GUILD, SwarmWorld.BACKUP_GUILD);
    }

    private ConsoleCommandInterpreter interpreter(Duration confirmTimeout) {
        DiscordClient master = world.discord.client(world.masterAccount);
        return new ConsoleCommandInterpreter(master, world.console.getId(),
                new MessageLocator(master, List.of(world.general.getId())), importer, profiles, roles,
                new ConfirmationGate(), confirmTimeout, Runnable::run);
    }

    private Message say(String text) {
        return world.discord.post(world.console.getId(), world.bob, text);
    }

    /** Replies posted by the master, skipping the operator's own messages. */
    private List<String> consoleReplies() {
        return world.discord.messages(world.console.getId()).stream()
                .filter(m -> m.getAuthor().getId().equals(world.masterAccount.getId()))
                .map(Message::getContent)
                .toList();
    }

    private static CommandException failure(CompletableFuture<Void> future) {
        CompletionException e = assertThrows(CompletionException.class, future::join);
        return assertInstanceOf(CommandException.class, e.getCause());
    }

    private Message historyOfThree() {
        Message start = world.discord.post(world.general.getId(), world.bob, "start");
        world.discord.post(world.general.getId(), world.bob, "one");
        world.discord.post(world.general.getId(), world.alice, "two");
        return start;
    }

    @Test
    void manualImport_declinedSendsNothing() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));
        Message start = historyOfThree();

        CompletableFuture<Void> command = console.handle(say("manual import " + start.getId()));
        assertTrue(console.isAwaitingConfirmation());
        assertFalse(command.isDone());

        assertNull(console.handle(say("no")).join());

        assertEquals(CommandException.Kind.CANCELLED, failure(command).getKind());
        assertTrue(world.discord.messages(backup.getId()).isEmpty());
        List<String> replies = consoleReplies();
        assertTrue(replies.get(0).startsWith("Found message " + start.getId() + " in #general by bob."));
        assertEquals("❌ Import cancelled.", replies.get(replies.size() - 1));
        assertFalse(console.isAwaitingConfirmation());
    }

    @Test
    void manualImport_confirmedReplaysEverythingAfterTheMessage() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));
        Message start = historyOfThree();

        CompletableFuture<Void> command = console.handle(say("manual import " + start.getId()));
        console.handle(say("yes")).join();
        command.join();

        assertEquals(List.of("[03/14/2022 09:05PM] one\n-# sent by bob", "[03/14/2022 09:05PM] two"),
                world.discord.messages(backup.getId()).stream().map(Message::getContent).toList());
        List<String> replies = consoleReplies();
        assertEquals("Imported 2 messages from #general.", replies.get(replies.size() - 1));
    }

    @Test
    void manualImport_onlyExactYesConfirms() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));
        Message start = historyOfThree();

        CompletableFuture<Void> command = console.handle(say("manual import " + start.getId()));
        console.handle(say("Yes"));

        assertEquals(CommandException.Kind.CANCELLED, failure(command).getKind());
        assertTrue(world.discord.messages(backup.getId()).isEmpty());
    }

    @Test
    void manualImport_timesOutWithoutAnswer() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofMillis(200));
        Message start = historyOfThree();

        CompletableFuture<Void> command = console.handle(say("manual import " + start.getId()));

        CommandException e = failure(command);
        assertEquals(CommandException.Kind.CANCELLED, e.getKind());
        assertTrue(e.getMessage().startsWith("Import cancelled: no confirmation"));
        assertFalse(console.isAwaitingConfirmation());

        console.handle(say("yes")).join();
        assertTrue(world.discord.messages(backup.getId()).isEmpty());
    }

    @Test
    void manualImport_unknownMessageNeverAsks() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));

        CommandException e = failure(console.handle(say("manual import 123456789")));

        assertEquals(CommandException.Kind.NOT_FOUND, e.getKind());
        assertFalse(console.isAwaitingConfirmation());
    }

    @Test
    void getMessage_nonNumericIdFailsBeforeAnyLookup() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));

        CommandException e = failure(console.handle(say("get message abc")));

        assertEquals(CommandException.Kind.FORMAT, e.getKind());
        assertEquals(0, world.discord.messageLookups.get());
        assertEquals(List.of("❌ 'abc' is not a message id (digits only)"), consoleReplies());
    }

    @Test
    void getMessage_describesFoundMessage() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));
        Message target = world.discord.postWithAttachment(world.general.getId(), world.bob, "look at this",
                "https://cdn.example/cat.png");

        console.handle(say("get message " + target.getId())).join();

        String reply = consoleReplies().get(0);
        assertTrue(reply.startsWith("Message " + target.getId() + " in #general by bob"));
        assertTrue(reply.contains("look at this"));
        assertTrue(reply.contains("file.png: https://cdn.example/cat.png"));
    }

    @Test
    void getMessage_attachesTheMessageEmbeds() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));
        Message target = world.discord.post(world.general.getId(), world.bob, "");
        target.getEmbeds().add(Map.of("type", "rich", "title", "Weekly poll", "description", "vote"));

        console.handle(say("get message " + target.getId())).join();

        Message reply = world.discord.messages(world.console.getId()).get(1);
        assertTrue(reply.getContent().contains("(no text)"));
        assertTrue(reply.getContent().contains("Embeds: 1 (attached)"));
        assertEquals(List.of(Map.of("type", "rich", "title", "Weekly poll", "description", "vote")),
                reply.getEmbeds());
    }

    @Test
    void getMessage_missingMessageIsNotFound() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));

        CommandException e = failure(console.handle(say("get message 42")));

        assertEquals(CommandException.Kind.NOT_FOUND, e.getKind());
        assertEquals(1, world.discord.messageLookups.get());
    }

    @Test
    void handle_matchesCommandsCaseInsensitively() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));

        console.handle(say("HELP")).join();

        assertTrue(consoleReplies().get(0).startsWith("**Console commands**"));
    }

    @Test
    void handle_ignoresChatter() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));

        console.handle(say("helpful tip: drink water")).join();
        console.handle(say("get messages 1")).join();

        assertTrue(consoleReplies().isEmpty());
    }

    @Test
    void syncProfiles_reportsSummary() {
        ConsoleCommandInterpreter console = interpreter(Duration.ofSeconds(5));

        console.handle(say("sync profiles")).join();

        assertEquals(List.of("Synced 1 profiles."), consoleReplies());
        assertEquals("alice", world.aliceProxyAccount.getUsername());
    }
}
