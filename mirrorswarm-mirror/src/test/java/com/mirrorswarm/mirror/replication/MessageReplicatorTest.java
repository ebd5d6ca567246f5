package com.mirrorswarm.mirror.replication;

import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.mirror.reaction.ReactionReplicator;
import com.mirrorswarm.mirror.stats.StatTopics;
import com.mirrorswarm.mirror.stats.ThreadCounterStore;
import com.mirrorswarm.mirror.support.SwarmWorld;
import com.mirrorswarm.mirror.transform.ContentTransformer;
import com.mirrorswarm.mirror.transform.MentionDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageReplicatorTest {

    private SwarmWorld world;
    private Channel backup;
    private ThreadCounterStore counters;
    private MessageReplicator replicator;

    @BeforeEach
    void setUp() {
        world = new SwarmWorld();
        backup = world.mirrorChannel(world.general);
        ReactionReplicator reactions = new ReactionReplicator(world.router,
                world.discord.client(world.masterAccount),
                world.discord.emoji(SwarmWorld.BACKUP_GUILD, "unknown_emoji"));
        counters = new ThreadCounterStore(world.discord.client(world.masterAccount), SwarmWorld.BACKUP_GUILD,
                StatTopics.defaults());
        counters.reconcile(List.of(backup));
        replicator = new MessageReplicator(world.router, new ContentTransformer(ZoneOffset.UTC), reactions,
                () -> new MentionDirectory(world.router.mentionUsers(), Map.of()), counters);
    }

    private List<Message> backupMessages() {
        return world.discord.messages(backup.getId());
    }

    @Test
    void replicate_dedicatedAuthorSpeaksThroughProxyWithoutAttribution() {
        Message source = world.discord.post(world.general.getId(), world.alice, "hi");

        ReplicationResult result = replicator.replicate(source, "general", false);

        assertSame(world.aliceIdentity, result.identity());
        assertTrue(result.delivered());
        Message sent = backupMessages().get(0);
        assertEquals("hi", sent.getContent());
        assertEquals(world.aliceProxyAccount.getId(), sent.getAuthor().getId());
    }

    @Test
    void replicate_unmappedAuthorGoesThroughMasterWithAttribution() {
        Message source = world.discord.post(world.general.getId(), world.bob, "hi");

        ReplicationResult result = replicator.replicate(source, "general", false);

        assertSame(world.master, result.identity());
        assertEquals("hi\n-# sent by bob", backupMessages().get(0).getContent());
        assertEquals(world.masterAccount.getId(), backupMessages().get(0).getAuthor().getId());
    }

    @Test
    void replicate_rewritesMentionsOfRosterUsers() {
        Message source = world.discord.post(world.general.getId(), world.bob,
                "thanks <@" + world.alice.getId() + "> and @everyone");

        replicator.replicate(source, "general", false);

        assertEquals("thanks <@" + world.aliceProxyAccount.getId() + "> and @\u200Beveryone\n-# sent by bob",
                backupMessages().get(0).getContent());
    }

    @Test
    void replicate_appendsAttachmentUrlsBeforeAttribution() {
        Message source = world.discord.postWithAttachment(world.general.getId(), world.bob, "look",
                "https://cdn.example/a.png");

        replicator.replicate(source, "general", false);

        assertEquals("look\nhttps://cdn.example/a.png\n-# sent by bob", backupMessages().get(0).getContent());
        assertEquals(1, counters.pendingDelta(backup.getId(), StatTopics.ATTACHMENTS_SENT.title()));
    }

    @Test
    void replicate_splitsLongTextAndCountsOnce() {
        Message source = world.discord.post(world.general.getId(), world.bob, "word ".repeat(500).trim());

        ReplicationResult result = replicator.replicate(source, "general", false);

        assertTrue(result.sent().size() >= 2);
        assertTrue(backupMessages().stream().allMatch(m -> m.getContent().length() <= 2000));
        assertTrue(result.last().getContent().endsWith("-# sent by bob"));
        assertEquals(1, counters.pendingDelta(backup.getId(), StatTopics.MESSAGES_SENT.title()));
    }

    @Test
    void replicate_liveForwardsOnlyRichEmbeds() {
        Message source = world.discord.post(world.general.getId(), world.alice, "");
        source.getEmbeds().add(Map.of("type", "rich", "title", "Poll"));
        source.getEmbeds().add(Map.of("type", "link", "url", "https://example.com"));

        ReplicationResult result = replicator.replicate(source, "general", false);

        assertEquals(1, result.sent().size());
        assertEquals("", result.last().getContent());
        assertEquals(List.of(Map.of("type", "rich", "title", "Poll")), result.last().getEmbeds());
    }

    @Test
    void replicate_contentlessMessageIsSkippedForEveryAuthor() {
        Message fromAlice = world.discord.post(world.general.getId(), world.alice, "");
        Message fromBob = world.discord.post(world.general.getId(), world.bob, "");
        fromBob.getEmbeds().add(Map.of("type", "link", "url", "https://example.com"));

        assertFalse(replicator.replicate(fromAlice, "general", false).delivered());
        assertFalse(replicator.replicate(fromBob, "general", false).delivered());

        assertTrue(backupMessages().isEmpty());
        assertEquals(0, counters.pendingDelta(backup.getId(), StatTopics.MESSAGES_SENT.title()));
    }

    @Test
    void forwardedEmbeds_batchKeepsEveryEmbed() {
        Message source = world.discord.post(world.general.getId(), world.alice, "");
        source.getEmbeds().add(Map.of("type", "rich"));
        source.getEmbeds().add(Map.of("type", "link"));

        assertEquals(2, MessageReplicator.forwardedEmbeds(source, true).size());
        assertEquals(1, MessageReplicator.forwardedEmbeds(source, false).size());
    }

    @Test
    void isReplicable_skipsSystemMessages() {
        Message join = world.discord.post(world.general.getId(), world.bob, "");
        join.setType(7);
        Message reply = world.discord.post(world.general.getId(), world.bob, "re");
        reply.setType(19);

        assertFalse(MessageReplicator.isReplicable(join));
        assertTrue(MessageReplicator.isReplicable(reply));
    }

    @Test
    void replicate_missingBackupChannelFails() {
        Channel random = world.discord.textChannel(SwarmWorld.SOURCE_GUILD, "random");
        Message source = world.discord.post(random.getId(), world.bob, "hi");

        assertThrows(IllegalStateException.class, () -> replicator.replicate(source, "random", false));
        assertTrue(backupMessages().isEmpty());
    }
}
