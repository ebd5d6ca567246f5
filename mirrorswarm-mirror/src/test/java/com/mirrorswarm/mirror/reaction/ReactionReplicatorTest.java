package com.mirrorswarm.mirror.reaction;

import com.mirrorswarm.channel.discord.DiscordEmojis;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Emoji;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.OutboundMessage;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import com.mirrorswarm.mirror.support.SwarmWorld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReactionReplicatorTest {

    private static final Emoji THUMBS = Emoji.builder().name("👍").build();

    private SwarmWorld world;
    private Channel backupChannel;
    private Emoji placeholder;
    private Emoji foreignBlob;
    private ReactionReplicator replicator;

    @BeforeEach
    void setUp() {
        world = new SwarmWorld();
        backupChannel = world.mirrorChannel(world.general);
        placeholder = world.discord.emoji(SwarmWorld.BACKUP_GUILD, "unknown_emoji");
        foreignBlob = world.discord.emoji(SwarmWorld.SOURCE_GUILD, "blob");
        replicator = new ReactionReplicator(world.router, world.discord.client(world.masterAccount), placeholder);
    }

    private Message backupOf(String content) {
        return world.master.send("general", OutboundMessage.silent(content));
    }

    @Test
    void replicate_unknownEmojiFromTwoUnmappedUsers_onePlaceholderAndCountOfOne() {
        Message source = world.discord.post(world.general.getId(), world.carol, "hi");
        world.discord.react(source, foreignBlob, world.bob, world.carol);
        Message backup = backupOf("hi\n-# sent by carol");

        UnknownReactionTally tally = replicator.replicate(source, backup, world.master);

        assertEquals(Map.of(DiscordEmojis.reactionKey(placeholder), List.of(world.masterAccount.getId())),
                world.discord.reactionsOn(backup.getId()));
        assertEquals(1, tally.unknownCount(foreignBlob));
        assertEquals("hi\n-# sent by carol\n\n**Unknown Reactions**\n:blob: + 1 unknown",
                world.discord.messages(backupChannel.getId()).get(0).getContent());
    }

    @Test
    void replicate_dedicatedIdentityFallsBackWithMention() {
        Message source = world.discord.post(world.general.getId(), world.alice, "hi");
        world.discord.react(source, foreignBlob, world.alice);
        Message backup = world.aliceIdentity.send("general", OutboundMessage.silent("hi"));

        UnknownReactionTally tally = replicator.replicate(source, backup, world.aliceIdentity);

        assertEquals(Map.of(DiscordEmojis.reactionKey(placeholder), List.of(world.aliceProxyAccount.getId())),
                world.discord.reactionsOn(backup.getId()));
        assertEquals(Set.of("<@" + world.aliceProxyAccount.getId() + ">"), tally.fallbacks(foreignBlob));
        assertEquals("hi\n\n**Unknown Reactions**\n:blob: <@" + world.aliceProxyAccount.getId() + ">",
                world.discord.messages(backupChannel.getId()).get(0).getContent());
    }

    @Test
    void replicate_placeholderUsedOncePerIdentity() {
        Emoji otherForeign = world.discord.emoji(SwarmWorld.SOURCE_GUILD, "party");
        Message source = world.discord.post(world.general.getId(), world.bob, "hi");
        world.discord.react(source, foreignBlob, world.bob);
        world.discord.react(source, otherForeign, world.carol);
        Message backup = backupOf("hi");

        UnknownReactionTally tally = replicator.replicate(source, backup, world.master);

        long placeholderReactions = world.discord.calls.stream().filter(c -> c.startsWith("react ")).count();
        assertEquals(1, placeholderReactions);
        assertEquals(1, tally.unknownCount(foreignBlob));
        assertEquals(1, tally.unknownCount(otherForeign));
    }

    @Test
    void replicate_dedicatedIdentityWithUsableEmojiLeavesNoFootnote() {
        Emoji shared = world.discord.emoji(SwarmWorld.BACKUP_GUILD, "shared");
        Message source = world.discord.post(world.general.getId(), world.alice, "hi");
        world.discord.react(source, shared, world.alice);
        world.discord.react(source, THUMBS, world.alice);
        Message backup = world.aliceIdentity.send("general", OutboundMessage.silent("hi"));

        UnknownReactionTally tally = replicator.replicate(source, backup, world.aliceIdentity);

        assertTrue(tally.isEmpty());
        assertEquals(2, world.discord.reactionsOn(backup.getId()).size());
        assertEquals("hi", world.discord.messages(backupChannel.getId()).get(0).getContent());
    }

    @Test
    void replicate_masterReactionCountsAsUnknown() {
        Message source = world.discord.post(world.general.getId(), world.bob, "hi");
        world.discord.react(source, THUMBS, world.bob, world.alice);
        Message backup = backupOf("hi");

        UnknownReactionTally tally = replicator.replicate(source, backup, world.master);

        assertEquals(List.of(world.aliceProxyAccount.getId(), world.masterAccount.getId()),
                world.discord.reactionsOn(backup.getId()).get("👍"));
        assertEquals(1, tally.unknownCount(THUMBS));
        assertTrue(tally.fallbacks(THUMBS).isEmpty());
    }

    @Test
    void replicate_pagesThroughReactingUsers() {
        List<User> crowd = new ArrayList<>();
        for (int i = 0; i < 150; i++) {
            crowd.add(world.discord.user(String.format("4%017d", i), "user" + i));
        }
        Message source = world.discord.post(world.general.getId(), world.bob, "popular");
        world.discord.react(source, THUMBS, crowd.toArray(new User[0]));
        world.discord.react(source, THUMBS, world.alice);
        Message backup = backupOf("popular");

        replicator.replicate(source, backup, world.master);

        assertEquals(List.of(world.aliceProxyAccount.getId(), world.masterAccount.getId()),
                world.discord.reactionsOn(backup.getId()).get("👍"));
    }

    @Test
    void replicate_longMessageGetsFootnoteAsFollowUp() {
        Message source = world.discord.post(world.general.getId(), world.bob, "long");
        world.discord.react(source, foreignBlob, world.bob);
        String longText = "x".repeat(1990);
        Message backup = backupOf(longText);

        replicator.replicate(source, backup, world.master);

        List<Message> inBackup = world.discord.messages(backupChannel.getId());
        assertEquals(2, inBackup.size());
        assertEquals(longText, inBackup.get(0).getContent());
        assertEquals("**Unknown Reactions**\n:blob: + 1 unknown", inBackup.get(1).getContent());
    }

    @Test
    void replicate_noReactionsDoesNothing() {
        Message source = world.discord.post(world.general.getId(), world.bob, "quiet");
        Message backup = backupOf("quiet");
        int callsBefore = world.discord.calls.size();

        assertTrue(replicator.replicate(source, backup, world.master).isEmpty());
        assertEquals(callsBefore, world.discord.calls.size());
    }
}
