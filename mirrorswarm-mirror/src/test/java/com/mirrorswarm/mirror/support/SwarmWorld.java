package com.mirrorswarm.mirror.support;

import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import com.mirrorswarm.common.config.MirrorSwarmConfig;
import com.mirrorswarm.mirror.identity.IdentityRouter;
import com.mirrorswarm.mirror.identity.ProxyIdentity;

import java.util.List;
import java.util.Map;

/**
 * A source guild with a console and one monitored channel, an empty backup
 * guild, and a swarm of the master plus one dedicated identity for alice.
 * Bob and carol have no dedicated identity.
 */
public class SwarmWorld {

    public static final String SOURCE_GUILD = "100000000000000001";
    public static final String BACKUP_GUILD = "200000000000000002";

    public final FakeDiscord discord = new FakeDiscord();

    public final User masterAccount = discord.user("900000000000000001", "mirror-master");
    public final User aliceProxyAccount = discord.user("900000000000000002", "alice-proxy");

    public final User alice = discord.user("300000000000000001", "alice");
    public final User bob = discord.user("300000000000000002", "bob");
    public final User carol = discord.user("300000000000000003", "carol");

    public final Channel general;
    public final Channel console;

    public final ProxyIdentity master;
    public final ProxyIdentity aliceIdentity;
    public final IdentityRouter router;

    public SwarmWorld() {
        discord.guild(SOURCE_GUILD);
        discord.guild(BACKUP_GUILD);
        discord.member(SOURCE_GUILD, alice, "Alice A");
        discord.member(SOURCE_GUILD, bob, null);
        discord.member(SOURCE_GUILD, carol, null);
        general = discord.textChannel(SOURCE_GUILD, "general");
        console = discord.textChannel(SOURCE_GUILD, "console");

        master = ProxyIdentity.master(discord.client(masterAccount), BACKUP_GUILD);
        aliceIdentity = ProxyIdentity.dedicated(alice.getId(), discord.client(aliceProxyAccount), BACKUP_GUILD);
        router = new IdentityRouter(master, List.of(aliceIdentity));
    }

    public MirrorSwarmConfig config() {
        MirrorSwarmConfig config = new MirrorSwarmConfig();
        config.setMasterToken("master-token");
        config.setSourceGuildId(SOURCE_GUILD);
        config.setBackupGuildId(BACKUP_GUILD);
        config.setMonitoredChannelIds(List.of(general.getId()));
        config.setConsoleChannelId(console.getId());
        config.setSwarm(Map.of(alice.getId(), "alice-token"));
        config.setConfirmTimeoutSeconds(5);
        config.setStats(new MirrorSwarmConfig.StatsConfig());
        config.setUnknownEmoji(new MirrorSwarmConfig.UnknownEmojiConfig());
        config.setDiscord(new MirrorSwarmConfig.DiscordConfig());
        config.setLogging(new MirrorSwarmConfig.LoggingConfig());
        return config;
    }

    /** Create the backup channel named like {@code source} and load every directory. */
    public Channel mirrorChannel(Channel source) {
        Channel backup = discord.textChannel(BACKUP_GUILD, source.getName());
        router.all().forEach(ProxyIdentity::refreshDirectories);
        return backup;
    }

    public Channel backup(String name) {
        return discord.channelNamed(BACKUP_GUILD, name);
    }
}
