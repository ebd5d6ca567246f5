package com.mirrorswarm.mirror.sync;

import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes.Role;
import com.mirrorswarm.mirror.support.SwarmWorld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RoleSynchronizerTest {

    private SwarmWorld world;
    private RoleSynchronizer roles;
    private Role mods;
    private Role vip;
    private Role grey;

    @BeforeEach
    void setUp() {
        world = new SwarmWorld();
        DiscordClient master = world.discord.client(world.masterAccount);
        roles = new RoleSynchronizer(world.router, master, master, SwarmWorld.SOURCE_GUILD, SwarmWorld.BACKUP_GUILD);
        mods = world.discord.role(SwarmWorld.SOURCE_GUILD, "mods", 0x00ff00, 5);
        vip = world.discord.role(SwarmWorld.SOURCE_GUILD, "vip", 0xff00ff, 2);
        grey = world.discord.role(SwarmWorld.SOURCE_GUILD, "lurkers", 0, 9);
        world.discord.memberOf(SwarmWorld.SOURCE_GUILD, world.alice.getId()).getRoles()
                .addAll(List.of(vip.getId(), mods.getId(), grey.getId()));
    }

    @Test
    void syncRoles_createsMissingRolesAndColoursProxy() {
        world.discord.role(SwarmWorld.BACKUP_GUILD, "vip", 0xff00ff, 1);

        SyncReport report = roles.syncRoles();

        List<String> backupNames = world.discord.roles(SwarmWorld.BACKUP_GUILD).stream().map(Role::getName).toList();
        assertTrue(backupNames.containsAll(List.of("@everyone", "vip", "mods", "lurkers")));
        assertEquals(1, backupNames.stream().filter("vip"::equals).count());
        assertEquals(1, backupNames.stream().filter("@everyone"::equals).count());

        Role backupMods = world.aliceIdentity.role("mods").orElseThrow();
        assertEquals(List.of(backupMods.getId()),
                world.discord.memberOf(SwarmWorld.BACKUP_GUILD, world.aliceProxyAccount.getId()).getRoles());
        assertEquals(3, report.succeeded());
        assertTrue(report.failures().isEmpty());
    }

    @Test
    void rebuildMapping_joinsRolesByName() {
        Role backupVip = world.discord.role(SwarmWorld.BACKUP_GUILD, "vip", 0, 1);

        Map<String, String> mapping = roles.rebuildMapping();

        assertEquals(backupVip.getId(), mapping.get(vip.getId()));
        assertFalse(mapping.containsKey(mods.getId()));
        assertEquals(SwarmWorld.BACKUP_GUILD, mapping.get(SwarmWorld.SOURCE_GUILD));
        assertSame(mapping, roles.roleMapping());
    }

    @Test
    void topColouredRole_picksHighestPositionWithColour() {
        Map<String, Role> byId = Map.of(mods.getId(), mods, vip.getId(), vip, grey.getId(), grey);

        assertEquals(mods, RoleSynchronizer.topColouredRole(
                world.discord.memberOf(SwarmWorld.SOURCE_GUILD, world.alice.getId()), byId).orElseThrow());
        assertTrue(RoleSynchronizer.topColouredRole(
                world.discord.memberOf(SwarmWorld.SOURCE_GUILD, world.bob.getId()), byId).isEmpty());
    }
}
