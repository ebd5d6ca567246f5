package com.mirrorswarm.mirror.sync;

import com.mirrorswarm.channel.discord.DiscordApi;
import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes.Member;
import com.mirrorswarm.channel.discord.DiscordTypes.Role;
import com.mirrorswarm.mirror.identity.IdentityRouter;
import com.mirrorswarm.mirror.identity.ProxyIdentity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps backup roles in step with the source guild, joined by name, and
 * colours dedicated identities like their source users.
 */
@Slf4j
public class RoleSynchronizer {

    private final IdentityRouter router;
    private final DiscordClient source;
    private final DiscordClient backup;
    private final String sourceGuildId;
    private final String backupGuildId;

    private volatile Map<String, String> roleMapping = Map.of();

    /**
     * @param source client reading the source guild
     * @param backup client managing roles in the backup guild
     */
    public RoleSynchronizer(IdentityRouter router, DiscordClient source, DiscordClient backup,
            String sourceGuildId, String backupGuildId) {
        this.router = router;
        this.source = source;
        this.backup = backup;
        this.sourceGuildId = sourceGuildId;
        this.backupGuildId = backupGuildId;
    }

    /** Source role id to backup role id, as of the last rebuild. */
    public Map<String, String> roleMapping() {
        return roleMapping;
    }

    /**
     * Join source and backup roles by name.
     */
    public Map<String, String> rebuildMapping() {
        Map<String, Role> backupByName = byName(backup.listRoles(backupGuildId));
        Map<String, String> mapping = new LinkedHashMap<>();
        for (Role role : source.listRoles(sourceGuildId)) {
            Role target = backupByName.get(role.getName());
            if (target != null) {
                mapping.put(role.getId(), target.getId());
            }
        }
        roleMapping = Map.copyOf(mapping);
        log.debug("Role mapping rebuilt: {} roles", mapping.size());
        return roleMapping;
    }

    /**
     * Create backup roles missing by name, give every dedicated identity the
     * backup role of its user's top coloured role, then rebuild the mapping.
     */
    public SyncReport syncRoles() {
        List<Role> sourceRoles = source.listRoles(sourceGuildId);
        Map<String, Role> backupByName = byName(backup.listRoles(backupGuildId));

        int created = 0;
        List<String> failures = new ArrayList<>();
        for (Role role : sourceRoles) {
            if (!isCopyable(role) || backupByName.containsKey(role.getName())) {
                continue;
            }
            try {
                backupByName.put(role.getName(), backup.createRole(backupGuildId, role.getName(), role.getColor()));
                created++;
                log.info("Created backup role {}", role.getName());
            } catch (DiscordApi.ApiError e) {
                failures.add("role " + role.getName() + ": " + e.getMessage());
            }
        }

        Map<String, Role> sourceById = new HashMap<>();
        sourceRoles.forEach(r -> sourceById.put(r.getId(), r));
        int coloured = 0;
        for (ProxyIdentity identity : router.dedicated()) {
            try {
                Member member = source.getMember(sourceGuildId, identity.key());
                Optional<Role> top = topColouredRole(member, sourceById);
                Role target = top.map(r -> backupByName.get(r.getName())).orElse(null);
                if (target != null) {
                    backup.addMemberRole(backupGuildId, identity.self().getId(), target.getId());
                    coloured++;
                }
            } catch (DiscordApi.ApiError e) {
                log.warn("[{}] Role assignment failed: {}", identity.key(), e.getMessage());
                failures.add(identity.key() + ": " + e.getMessage());
            }
        }
        rebuildMapping();
        for (ProxyIdentity identity : router.all()) {
            identity.refreshDirectories();
        }
        log.info("Role sync: {} roles created, {} identities coloured", created, coloured);
        return new SyncReport(created + coloured, failures);
    }

    static Optional<Role> topColouredRole(Member member, Map<String, Role> rolesById) {
        return member.getRoles().stream()
                .map(rolesById::get)
                .filter(r -> r != null && r.getColor() != 0)
                .max(Comparator.comparingInt(Role::getPosition));
    }

    private boolean isCopyable(Role role) {
        return !role.isManaged() && !"@everyone".equals(role.getName()) && !sourceGuildId.equals(role.getId());
    }

    private static Map<String, Role> byName(List<Role> roles) {
        Map<String, Role> map = new LinkedHashMap<>();
        roles.forEach(r -> map.putIfAbsent(r.getName(), r));
        return map;
    }
}
