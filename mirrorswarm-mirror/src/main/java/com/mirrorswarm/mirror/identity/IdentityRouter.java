package com.mirrorswarm.mirror.identity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps source users to the identity that acts for them. Users without a
 * dedicated identity are served by the default one.
 */
public class IdentityRouter {

    private final ProxyIdentity master;
    private final Map<String, ProxyIdentity> roster;

    public IdentityRouter(ProxyIdentity master, Collection<ProxyIdentity> dedicated) {
        if (!master.isDefault()) {
            throw new IllegalArgumentException("Router needs the default identity, got " + master);
        }
        this.master = master;
        Map<String, ProxyIdentity> byUser = new LinkedHashMap<>();
        for (ProxyIdentity identity : dedicated) {
            if (identity.isDefault()) {
                throw new IllegalArgumentException("Only one default identity is allowed");
            }
            if (byUser.putIfAbsent(identity.key(), identity) != null) {
                throw new IllegalArgumentException("Duplicate identity for source user " + identity.key());
            }
        }
        this.roster = Collections.unmodifiableMap(byUser);
    }

    /**
     * The identity to act for {@code sourceUserId}: its dedicated identity, or
     * the default identity.
     */
    public ProxyIdentity route(String sourceUserId) {
        if (sourceUserId == null) {
            return master;
        }
        return roster.getOrDefault(sourceUserId, master);
    }

    public boolean hasDedicated(String sourceUserId) {
        return sourceUserId != null && roster.containsKey(sourceUserId);
    }

    public ProxyIdentity master() {
        return master;
    }

    /** Dedicated identities in roster order. */
    public List<ProxyIdentity> dedicated() {
        return List.copyOf(roster.values());
    }

    /** Default identity first, then the dedicated ones. */
    public List<ProxyIdentity> all() {
        List<ProxyIdentity> all = new ArrayList<>(roster.size() + 1);
        all.add(master);
        all.addAll(roster.values());
        return all;
    }

    /**
     * Source user id to the user id of its proxy account.
     */
    public Map<String, String> mentionUsers() {
        Map<String, String> users = new LinkedHashMap<>();
        roster.forEach((sourceUserId, identity) -> users.put(sourceUserId, identity.self().getId()));
        return users;
    }

    /**
     * Account ids of every identity, used to ignore the swarm's own messages.
     */
    public Set<String> accountIds() {
        Set<String> ids = new HashSet<>();
        for (ProxyIdentity identity : all()) {
            ids.add(identity.self().getId());
        }
        return ids;
    }
}
