package com.mirrorswarm.mirror.transform;

import java.util.Map;

/**
 * Id translation tables for mention rewriting: source user id to proxy user
 * id, and source role id to backup role id.
 */
public record MentionDirectory(Map<String, String> users, Map<String, String> roles) {

    public MentionDirectory {
        users = users != null ? Map.copyOf(users) : Map.of();
        roles = roles != null ? Map.copyOf(roles) : Map.of();
    }

    public static MentionDirectory empty() {
        return new MentionDirectory(Map.of(), Map.of());
    }
}
