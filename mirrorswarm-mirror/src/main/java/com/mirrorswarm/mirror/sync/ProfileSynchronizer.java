package com.mirrorswarm.mirror.sync;

import com.mirrorswarm.channel.discord.DiscordApi;
import com.mirrorswarm.channel.discord.DiscordClient;
import com.mirrorswarm.channel.discord.DiscordTypes.Member;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import com.mirrorswarm.mirror.identity.IdentityRouter;
import com.mirrorswarm.mirror.identity.ProxyIdentity;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Copies source users' avatar, username and nickname onto their dedicated
 * identities.
 */
@Slf4j
public class ProfileSynchronizer {

    private final IdentityRouter router;
    private final DiscordClient source;
    private final String sourceGuildId;
    private final Map<String, SyncedProfile> synced = new ConcurrentHashMap<>();

    public ProfileSynchronizer(IdentityRouter router, DiscordClient source, String sourceGuildId) {
        this.router = router;
        this.source = source;
        this.sourceGuildId = sourceGuildId;
    }

    public SyncReport syncAll() {
        int synced = 0;
        List<String> failures = new ArrayList<>();
        for (ProxyIdentity identity : router.dedicated()) {
            try {
                sync(identity);
                synced++;
            } catch (DiscordApi.ApiError e) {
                log.warn("[{}] Profile sync failed: {}", identity.key(), e.getMessage());
                failures.add(identity.key() + ": " + e.getMessage());
            }
        }
        return new SyncReport(synced, failures);
    }

    /**
     * Sync one dedicated identity from its source member. The avatar is only
     * downloaded and uploaded when its hash differs from the last one synced
     * onto this identity, and an unchanged nickname is not written again.
     */
    public void sync(ProxyIdentity identity) {
        if (identity.isDefault()) {
            throw new IllegalArgumentException("The default identity has no source user");
        }
        Member member = source.getMember(sourceGuildId, identity.key());
        User user = member.getUser();
        SyncedProfile last = synced.get(identity.key());

        byte[] avatar = null;
        String mimeType = null;
        String avatarUrl = user.getAvatarUrl();
        boolean avatarChanged = last == null || !Objects.equals(last.avatarHash(), user.getAvatar());
        if (avatarUrl != null && avatarChanged) {
            avatar = source.download(avatarUrl);
            mimeType = user.getAvatar().startsWith("a_") ? "image/gif" : "image/png";
        }
        String username = user.getUsername().equals(identity.self().getUsername()) ? null : user.getUsername();
        boolean accountChanged = username != null || avatar != null;
        if (accountChanged) {
            identity.client().modifyCurrentUser(username, avatar, mimeType);
        }

        String nick = member.getNick() != null ? member.getNick() : user.getDisplayName();
        boolean nickChanged = last == null || !Objects.equals(last.nick(), nick);
        if (nickChanged) {
            identity.client().modifyCurrentMemberNick(identity.backupGuildId(), nick);
        }
        synced.put(identity.key(), new SyncedProfile(user.getAvatar(), nick));

        if (accountChanged || nickChanged) {
            identity.refreshDirectories();
            log.info("[{}] Profile synced from {}", identity.key(), user.getUsername());
        } else {
            log.debug("[{}] Profile of {} unchanged", identity.key(), user.getUsername());
        }
    }

    /** What was last written onto an identity. */
    private record SyncedProfile(String avatarHash, String nick) {
    }
}
