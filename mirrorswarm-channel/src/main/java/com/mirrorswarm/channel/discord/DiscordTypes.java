package com.mirrorswarm.channel.discord;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Discord REST and gateway payload types.
 * Field names are camelCase here and snake_case on the wire, see
 * {@link DiscordJson}.
 */
public final class DiscordTypes {

    private DiscordTypes() {
    }

    // Channel type ids
    public static final int GUILD_TEXT = 0;
    public static final int GUILD_CATEGORY = 4;
    public static final int ANNOUNCEMENT_THREAD = 10;
    public static final int PUBLIC_THREAD = 11;
    public static final int PRIVATE_THREAD = 12;

    // Message type ids
    public static final int MESSAGE_DEFAULT = 0;
    public static final int MESSAGE_THREAD_CREATED = 18;
    public static final int MESSAGE_REPLY = 19;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class User {
        private String id;
        private String username;
        private String globalName;
        private String avatar;
        private boolean bot;

        /** Mention token rendering this user. */
        public String mention() {
            return "<@" + id + ">";
        }

        /** Display name: global name when set, else username. */
        @JsonIgnore
        public String getDisplayName() {
            return globalName != null && !globalName.isBlank() ? globalName : username;
        }

        /** CDN URL of the avatar, or null when the user has the default avatar. */
        @JsonIgnore
        public String getAvatarUrl() {
            if (avatar == null) {
                return null;
            }
            String ext = avatar.startsWith("a_") ? "gif" : "png";
            return "https://cdn.discordapp.com/avatars/" + id + "/" + avatar + "." + ext + "?size=512";
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Member {
        private User user;
        private String guildId;
        private String nick;
        @Builder.Default
        private List<String> roles = new ArrayList<>();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Role {
        private String id;
        private String name;
        private int color;
        private int position;
        private boolean managed;

        public String mention() {
            return "<@&" + id + ">";
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Emoji {
        /** Null for unicode emoji. */
        private String id;
        private String name;
        private boolean animated;

        @JsonIgnore
        public boolean isCustom() {
            return id != null && !id.isBlank();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Channel {
        private String id;
        private String name;
        private int type;
        private String guildId;
        /** Parent text channel for threads, category for text channels. */
        private String parentId;

        @JsonIgnore
        public boolean isThread() {
            return type == PUBLIC_THREAD || type == PRIVATE_THREAD || type == ANNOUNCEMENT_THREAD;
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Attachment {
        private String id;
        private String filename;
        private String url;
        private long size;
        private String contentType;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Reaction {
        private int count;
        private Emoji emoji;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Message {
        private String id;
        private String channelId;
        private String guildId;
        private User author;
        private Member member;
        private String content;
        private OffsetDateTime timestamp;
        private int type;
        private String webhookId;
        @Builder.Default
        private List<Attachment> attachments = new ArrayList<>();
        @Builder.Default
        private List<Map<String, Object>> embeds = new ArrayList<>();
        @Builder.Default
        private List<Reaction> reactions = new ArrayList<>();
    }

    /**
     * Body of a create-message request.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class OutboundMessage {
        private String content;
        private List<Map<String, Object>> embeds;
        private Map<String, Object> allowedMentions;

        /** Plain text message that never pings anyone. */
        public static OutboundMessage silent(String content) {
            return OutboundMessage.builder()
                    .content(content)
                    .allowedMentions(Map.of("parse", List.of()))
                    .build();
        }
    }

    /**
     * Embed type of a raw embed payload ("rich", "link", "image", ...).
     */
    public static String embedType(Map<String, Object> embed) {
        Object type = embed != null ? embed.get("type") : null;
        return type instanceof String s ? s : "rich";
    }
}
