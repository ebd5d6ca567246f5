package com.mirrorswarm.channel.discord;

import com.mirrorswarm.channel.discord.DiscordTypes.Emoji;

/**
 * Emoji formatting helpers for reactions and message text.
 */
public final class DiscordEmojis {

    private DiscordEmojis() {
    }

    /**
     * Identifier used in reaction endpoints: {@code name:id} for custom emoji,
     * the unicode sequence itself otherwise. Path encoding is left to the HTTP
     * layer.
     */
    public static String reactionKey(Emoji emoji) {
        if (emoji.isCustom()) {
            String name = emoji.getName() != null && !emoji.getName().isBlank() ? emoji.getName() : "_";
            return name + ":" + emoji.getId();
        }
        return emoji.getName();
    }

    /**
     * Inline rendering of an emoji in message text.
     */
    public static String render(Emoji emoji) {
        if (emoji.isCustom()) {
            String name = emoji.getName() != null && !emoji.getName().isBlank() ? emoji.getName() : "_";
            return (emoji.isAnimated() ? "<a:" : "<:") + name + ":" + emoji.getId() + ">";
        }
        return emoji.getName() != null ? emoji.getName() : "?";
    }

    /**
     * Label safe to print anywhere: custom emoji become {@code :name:} since
     * they may not render outside their home guild.
     */
    public static String label(Emoji emoji) {
        if (emoji.isCustom()) {
            return ":" + (emoji.getName() != null ? emoji.getName() : "_") + ":";
        }
        return emoji.getName() != null ? emoji.getName() : "?";
    }

    /**
     * Normalize an emoji name for upload (alphanumeric + underscores, 2-32 chars).
     */
    public static String normalizeEmojiName(String raw) {
        String name = raw == null ? "" : raw.trim().replaceAll("[^a-zA-Z0-9_]", "_");
        if (name.length() < 2 || name.length() > 32) {
            throw new IllegalArgumentException("Emoji name must be 2-32 alphanumeric/underscore characters: " + raw);
        }
        return name;
    }
}
