package com.mirrorswarm.mirror.reaction;

import com.mirrorswarm.channel.discord.DiscordEmojis;
import com.mirrorswarm.channel.discord.DiscordTypes.Emoji;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-emoji record of reactions the backup could not attribute to a proxy
 * account: dedicated identities that fell back to the placeholder, and the
 * number of reactions made by (or on behalf of) the default identity.
 */
public class UnknownReactionTally {

    public static final String FOOTNOTE_HEADER = "**Unknown Reactions**";

    private final Map<String, Line> lines = new LinkedHashMap<>();

    /** A dedicated identity had to use the placeholder for this emoji. */
    public void recordFallback(Emoji emoji, String identityMention) {
        line(emoji).fallbacks.add(identityMention);
    }

    /** The default identity acted for this emoji. */
    public void recordUnknown(Emoji emoji) {
        line(emoji).unknown++;
    }

    public boolean isEmpty() {
        return lines.values().stream().allMatch(Line::isEmpty);
    }

    public int unknownCount(Emoji emoji) {
        Line line = lines.get(DiscordEmojis.reactionKey(emoji));
        return line != null ? line.unknown : 0;
    }

    public Set<String> fallbacks(Emoji emoji) {
        Line line = lines.get(DiscordEmojis.reactionKey(emoji));
        return line != null ? Set.copyOf(line.fallbacks) : Set.of();
    }

    /**
     * The footnote block, or an empty string when nothing was tallied.
     *
     * <pre>
     * **Unknown Reactions**
     * :blob: &lt;@1&gt; &lt;@2&gt; + 1 unknown
     * </pre>
     */
    public String renderFootnote() {
        StringBuilder sb = new StringBuilder();
        for (Line line : lines.values()) {
            if (line.isEmpty()) {
                continue;
            }
            sb.append('\n').append(line.label);
            for (String mention : line.fallbacks) {
                sb.append(' ').append(mention);
            }
            if (line.unknown > 0) {
                sb.append(" + ").append(line.unknown).append(" unknown");
            }
        }
        return sb.length() == 0 ? "" : FOOTNOTE_HEADER + sb;
    }

    private Line line(Emoji emoji) {
        return lines.computeIfAbsent(DiscordEmojis.reactionKey(emoji), k -> new Line(DiscordEmojis.label(emoji)));
    }

    private static final class Line {
        final String label;
        final Set<String> fallbacks = new LinkedHashSet<>();
        int unknown;

        Line(String label) {
            this.label = label;
        }

        boolean isEmpty() {
            return fallbacks.isEmpty() && unknown == 0;
        }
    }
}
