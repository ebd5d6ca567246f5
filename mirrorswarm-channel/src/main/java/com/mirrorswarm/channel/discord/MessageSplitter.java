package com.mirrorswarm.channel.discord;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits text that exceeds Discord's message length into several messages,
 * keeping fenced code blocks balanced across the parts.
 */
public final class MessageSplitter {

    private MessageSplitter() {
    }

    public static final int TEXT_LIMIT = 2000;

    private static final Pattern FENCE_RE = Pattern.compile("^( {0,3})(`{3,}|~{3,})(.*)$");

    /**
     * Split with the platform limit.
     */
    public static List<String> split(String text) {
        return split(text, TEXT_LIMIT);
    }

    /**
     * Split {@code text} into parts of at most {@code maxChars} characters.
     * Empty input yields an empty list.
     */
    public static List<String> split(String text, int maxChars) {
        int charLimit = Math.max(1, maxChars);
        String body = text != null ? text : "";
        if (body.isEmpty())
            return List.of();
        if (body.length() <= charLimit)
            return List.of(body);

        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        Fence openFence = null;

        for (String line : body.split("\n", -1)) {
            Fence fenceInfo = parseFenceLine(line);
            Fence nextOpenFence = openFence;
            if (fenceInfo != null) {
                if (openFence == null) {
                    nextOpenFence = fenceInfo;
                } else if (openFence.markerChar == fenceInfo.markerChar
                        && fenceInfo.markerLen >= openFence.markerLen) {
                    nextOpenFence = null;
                }
            }

            int reserve = nextOpenFence != null ? closeLine(nextOpenFence).length() + 1 : 0;
            int effectiveLimit = Math.max(1, charLimit - reserve);
            if (current.length() > 0 && current.length() + 1 + line.length() > effectiveLimit) {
                flush(parts, current, openFence);
            }
            int reopenLen = openFence != null ? openFence.openLine.length() + 1 : 0;
            int room = effectiveLimit - (current.length() > 0 ? current.length() + 1 : 0);
            List<String> segments = splitLongLine(line, Math.max(1, room),
                    Math.max(1, effectiveLimit - reopenLen), openFence != null);

            for (int i = 0; i < segments.size(); i++) {
                if (i > 0) {
                    flush(parts, current, openFence);
                }
                if (current.length() > 0) {
                    current.append('\n');
                }
                current.append(segments.get(i));
            }
            openFence = nextOpenFence;
        }

        if (current.length() > 0) {
            String payload = closeIfNeeded(current.toString(), openFence);
            if (!payload.isBlank())
                parts.add(payload);
        }
        return parts;
    }

    /**
     * Close the current part and start the next one, reopening the fence the
     * part ended inside of.
     */
    private static void flush(List<String> parts, StringBuilder current, Fence openFence) {
        String payload = closeIfNeeded(current.toString(), openFence);
        if (!payload.isBlank())
            parts.add(payload);
        current.setLength(0);
        if (openFence != null) {
            current.append(openFence.openLine);
        }
    }

    private record Fence(String indent, char markerChar, int markerLen, String openLine) {
    }

    private static Fence parseFenceLine(String line) {
        Matcher m = FENCE_RE.matcher(line);
        if (!m.matches())
            return null;
        String marker = m.group(2);
        return new Fence(m.group(1), marker.charAt(0), marker.length(), line);
    }

    private static String closeLine(Fence f) {
        return f.indent + String.valueOf(f.markerChar).repeat(f.markerLen);
    }

    private static String closeIfNeeded(String text, Fence fence) {
        if (fence == null)
            return text;
        return text.endsWith("\n") ? text + closeLine(fence) : text + "\n" + closeLine(fence);
    }

    /**
     * Break a line that cannot fit; the first piece fits what is left of the
     * current part, later pieces get a full part. Breaks on whitespace outside
     * code fences.
     */
    private static List<String> splitLongLine(String line, int firstLimit, int fullLimit,
            boolean insideFence) {
        if (line.length() <= firstLimit)
            return List.of(line);

        List<String> out = new ArrayList<>();
        String remaining = line;
        int limit = firstLimit;
        while (remaining.length() > limit) {
            int breakIdx = limit;
            if (!insideFence) {
                for (int i = limit - 1; i > 0; i--) {
                    if (Character.isWhitespace(remaining.charAt(i))) {
                        breakIdx = i;
                        break;
                    }
                }
            }
            out.add(remaining.substring(0, breakIdx));
            remaining = remaining.substring(breakIdx);
            limit = fullLimit;
        }
        if (!remaining.isEmpty())
            out.add(remaining);
        return out;
    }
}
