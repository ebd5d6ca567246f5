package com.mirrorswarm.channel.discord;

import java.util.Comparator;

/**
 * Helpers for Discord ids (snowflakes): decimal strings that sort by creation
 * time when compared numerically.
 */
public final class Snowflakes {

    private Snowflakes() {
    }

    /** Numeric order without parsing: shorter ids are older. */
    public static final Comparator<String> ORDER = Comparator.comparingInt(String::length)
            .thenComparing(Comparator.naturalOrder());

    /**
     * Whether {@code raw} is a non-empty run of ASCII digits.
     */
    public static boolean isSnowflake(String raw) {
        if (raw == null || raw.isEmpty()) {
            return false;
        }
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
