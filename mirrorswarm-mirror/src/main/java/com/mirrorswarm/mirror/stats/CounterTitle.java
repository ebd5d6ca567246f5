package com.mirrorswarm.mirror.stats;

/**
 * Encoding of a counter value in a thread title: {@code "<topic> - <value>"}.
 */
public final class CounterTitle {

    private CounterTitle() {
    }

    public static final String SEPARATOR = " - ";

    public static String format(String topic, long value) {
        return topic + SEPARATOR + value;
    }

    public static boolean matches(String topic, String title) {
        return title != null && title.startsWith(topic + SEPARATOR);
    }

    /**
     * @throws CounterFormatException when the title lacks the topic prefix or
     *                                the suffix is not a non-negative integer
     */
    public static long parse(String topic, String title) {
        if (!matches(topic, title)) {
            throw new CounterFormatException("Thread title '" + title + "' does not start with '"
                    + topic + SEPARATOR + "'");
        }
        String suffix = title.substring(topic.length() + SEPARATOR.length());
        if (suffix.isEmpty() || suffix.length() > 18 || !suffix.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new CounterFormatException("Thread title '" + title + "' has no counter value");
        }
        return Long.parseLong(suffix);
    }
}
