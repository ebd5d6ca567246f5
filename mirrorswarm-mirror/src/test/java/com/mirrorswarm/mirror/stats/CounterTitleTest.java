package com.mirrorswarm.mirror.stats;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CounterTitleTest {

    private static final String TOPIC = "Total Messages Sent";

    @Test
    void format_joinsTopicAndValue() {
        assertEquals("Total Messages Sent - 0", CounterTitle.format(TOPIC, 0));
    }

    @Test
    void parse_readsValue() {
        assertEquals(7, CounterTitle.parse(TOPIC, "Total Messages Sent - 7"));
        assertEquals(123456789012345678L, CounterTitle.parse(TOPIC, "Total Messages Sent - 123456789012345678"));
    }

    @Test
    void parse_rejectsMalformedTitles() {
        assertThrows(CounterFormatException.class, () -> CounterTitle.parse(TOPIC, "Total Messages - 7"));
        assertThrows(CounterFormatException.class, () -> CounterTitle.parse(TOPIC, "Total Messages Sent - "));
        assertThrows(CounterFormatException.class, () -> CounterTitle.parse(TOPIC, "Total Messages Sent - -1"));
        assertThrows(CounterFormatException.class, () -> CounterTitle.parse(TOPIC, "Total Messages Sent - 7 "));
        assertThrows(CounterFormatException.class,
                () -> CounterTitle.parse(TOPIC, "Total Messages Sent - 1234567890123456789"));
        assertThrows(CounterFormatException.class, () -> CounterTitle.parse(TOPIC, null));
    }

    @Test
    void statTopic_rejectsSeparatorInTitle() {
        assertThrows(IllegalArgumentException.class, () -> new StatTopic("a - b", m -> 1));
        assertThrows(IllegalArgumentException.class, () -> new StatTopic(" ", m -> 1));
    }
}
