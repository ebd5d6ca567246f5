package com.mirrorswarm.channel.discord;

import com.mirrorswarm.channel.discord.DiscordTypes.Emoji;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscordEmojisTest {

    private static final Emoji THUMBS = Emoji.builder().name("👍").build();
    private static final Emoji BLOB = Emoji.builder().id("123").name("blob").build();
    private static final Emoji PARTY = Emoji.builder().id("456").name("party").animated(true).build();

    @Test
    void reactionKey_unicodeIsRawName() {
        assertEquals("👍", DiscordEmojis.reactionKey(THUMBS));
    }

    @Test
    void reactionKey_customIsNameColonId() {
        assertEquals("blob:123", DiscordEmojis.reactionKey(BLOB));
        assertEquals("_:789", DiscordEmojis.reactionKey(Emoji.builder().id("789").build()));
    }

    @Test
    void render_marksAnimatedEmoji() {
        assertEquals("<:blob:123>", DiscordEmojis.render(BLOB));
        assertEquals("<a:party:456>", DiscordEmojis.render(PARTY));
        assertEquals("👍", DiscordEmojis.render(THUMBS));
    }

    @Test
    void label_customEmojiUsesColonName() {
        assertEquals(":blob:", DiscordEmojis.label(BLOB));
        assertEquals("👍", DiscordEmojis.label(THUMBS));
    }

    @Test
    void normalizeEmojiName_replacesInvalidCharacters() {
        assertEquals("unknown_emoji", DiscordEmojis.normalizeEmojiName("unknown-emoji"));
    }

    @Test
    void normalizeEmojiName_rejectsBadLength() {
        assertThrows(IllegalArgumentException.class, () -> DiscordEmojis.normalizeEmojiName("x"));
        assertThrows(IllegalArgumentException.class, () -> DiscordEmojis.normalizeEmojiName("a".repeat(33)));
    }

    @Test
    void snowflakes_orderNumericallyWithoutParsing() {
        assertTrue(Snowflakes.ORDER.compare("999", "1000") < 0);
        assertTrue(Snowflakes.ORDER.compare("1002", "1001") > 0);
        assertTrue(Snowflakes.isSnowflake("123456789012345678"));
        assertFalse(Snowflakes.isSnowflake("12a4"));
        assertFalse(Snowflakes.isSnowflake(""));
        assertFalse(Snowflakes.isSnowflake("-12"));
    }
}
