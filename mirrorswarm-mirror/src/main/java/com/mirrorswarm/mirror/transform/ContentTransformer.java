package com.mirrorswarm.mirror.transform;

import com.mirrorswarm.channel.discord.DiscordTypes.User;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites source message text for the backup guild.
 * <p>
 * Steps, in order:
 * <ol>
 * <li>user mentions of roster users point at their proxy account</li>
 * <li>role mentions point at the backup role of the same name</li>
 * <li>{@code @everyone} and {@code @here} are neutered</li>
 * <li>batch imports are prefixed with the source timestamp</li>
 * <li>messages sent by the default identity name their author</li>
 * </ol>
 * Unknown or malformed tokens are left as they are. Steps 1-3 are idempotent.
 */
public class ContentTransformer {

    public static final String ZERO_WIDTH_SPACE = "\u200B";
    public static final String ATTRIBUTION_PREFIX = "-# sent by ";

    private static final Pattern USER_MENTION = Pattern.compile("<@!?(\\d+)>");
    private static final Pattern ROLE_MENTION = Pattern.compile("<@&(\\d+)>");
    private static final Pattern BROADCAST = Pattern.compile("@(everyone|here)");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("MM/dd/yyyy hh:mma", Locale.US);

    private final ZoneOffset offset;

    public ContentTransformer(ZoneOffset offset) {
        this.offset = offset != null ? offset : ZoneOffset.UTC;
    }

    /**
     * Full pipeline.
     *
     * @param sentByDefault whether the default identity will send the result
     */
    public String transform(String raw, boolean batchImport, OffsetDateTime timestamp, User author,
            boolean sentByDefault, MentionDirectory mentions) {
        String text = rewrite(raw, mentions);
        if (batchImport && timestamp != null) {
            text = stamp(timestamp) + (text.isEmpty() ? "" : " " + text);
        }
        if (sentByDefault && author != null) {
            String attribution = ATTRIBUTION_PREFIX + author.getDisplayName();
            text = text.isEmpty() ? attribution : text + "\n" + attribution;
        }
        return text;
    }

    /**
     * Mention substitution and broadcast neutering only.
     */
    public String rewrite(String raw, MentionDirectory mentions) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        MentionDirectory directory = mentions != null ? mentions : MentionDirectory.empty();
        String text = replaceIds(raw, USER_MENTION, directory.users(), "<@", ">");
        text = replaceIds(text, ROLE_MENTION, directory.roles(), "<@&", ">");
        return BROADCAST.matcher(text).replaceAll("@" + ZERO_WIDTH_SPACE + "$1");
    }

    /**
     * Timestamp annotation in the configured offset, e.g. {@code [03/14/2022 09:05PM]}.
     */
    public String stamp(OffsetDateTime timestamp) {
        return "[" + STAMP.format(timestamp.withOffsetSameInstant(offset)) + "]";
    }

    private static String replaceIds(String text, Pattern pattern, Map<String, String> ids,
            String open, String close) {
        if (ids.isEmpty()) {
            return text;
        }
        Matcher m = pattern.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String target = ids.get(m.group(1));
            String replacement = target != null ? open + target + close : m.group();
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }
}
