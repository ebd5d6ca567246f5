package com.mirrorswarm.common.logging;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Masks bot tokens and authorization headers before they reach the log.
 */
public final class TokenRedact {

    private TokenRedact() {
    }

    private static final int MIN_TOKEN_LENGTH = 18;
    private static final int KEEP_START = 6;
    private static final int KEEP_END = 4;

    private static final List<Pattern> PATTERNS = List.of(
            // Authorization headers
            Pattern.compile("Authorization\\s*[:=]\\s*Bot\\s+([A-Za-z0-9._\\-]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bBot\\s+([A-Za-z0-9._\\-]{18,})"),
            // JSON fields
            Pattern.compile("\"(?:masterToken|token)\"\\s*:\\s*\"([^\"]+)\""),
            // Discord bot tokens: base64 user id . timestamp . hmac
            Pattern.compile("\\b([MNO][A-Za-z\\d_-]{23,25}\\.[A-Za-z\\d_-]{6}\\.[A-Za-z\\d_-]{27,38})\\b"));

    /**
     * Redact every token-looking value in {@code text}.
     */
    public static String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : PATTERNS) {
            result = redactWithPattern(result, pattern);
        }
        return result;
    }

    /**
     * Mask a single token, preserving start/end characters.
     */
    public static String maskToken(String token) {
        if (token == null || token.length() < MIN_TOKEN_LENGTH) {
            return "***";
        }
        return token.substring(0, KEEP_START) + "…" + token.substring(token.length() - KEEP_END);
    }

    private static String redactWithPattern(String text, Pattern pattern) {
        Matcher matcher = pattern.matcher(text);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String fullMatch = matcher.group(0);
            String token = matcher.group(1);
            String replacement = token.equals(fullMatch)
                    ? maskToken(token)
                    : fullMatch.replace(token, maskToken(token));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
