package com.mirrorswarm.channel.discord;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Discord REST API constants and error type.
 */
public final class DiscordApi {

    private DiscordApi() {
    }

    public static final String API_BASE = "https://discord.com/api/v10";

    /** Retry parameters for rate-limited calls. */
    public static final int DEFAULT_RETRY_ATTEMPTS = 3;
    public static final int DEFAULT_MIN_DELAY_MS = 500;
    public static final int DEFAULT_MAX_DELAY_MS = 30_000;

    // JSON error codes
    public static final int UNKNOWN_CHANNEL = 10003;
    public static final int UNKNOWN_MESSAGE = 10008;
    public static final int UNKNOWN_EMOJI = 10014;
    public static final int MISSING_ACCESS = 50001;
    public static final int MISSING_PERMISSIONS = 50013;
    public static final int REACTION_BLOCKED = 90001;

    // =========================================================================
    // Error type
    // =========================================================================

    public static class ApiError extends RuntimeException {
        private final int status;
        private final int code;
        private final Double retryAfterSeconds;

        public ApiError(String message, int status, int code, Double retryAfterSeconds) {
            super(message);
            this.status = status;
            this.code = code;
            this.retryAfterSeconds = retryAfterSeconds;
        }

        public ApiError(String message, Throwable cause) {
            super(message, cause);
            this.status = 0;
            this.code = 0;
            this.retryAfterSeconds = null;
        }

        /** HTTP status, 0 when the request never got a response. */
        public int getStatus() {
            return status;
        }

        /** Discord JSON error code, 0 when absent. */
        public int getCode() {
            return code;
        }

        public Double getRetryAfterSeconds() {
            return retryAfterSeconds;
        }

        public boolean isNotFound() {
            return status == 404;
        }

        public boolean isRateLimited() {
            return status == 429;
        }
    }

    // =========================================================================
    // Error parsing
    // =========================================================================

    /**
     * Build an {@link ApiError} from an HTTP error response.
     */
    public static ApiError errorFromResponse(String method, String path, int status, String body) {
        int code = 0;
        Double retryAfter = null;
        String detail = formatErrorText(body);
        JsonNode json = parseQuietly(body);
        if (json != null) {
            code = json.path("code").asInt(0);
            if (json.hasNonNull("retry_after")) {
                retryAfter = json.get("retry_after").asDouble();
            }
        }
        String message = method + " " + path + " -> HTTP " + status
                + (detail != null ? ": " + detail : "");
        return new ApiError(message, status, code, retryAfter);
    }

    /**
     * Format a Discord API error JSON body into a human-readable message.
     * Extracts "message" and optional "retry_after" from the response payload.
     */
    public static String formatErrorText(String responseBody) {
        if (responseBody == null)
            return null;
        String trimmed = responseBody.trim();
        if (trimmed.isEmpty())
            return null;
        JsonNode json = parseQuietly(trimmed);
        if (json == null || !json.isObject()) {
            return trimmed;
        }
        String message = json.path("message").asText("");
        String msg = message.isEmpty() ? "unknown error" : message;
        if (json.hasNonNull("retry_after")) {
            double seconds = json.get("retry_after").asDouble();
            String formatted = seconds < 10 ? String.format(Locale.ROOT, "%.1fs", seconds)
                    : Math.round(seconds) + "s";
            return msg + " (retry after " + formatted + ")";
        }
        return msg;
    }

    /**
     * Check if an error is a rate limit (HTTP 429) and should be retried.
     */
    public static boolean isRateLimited(Throwable err) {
        return err instanceof ApiError apiError && apiError.isRateLimited();
    }

    private static JsonNode parseQuietly(String body) {
        if (body == null || body.isBlank() || !body.trim().startsWith("{")) {
            return null;
        }
        try {
            return DiscordJson.MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}
