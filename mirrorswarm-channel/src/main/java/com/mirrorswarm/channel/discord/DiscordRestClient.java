package com.mirrorswarm.channel.discord;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorswarm.channel.discord.DiscordTypes.Channel;
import com.mirrorswarm.channel.discord.DiscordTypes.Emoji;
import com.mirrorswarm.channel.discord.DiscordTypes.Member;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.OutboundMessage;
import com.mirrorswarm.channel.discord.DiscordTypes.Role;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link DiscordClient} over the Discord REST API using OkHttp.
 * <p>
 * HTTP 429 responses are retried up to {@link DiscordApi#DEFAULT_RETRY_ATTEMPTS}
 * times after the advertised {@code retry_after}.
 */
@Slf4j
public class DiscordRestClient implements DiscordClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
    private static final int THREAD_AUTO_ARCHIVE_WEEK = 10080;

    private final OkHttpClient apiClient;
    private final OkHttpClient cdnClient;
    private final HttpUrl baseUrl;
    private final ObjectMapper mapper = DiscordJson.MAPPER;

    public DiscordRestClient(String token, String apiBaseUrl) {
        this(token, apiBaseUrl, new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(Duration.ofSeconds(30))
                .build());
    }

    /**
     * Constructor for testing, allows injecting the HTTP client.
     */
    DiscordRestClient(String token, String apiBaseUrl, OkHttpClient httpClient) {
        HttpUrl parsed = HttpUrl.parse(apiBaseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid Discord API base URL: " + apiBaseUrl);
        }
        this.baseUrl = parsed;
        this.cdnClient = httpClient;
        String authorization = "Bot " + token;
        this.apiClient = httpClient.newBuilder()
                .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                        .header("Authorization", authorization)
                        .header("User-Agent", "DiscordBot (https://github.com/mirrorswarm, 0.1)")
                        .build()))
                .build();
    }

    // =========================================================================
    // Users and guild structure
    // =========================================================================

    @Override
    public User getCurrentUser() {
        return get(url("users", "@me").build(), User.class);
    }

    @Override
    public List<Channel> listGuildChannels(String guildId) {
        return getList(url("guilds", guildId, "channels").build(), Channel.class);
    }

    @Override
    public Channel createTextChannel(String guildId, String name) {
        return send("POST", url("guilds", guildId, "channels").build(),
                Map.of("name", name, "type", DiscordTypes.GUILD_TEXT), Channel.class);
    }

    @Override
    public Channel getChannel(String channelId) {
        return get(url("channels", channelId).build(), Channel.class);
    }

    @Override
    public List<Role> listRoles(String guildId) {
        return getList(url("guilds", guildId, "roles").build(), Role.class);
    }

    @Override
    public Role createRole(String guildId, String name, int color) {
        return send("POST", url("guilds", guildId, "roles").build(),
                Map.of("name", name, "color", color), Role.class);
    }

    @Override
    public List<Emoji> listEmojis(String guildId) {
        return getList(url("guilds", guildId, "emojis").build(), Emoji.class);
    }

    @Override
    public Emoji createEmoji(String guildId, String name, byte[] image, String mimeType) {
        return send("POST", url("guilds", guildId, "emojis").build(),
                Map.of("name", name, "image", dataUri(image, mimeType)), Emoji.class);
    }

    // =========================================================================
    // Members and profile
    // =========================================================================

    @Override
    public Member getMember(String guildId, String userId) {
        return get(url("guilds", guildId, "members", userId).build(), Member.class);
    }

    @Override
    public void addMemberRole(String guildId, String userId, String roleId) {
        execute("PUT", url("guilds", guildId, "members", userId, "roles", roleId).build(), null);
    }

    @Override
    public void modifyCurrentUser(String username, byte[] avatar, String mimeType) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (username != null) {
            body.put("username", username);
        }
        if (avatar != null) {
            body.put("avatar", dataUri(avatar, mimeType));
        }
        if (body.isEmpty()) {
            return;
        }
        execute("PATCH", url("users", "@me").build(), body);
    }

    @Override
    public void modifyCurrentMemberNick(String guildId, String nick) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("nick", nick);
        execute("PATCH", url("guilds", guildId, "members", "@me").build(), body);
    }

    // =========================================================================
    // Messages
    // =========================================================================

    @Override
    public Message sendMessage(String channelId, OutboundMessage message) {
        return send("POST", url("channels", channelId, "messages").build(), message, Message.class);
    }

    @Override
    public Message editMessage(String channelId, String messageId, String content) {
        return send("PATCH", url("channels", channelId, "messages", messageId).build(),
                Map.of("content", content), Message.class);
    }

    @Override
    public Message fetchMessage(String channelId, String messageId) {
        return get(url("channels", channelId, "messages", messageId).build(), Message.class);
    }

    @Override
    public List<Message> fetchMessagesAfter(String channelId, String afterId, int limit) {
        HttpUrl target = url("channels", channelId, "messages")
                .addQueryParameter("after", afterId)
                .addQueryParameter("limit", String.valueOf(clampLimit(limit)))
                .build();
        List<Message> page = new ArrayList<>(getList(target, Message.class));
        page.sort((a, b) -> Snowflakes.ORDER.compare(a.getId(), b.getId()));
        return page;
    }

    @Override
    public List<Message> fetchRecentMessages(String channelId, int limit) {
        HttpUrl target = url("channels", channelId, "messages")
                .addQueryParameter("limit", String.valueOf(clampLimit(limit)))
                .build();
        return getList(target, Message.class);
    }

    @Override
    public void deleteMessage(String channelId, String messageId) {
        execute("DELETE", url("channels", channelId, "messages", messageId).build(), null);
    }

    // =========================================================================
    // Reactions
    // =========================================================================

    @Override
    public void addReaction(String channelId, String messageId, String emojiKey) {
        execute("PUT", url("channels", channelId, "messages", messageId, "reactions", emojiKey, "@me").build(),
                null);
    }

    @Override
    public List<User> listReactionUsers(String channelId, String messageId, String emojiKey,
            String afterUserId, int limit) {
        HttpUrl.Builder target = url("channels", channelId, "messages", messageId, "reactions", emojiKey)
                .addQueryParameter("limit", String.valueOf(clampLimit(limit)));
        if (afterUserId != null) {
            target.addQueryParameter("after", afterUserId);
        }
        return getList(target.build(), User.class);
    }

    // =========================================================================
    // Threads
    // =========================================================================

    @Override
    public List<Channel> listActiveThreads(String guildId) {
        return threadsOf(url("guilds", guildId, "threads", "active").build());
    }

    @Override
    public List<Channel> listPublicArchivedThreads(String channelId) {
        return threadsOf(url("channels", channelId, "threads", "archived", "public").build());
    }

    @Override
    public Channel createThread(String channelId, String name, int autoArchiveMinutes) {
        int archive = autoArchiveMinutes > 0 ? autoArchiveMinutes : THREAD_AUTO_ARCHIVE_WEEK;
        return send("POST", url("channels", channelId, "threads").build(),
                Map.of("name", name, "type", DiscordTypes.PUBLIC_THREAD, "auto_archive_duration", archive),
                Channel.class);
    }

    @Override
    public Channel renameThread(String threadId, String name) {
        return send("PATCH", url("channels", threadId).build(),
                Map.of("name", name, "archived", false), Channel.class);
    }

    // =========================================================================
    // Files
    // =========================================================================

    @Override
    public byte[] download(String fileUrl) {
        Request request = new Request.Builder().url(fileUrl).get().build();
        try (Response response = cdnClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new DiscordApi.ApiError("GET " + fileUrl + " -> HTTP " + response.code(),
                        response.code(), 0, null);
            }
            return body.bytes();
        } catch (IOException e) {
            throw new DiscordApi.ApiError("GET " + fileUrl + " failed: " + e.getMessage(), e);
        }
    }

    // =========================================================================
    // HTTP plumbing
    // =========================================================================

    private HttpUrl.Builder url(String... segments) {
        HttpUrl.Builder builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    private List<Channel> threadsOf(HttpUrl target) {
        JsonNode threads = readTree(execute("GET", target, null)).path("threads");
        return mapper.convertValue(threads, new TypeReference<List<Channel>>() {
        });
    }

    private <T> T get(HttpUrl target, Class<T> type) {
        return read(execute("GET", target, null), mapper.constructType(type));
    }

    private <T> List<T> getList(HttpUrl target, Class<T> elementType) {
        return read(execute("GET", target, null),
                mapper.getTypeFactory().constructCollectionType(List.class, elementType));
    }

    private <T> T send(String method, HttpUrl target, Object body, Class<T> type) {
        return read(execute(method, target, body), mapper.constructType(type));
    }

    private <T> T read(String json, JavaType type) {
        try {
            return mapper.readValue(json, type);
        } catch (IOException e) {
            throw new DiscordApi.ApiError("Unexpected Discord payload for " + type.getTypeName(), e);
        }
    }

    private JsonNode readTree(String json) {
        try {
            return mapper.readTree(json);
        } catch (IOException e) {
            throw new DiscordApi.ApiError("Unexpected Discord payload", e);
        }
    }

    /**
     * Perform one request, retrying rate limits.
     *
     * @return response body, empty for 204
     */
    private String execute(String method, HttpUrl target, Object body) {
        RequestBody requestBody = null;
        if (body != null) {
            try {
                requestBody = RequestBody.create(mapper.writeValueAsString(body), JSON);
            } catch (IOException e) {
                throw new DiscordApi.ApiError("Cannot encode request body for " + method + " " + target.encodedPath(), e);
            }
        } else if (!"GET".equals(method) && !"DELETE".equals(method)) {
            requestBody = RequestBody.create(new byte[0], null);
        }
        Request request = new Request.Builder().url(target).method(method, requestBody).build();

        for (int attempt = 1; ; attempt++) {
            try (Response response = apiClient.newCall(request).execute()) {
                ResponseBody responseBody = response.body();
                String text = responseBody != null ? responseBody.string() : "";
                if (response.isSuccessful()) {
                    return text;
                }
                DiscordApi.ApiError error = DiscordApi.errorFromResponse(method, target.encodedPath(),
                        response.code(), text);
                if (!error.isRateLimited() || attempt >= DiscordApi.DEFAULT_RETRY_ATTEMPTS) {
                    throw error;
                }
                long waitMs = retryDelayMs(error.getRetryAfterSeconds());
                log.debug("Rate limited on {} {}, retrying in {}ms (attempt {})",
                        method, target.encodedPath(), waitMs, attempt);
                sleep(waitMs);
            } catch (IOException e) {
                throw new DiscordApi.ApiError(method + " " + target.encodedPath() + " failed: " + e.getMessage(), e);
            }
        }
    }

    static long retryDelayMs(Double retryAfterSeconds) {
        long ms = retryAfterSeconds != null ? Math.round(retryAfterSeconds * 1000) : DiscordApi.DEFAULT_MIN_DELAY_MS;
        return Math.max(DiscordApi.DEFAULT_MIN_DELAY_MS, Math.min(DiscordApi.DEFAULT_MAX_DELAY_MS, ms));
    }

    private static void sleep(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiscordApi.ApiError("Interrupted while waiting out a rate limit", e);
        }
    }

    private static int clampLimit(int limit) {
        return Math.max(1, Math.min(100, limit));
    }

    private static String dataUri(byte[] image, String mimeType) {
        String type = mimeType != null ? mimeType : "image/png";
        return "data:" + type + ";base64," + Base64.getEncoder().encodeToString(image);
    }
}
