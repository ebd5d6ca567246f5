package com.mirrorswarm.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mirrorswarm.channel.discord.DiscordTypes.Member;
import com.mirrorswarm.channel.discord.DiscordTypes.Message;
import com.mirrorswarm.channel.discord.DiscordTypes.User;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One Discord gateway session over an OkHttp WebSocket.
 * <p>
 * HELLO starts the heartbeat and triggers IDENTIFY. Dispatches are decoded
 * and handed to the {@link GatewayListener} on a single dispatch thread, so
 * events of one session are processed strictly in arrival order. Reconnect
 * requests and dropped sockets open a fresh session after a short delay.
 */
@Slf4j
public class DiscordGateway implements AutoCloseable {

    // Gateway opcodes
    static final int OP_DISPATCH = 0;
    static final int OP_HEARTBEAT = 1;
    static final int OP_IDENTIFY = 2;
    static final int OP_RECONNECT = 7;
    static final int OP_INVALID_SESSION = 9;
    static final int OP_HELLO = 10;
    static final int OP_HEARTBEAT_ACK = 11;

    // Intent bits
    public static final int INTENT_GUILDS = 1;
    public static final int INTENT_GUILD_MEMBERS = 1 << 1;
    public static final int INTENT_GUILD_MESSAGES = 1 << 9;
    public static final int INTENT_GUILD_MESSAGE_REACTIONS = 1 << 10;
    public static final int INTENT_MESSAGE_CONTENT = 1 << 15;

    public static final int DEFAULT_INTENTS = INTENT_GUILDS | INTENT_GUILD_MEMBERS
            | INTENT_GUILD_MESSAGES | INTENT_GUILD_MESSAGE_REACTIONS | INTENT_MESSAGE_CONTENT;

    private static final long RECONNECT_DELAY_MS = 5_000;

    private final String name;
    private final String token;
    private final String gatewayUrl;
    private final int intents;
    private final GatewayListener listener;
    private final OkHttpClient client;
    private final ObjectMapper mapper = DiscordJson.MAPPER;
    private final ExecutorService dispatcher;
    private final ScheduledExecutorService heartbeats;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong sequence = new AtomicLong(-1);

    private volatile WebSocket socket;
    private volatile ScheduledFuture<?> heartbeatTask;
    private volatile boolean awaitingAck;

    public DiscordGateway(String name, String token, String gatewayUrl, GatewayListener listener) {
        this(name, token, gatewayUrl, DEFAULT_INTENTS, listener);
    }

    /**
     * @param intents gateway intent bits, see the {@code INTENT_*} constants
     */
    public DiscordGateway(String name, String token, String gatewayUrl, int intents, GatewayListener listener) {
        this(name, token, gatewayUrl, intents, listener, new OkHttpClient.Builder()
                .readTimeout(0, TimeUnit.MILLISECONDS) // WebSocket: no read timeout
                .build());
    }

    DiscordGateway(String name, String token, String gatewayUrl, int intents,
            GatewayListener listener, OkHttpClient client) {
        this.name = name;
        this.token = token;
        this.gatewayUrl = gatewayUrl;
        this.intents = intents;
        this.listener = listener;
        this.client = client;
        this.dispatcher = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "gateway-" + name);
            t.setDaemon(true);
            return t;
        });
        this.heartbeats = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "heartbeat-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Open the socket. Returns immediately; readiness is signalled through
     * {@link GatewayListener#onReady}.
     */
    public void connect() {
        if (closed.get()) {
            throw new IllegalStateException("Gateway " + name + " is closed");
        }
        log.info("[{}] Connecting to gateway", name);
        socket = client.newWebSocket(new Request.Builder().url(gatewayUrl).build(), new Listener());
    }

    /**
     * The single thread dispatch events are delivered on. Work submitted here
     * is serialized with event handling.
     */
    public Executor dispatchExecutor() {
        return dispatcher;
    }

    public boolean isOpen() {
        return socket != null && !closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        stopHeartbeat();
        WebSocket ws = socket;
        if (ws != null) {
            ws.close(1000, "shutdown");
        }
        heartbeats.shutdownNow();
        dispatcher.shutdown();
        log.info("[{}] Gateway closed", name);
    }

    // =========================================================================
    // Protocol handling
    // =========================================================================

    void handleFrame(WebSocket ws, String text) {
        JsonNode frame;
        try {
            frame = mapper.readTree(text);
        } catch (Exception e) {
            log.debug("[{}] Unparseable gateway frame: {}", name, e.getMessage());
            return;
        }
        if (frame.hasNonNull("s")) {
            sequence.set(frame.get("s").asLong());
        }
        int op = frame.path("op").asInt(-1);
        switch (op) {
            case OP_HELLO -> {
                long interval = frame.path("d").path("heartbeat_interval").asLong(41_250);
                startHeartbeat(ws, interval);
                identify(ws);
            }
            case OP_HEARTBEAT -> sendHeartbeat(ws);
            case OP_HEARTBEAT_ACK -> awaitingAck = false;
            case OP_RECONNECT, OP_INVALID_SESSION -> {
                log.info("[{}] Gateway asked for a new session (op {})", name, op);
                ws.close(4000, "reconnect");
            }
            case OP_DISPATCH -> {
                String type = frame.path("t").asText("");
                JsonNode data = frame.path("d");
                dispatcher.execute(() -> dispatch(type, data));
            }
            default -> log.debug("[{}] Ignoring gateway op {}", name, op);
        }
    }

    private void dispatch(String type, JsonNode data) {
        try {
            switch (type) {
                case "READY" -> {
                    User self = mapper.treeToValue(data.path("user"), User.class);
                    log.info("[{}] Gateway ready as {}", name, self.getUsername());
                    listener.onReady(self);
                }
                case "MESSAGE_CREATE" -> listener.onMessageCreate(mapper.treeToValue(data, Message.class));
                case "GUILD_MEMBER_UPDATE" -> listener.onGuildMemberUpdate(mapper.treeToValue(data, Member.class));
                default -> {
                }
            }
        } catch (Exception e) {
            log.error("[{}] Handler for {} failed: {}", name, type, e.getMessage(), e);
        }
    }

    private void identify(WebSocket ws) {
        ObjectNode properties = mapper.createObjectNode()
                .put("os", System.getProperty("os.name", "linux"))
                .put("browser", "mirrorswarm")
                .put("device", "mirrorswarm");
        ObjectNode d = mapper.createObjectNode()
                .put("token", token)
                .put("intents", intents);
        d.set("properties", properties);
        ObjectNode payload = mapper.createObjectNode().put("op", OP_IDENTIFY);
        payload.set("d", d);
        ws.send(payload.toString());
    }

    private void startHeartbeat(WebSocket ws, long intervalMs) {
        stopHeartbeat();
        awaitingAck = false;
        heartbeatTask = heartbeats.scheduleAtFixedRate(() -> {
            if (awaitingAck) {
                log.warn("[{}] Heartbeat not acknowledged, reconnecting", name);
                ws.cancel();
                return;
            }
            sendHeartbeat(ws);
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void sendHeartbeat(WebSocket ws) {
        long seq = sequence.get();
        ObjectNode payload = mapper.createObjectNode().put("op", OP_HEARTBEAT);
        if (seq >= 0) {
            payload.put("d", seq);
        } else {
            payload.putNull("d");
        }
        awaitingAck = true;
        ws.send(payload.toString());
    }

    private void stopHeartbeat() {
        ScheduledFuture<?> task = heartbeatTask;
        if (task != null) {
            task.cancel(false);
            heartbeatTask = null;
        }
    }

    private void scheduleReconnect() {
        stopHeartbeat();
        if (closed.get()) {
            return;
        }
        sequence.set(-1);
        heartbeats.schedule(() -> {
            if (!closed.get()) {
                connect();
            }
        }, RECONNECT_DELAY_MS, TimeUnit.MILLISECONDS);
    }

    private class Listener extends WebSocketListener {
        @Override
        public void onMessage(WebSocket ws, String text) {
            handleFrame(ws, text);
        }

        @Override
        public void onClosing(WebSocket ws, int code, String reason) {
            ws.close(code, reason);
        }

        @Override
        public void onClosed(WebSocket ws, int code, String reason) {
            log.info("[{}] Gateway socket closed ({} {})", name, code, reason);
            if (ws == socket) {
                scheduleReconnect();
            }
        }

        @Override
        public void onFailure(WebSocket ws, Throwable t, Response response) {
            log.warn("[{}] Gateway socket failed: {}", name, t.getMessage());
            if (ws == socket) {
                scheduleReconnect();
            }
        }
    }
}
