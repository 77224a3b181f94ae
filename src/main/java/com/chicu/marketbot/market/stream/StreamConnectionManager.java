package com.chicu.marketbot.market.stream;

import com.chicu.marketbot.common.enums.ConnectionState;
import com.chicu.marketbot.common.enums.EventKind;
import com.chicu.marketbot.config.BotProperties;
import com.chicu.marketbot.engine.BotTerminator;
import com.chicu.marketbot.exception.AuthenticationException;
import com.chicu.marketbot.exception.TransportException;
import com.chicu.marketbot.market.model.RawFrame;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;
import org.jetbrains.annotations.NotNull;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 🌐 Единственная WS-сессия BitSkins на процесс.
 *
 * Подключение → WS_AUTH_APIKEY → WS_SUB на канал своего вида → поток кадров
 * в очередь конвейера. Обрыв / таймаут / пропущенный pong → реконнект с backoff,
 * без ограничения числа попыток. Отклонённый ключ → FAILED и остановка процесса.
 *
 * Протокол: каждый кадр: JSON массив [action, data].
 */
@Slf4j
@Component
public class StreamConnectionManager {

    static final String WS_AUTH_APIKEY = "WS_AUTH_APIKEY";
    static final String WS_SUB = "WS_SUB";
    static final String WS_UNSUB = "WS_UNSUB";
    private static final String CONTROL_PREFIX = "WS_";

    private static final int NORMAL_CLOSURE = 1000;
    private static final long ENQUEUE_WAIT_MS = 1_000;

    private final OkHttpClient client;
    private final BotProperties props;
    private final EventKind kind;
    private final BlockingQueue<RawFrame> frames;
    private final ScheduledExecutorService scheduler;
    private final BotTerminator terminator;
    private final Clock clock;
    private final ReconnectBackoff backoff;

    private final AtomicLong sessionIds = new AtomicLong();

    private volatile StreamSession session;
    private volatile boolean closed = false;
    private volatile boolean fatal = false;
    private ScheduledFuture<?> pendingReconnect;

    @Autowired
    public StreamConnectionManager(OkHttpClient client,
                                   BotProperties props,
                                   EventKind kind,
                                   BlockingQueue<RawFrame> frames,
                                   ScheduledExecutorService streamScheduler,
                                   BotTerminator terminator,
                                   Clock clock) {
        this(client, props, kind, frames, streamScheduler, terminator, clock,
                new ReconnectBackoff(props.getReconnect()));
    }

    StreamConnectionManager(OkHttpClient client,
                            BotProperties props,
                            EventKind kind,
                            BlockingQueue<RawFrame> frames,
                            ScheduledExecutorService scheduler,
                            BotTerminator terminator,
                            Clock clock,
                            ReconnectBackoff backoff) {
        this.client = client;
        this.props = props;
        this.kind = kind;
        this.frames = frames;
        this.scheduler = scheduler;
        this.terminator = terminator;
        this.clock = clock;
        this.backoff = backoff;
    }

    // =====================================================================
    // CONNECT / CLOSE
    // =====================================================================

    /**
     * Открывает новую сессию. Без ключа API: сразу {@link AuthenticationException}.
     */
    public synchronized StreamSession connect() {
        if (fatal) {
            throw new AuthenticationException("authentication failed earlier, reconnect disabled");
        }
        if (closed) {
            throw new IllegalStateException("connection manager is closed");
        }
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            fatal = true;
            throw new AuthenticationException("BitSkins API key is not configured (bot.api-key)");
        }

        StreamSession s = new StreamSession(sessionIds.incrementAndGet());
        session = s;
        transition(s, ConnectionState.CONNECTING, props.getStream().getUrl());

        Request request = new Request.Builder()
                .url(props.getStream().getUrl())
                .build();

        s.attach(client.newWebSocket(request, new SessionListener(s)));
        return s;
    }

    /**
     * WS_UNSUB + нормальное закрытие. Реконнект больше не планируется.
     */
    public synchronized void close() {
        if (closed) return;
        closed = true;

        if (pendingReconnect != null) {
            pendingReconnect.cancel(false);
            pendingReconnect = null;
        }

        StreamSession s = session;
        if (s == null) return;

        s.cancelAuthTimeout();
        WebSocket ws = s.webSocket();

        if (ws != null) {
            if (s.isStreaming()) {
                send(s, WS_UNSUB, kind.channel());
            }
            ws.close(NORMAL_CLOSURE, "shutdown");
        }

        if (s.end()) {
            transition(s, ConnectionState.DISCONNECTED, "closed by client");
        }
        log.info("🔌 [WS] closed, frames received in last session: {}", s.framesReceived());
    }

    public StreamSession currentSession() {
        return session;
    }

    public ConnectionState state() {
        StreamSession s = session;
        return s == null ? ConnectionState.DISCONNECTED : s.state();
    }

    public boolean isClosed() {
        return closed;
    }

    ReconnectBackoff backoff() {
        return backoff;
    }

    // =====================================================================
    // SESSION EVENTS
    // =====================================================================

    private void onOpen(StreamSession s) {
        transition(s, ConnectionState.AUTHENTICATING, null);
        send(s, WS_AUTH_APIKEY, props.getApiKey().trim());

        Duration timeout = props.getStream().getAuthTimeout();
        s.authTimeout(scheduler.schedule(
                () -> onAuthTimeout(s),
                timeout.toMillis(),
                TimeUnit.MILLISECONDS
        ));
    }

    private void onText(StreamSession s, String text) {
        Instant now = clock.instant();

        JSONArray message = parseArray(text);

        if (s.state() == ConnectionState.AUTHENTICATING) {
            onAuthResponse(s, message, text);
            return;
        }

        if (!s.isStreaming()) {
            log.debug("[WS] {} frame ignored in state {}", s, s.state());
            return;
        }

        s.frameReceived();

        if (message == null || message.isEmpty()) {
            // пусть EventRouter отклонит и залогирует
            enqueue(s, RawFrame.of(null, text, now, s.id()));
            return;
        }

        String action = message.optString(0, "");
        if (action.startsWith(CONTROL_PREFIX)) {
            log.debug("📨 [WS] control {} {}", action, shrink(text));
            return;
        }

        Object data = message.opt(1);
        String payload = data == null ? "" : data.toString();
        enqueue(s, RawFrame.of(action, payload, now, s.id()));
    }

    private void onAuthResponse(StreamSession s, JSONArray message, String text) {
        s.cancelAuthTimeout();

        if (message == null || message.length() < 2) {
            failSession(s, new TransportException("unexpected auth response format: " + shrink(text)));
            return;
        }

        String action = message.optString(0, "");
        Object data = message.opt(1);

        boolean rejected = !action.startsWith("WS_AUTH")
                || action.toUpperCase().contains("ERROR")
                || action.toUpperCase().contains("FAIL")
                || (data instanceof JSONObject o && o.has("error"));

        if (rejected) {
            onAuthRejected(s, "authentication rejected: " + shrink(text));
            return;
        }

        log.info("🔐 [WS] authenticated for {} monitoring", kind.channel());

        // авторизация сбрасывает прошлые подписки: подписываемся после неё
        transition(s, ConnectionState.SUBSCRIBED, kind.channel());
        send(s, WS_SUB, kind.channel());

        transition(s, ConnectionState.STREAMING, null);
        backoff.onStreaming(clock.instant());
    }

    private void onAuthRejected(StreamSession s, String reason) {
        fatal = true;
        s.end();
        transition(s, ConnectionState.FAILED, reason);

        WebSocket ws = s.webSocket();
        if (ws != null) ws.close(NORMAL_CLOSURE, "authentication failed");

        terminator.terminate(new AuthenticationException(reason));
    }

    private void onAuthTimeout(StreamSession s) {
        if (s != session || s.state() != ConnectionState.AUTHENTICATING) return;

        WebSocket ws = s.webSocket();
        if (ws != null) ws.cancel();

        failSession(s, new TransportException(
                "no auth response within " + props.getStream().getAuthTimeout()));
    }

    /**
     * Обрыв: закрытие сокета, ошибка протокола, нет pong, таймаут рукопожатия.
     */
    private void failSession(StreamSession s, TransportException cause) {
        if (!s.end()) return;
        s.cancelAuthTimeout();

        if (fatal) return;

        // рукопожатие не прошло: восстановимо, FAILED только для отклонённого ключа
        String detail = s.state() == ConnectionState.CONNECTING
                ? "handshake failed: " + cause.getMessage()
                : cause.getMessage();
        transition(s, ConnectionState.DISCONNECTED, detail);

        if (closed || s != session) return;

        scheduleReconnect();
    }

    private synchronized void scheduleReconnect() {
        if (closed || fatal) return;

        Duration delay = backoff.nextDelay(clock.instant());
        log.warn("🔄 [WS] reconnect attempt #{} in {} ms", backoff.attempt(), delay.toMillis());

        pendingReconnect = scheduler.schedule(this::reconnect, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void reconnect() {
        if (closed || fatal) return;
        try {
            connect();
        } catch (AuthenticationException e) {
            log.error("⛔ [WS] reconnect aborted: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("❌ [WS] reconnect failed: {}", e.getMessage(), e);
            scheduleReconnect();
        }
    }

    // =====================================================================
    // HELPERS
    // =====================================================================

    /** null: кадр не JSON массив */
    private static JSONArray parseArray(String text) {
        if (text == null || !text.trim().startsWith("[")) return null;
        try {
            return new JSONArray(text);
        } catch (JSONException e) {
            log.debug("[WS] malformed array frame: {}", e.getMessage());
            return null;
        }
    }

    private void enqueue(StreamSession s, RawFrame frame) {
        try {
            // очередь полна → держим поток чтения OkHttp (backpressure)
            while (!frames.offer(frame, ENQUEUE_WAIT_MS, TimeUnit.MILLISECONDS)) {
                if (closed || s != session) {
                    log.warn("⚠ [WS] frame dropped on shutdown, channel={}", frame.channel());
                    return;
                }
                log.debug("⏳ [WS] frame queue full ({}), waiting", frames.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠ [WS] interrupted while enqueuing frame, channel={}", frame.channel());
        }
    }

    private void send(StreamSession s, String action, String data) {
        WebSocket ws = s.webSocket();
        if (ws == null) {
            log.warn("⚠️ [WS] send skipped: ws == null, action={}", action);
            return;
        }

        String msg = new JSONArray().put(action).put(data).toString();
        ws.send(msg);

        if (WS_AUTH_APIKEY.equals(action)) {
            log.info("📡 [WS] → {} ***", action);
        } else {
            log.info("📡 [WS] → {}", msg);
        }
    }

    private void transition(StreamSession s, ConnectionState next, String detail) {
        ConnectionState prev = s.moveTo(next);
        if (detail == null) {
            log.info("🔌 [WS] session#{} {} → {}", s.id(), prev, next);
        } else if (next == ConnectionState.DISCONNECTED || next == ConnectionState.FAILED) {
            log.warn("🔌 [WS] session#{} {} → {} ({})", s.id(), prev, next, detail);
        } else {
            log.info("🔌 [WS] session#{} {} → {} ({})", s.id(), prev, next, detail);
        }
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        return x.length() <= 300 ? x : x.substring(0, 300) + "...";
    }

    // =====================================================================
    // 🧠 LISTENER
    // =====================================================================

    private class SessionListener extends WebSocketListener {

        private final StreamSession s;

        SessionListener(StreamSession s) {
            this.s = s;
        }

        private boolean stale() {
            return s != session || s.isEnded();
        }

        @Override
        public void onOpen(@NotNull WebSocket webSocket, @NotNull Response response) {
            if (stale()) {
                webSocket.close(NORMAL_CLOSURE, "stale session");
                return;
            }
            // onOpen может прийти раньше, чем newWebSocket вернёт управление
            s.attach(webSocket);
            log.info("✅ [WS] OPEN {}", props.getStream().getUrl());
            StreamConnectionManager.this.onOpen(s);
        }

        @Override
        public void onMessage(@NotNull WebSocket webSocket, @NotNull String text) {
            if (stale()) return;
            try {
                onText(s, text);
            } catch (RuntimeException e) {
                log.error("❌ [WS] message handling error: {}", e.getMessage(), e);
            }
        }

        @Override
        public void onMessage(@NotNull WebSocket webSocket, @NotNull ByteString bytes) {
            onMessage(webSocket, bytes.utf8());
        }

        @Override
        public void onClosing(@NotNull WebSocket webSocket, int code, @NotNull String reason) {
            webSocket.close(NORMAL_CLOSURE, null);
            if (stale()) return;
            failSession(s, new TransportException("server closing code=" + code + " reason=" + reason));
        }

        @Override
        public void onClosed(@NotNull WebSocket webSocket, int code, @NotNull String reason) {
            if (stale()) return;
            failSession(s, new TransportException("closed code=" + code + " reason=" + reason));
        }

        @Override
        public void onFailure(@NotNull WebSocket webSocket, @NotNull Throwable t, Response response) {
            if (stale()) return;
            String http = response != null ? " http=" + response.code() : "";
            log.error("❌ [WS] failure {}{}: {}", s, http, t.getMessage());
            failSession(s, new TransportException("transport failure: " + t.getMessage(), t));
        }
    }
}
