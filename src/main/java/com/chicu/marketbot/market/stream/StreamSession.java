package com.chicu.marketbot.market.stream;

import com.chicu.marketbot.common.enums.ConnectionState;
import okhttp3.WebSocket;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Одна логическая WS-сессия. Создаётся на каждое подключение,
 * владелец: {@link StreamConnectionManager}, остальные только читают.
 */
public class StreamSession {

    private final long id;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile WebSocket webSocket;
    private volatile ScheduledFuture<?> authTimeout;

    private final AtomicLong framesReceived = new AtomicLong();
    private final AtomicBoolean ended = new AtomicBoolean(false);

    StreamSession(long id) {
        this.id = id;
    }

    public long id() {
        return id;
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isStreaming() {
        return state == ConnectionState.STREAMING;
    }

    public long framesReceived() {
        return framesReceived.get();
    }

    public boolean isEnded() {
        return ended.get();
    }

    // =====================================================================
    // только для StreamConnectionManager
    // =====================================================================

    ConnectionState moveTo(ConnectionState next) {
        ConnectionState prev = state;
        state = next;
        return prev;
    }

    void attach(WebSocket ws) {
        this.webSocket = ws;
    }

    WebSocket webSocket() {
        return webSocket;
    }

    void authTimeout(ScheduledFuture<?> f) {
        this.authTimeout = f;
    }

    void cancelAuthTimeout() {
        ScheduledFuture<?> f = authTimeout;
        if (f != null) {
            f.cancel(false);
            authTimeout = null;
        }
    }

    long frameReceived() {
        return framesReceived.incrementAndGet();
    }

    /** true только для первого вызова: сессия завершается ровно один раз */
    boolean end() {
        return ended.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "session#" + id + "[" + state + "]";
    }
}
