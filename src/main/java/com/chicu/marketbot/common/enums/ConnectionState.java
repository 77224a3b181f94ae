package com.chicu.marketbot.common.enums;

/**
 * Состояние WS-сессии.
 * DISCONNECTED → CONNECTING → AUTHENTICATING → SUBSCRIBED → STREAMING → (DISCONNECTED | FAILED)
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    AUTHENTICATING,
    SUBSCRIBED,
    STREAMING,
    /** Терминальное: ключ отклонён, реконнекта нет */
    FAILED
}
