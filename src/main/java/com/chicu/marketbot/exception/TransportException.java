package com.chicu.marketbot.exception;

/**
 * Обрыв / таймаут / ошибка протокола WS. Лечится реконнектом.
 */
public class TransportException extends MarketBotException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
