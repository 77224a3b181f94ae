package com.chicu.marketbot.exception;

/**
 * Не удалось получить курс валют. Используется последний известный курс.
 */
public class RateSourceException extends MarketBotException {

    public RateSourceException(String message) {
        super(message);
    }

    public RateSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
