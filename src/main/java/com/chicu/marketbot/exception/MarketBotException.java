package com.chicu.marketbot.exception;

/**
 * Базовое исключение бота. Все ошибки конвейера: unchecked.
 */
public class MarketBotException extends RuntimeException {

    public MarketBotException(String message) {
        super(message);
    }

    public MarketBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
