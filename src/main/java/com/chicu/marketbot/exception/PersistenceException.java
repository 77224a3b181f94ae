package com.chicu.marketbot.exception;

/**
 * Запись в Mongo не удалась после всех попыток.
 */
public class PersistenceException extends MarketBotException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
