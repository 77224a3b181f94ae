package com.chicu.marketbot.exception;

/**
 * Ключ API отклонён или отсутствует. Фатально: процесс завершается,
 * ключ нужно исправить снаружи.
 */
public class AuthenticationException extends MarketBotException {

    public AuthenticationException(String message) {
        super(message);
    }
}
