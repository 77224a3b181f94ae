package com.chicu.marketbot.exception;

import lombok.Getter;

/**
 * Кадр не прошёл валидацию. Кадр отбрасывается, поток продолжается.
 */
@Getter
public class EventParseException extends MarketBotException {

    /** Имя поля, из-за которого кадр отклонён */
    private final String field;

    public EventParseException(String field, String reason) {
        super("field '" + field + "': " + reason);
        this.field = field;
    }

    public EventParseException(String field, String reason, Throwable cause) {
        super("field '" + field + "': " + reason, cause);
        this.field = field;
    }
}
