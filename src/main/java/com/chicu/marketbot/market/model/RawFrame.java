package com.chicu.marketbot.market.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Сырой кадр из WS: action-канал + JSON data как байты.
 * Живёт только между StreamConnectionManager и EventRouter.
 */
public record RawFrame(
        String channel,      // listed / price_changed / delisted_or_sold
        byte[] payload,      // UTF-8 JSON объекта data
        Instant receivedAt,  // время прихода кадра
        long sessionId       // сессия, в которой кадр получен
) {

    public static RawFrame of(String channel, String json, Instant receivedAt, long sessionId) {
        return new RawFrame(channel, json.getBytes(StandardCharsets.UTF_8), receivedAt, sessionId);
    }

    public String payloadAsString() {
        return payload == null ? "" : new String(payload, StandardCharsets.UTF_8);
    }
}
