package com.chicu.marketbot.market.router;

import com.chicu.marketbot.common.enums.DelistReason;
import com.chicu.marketbot.common.enums.EventKind;
import com.chicu.marketbot.exception.EventParseException;
import com.chicu.marketbot.market.model.DelistedSoldEvent;
import com.chicu.marketbot.market.model.ItemDetails;
import com.chicu.marketbot.market.model.ListedEvent;
import com.chicu.marketbot.market.model.MarketEvent;
import com.chicu.marketbot.market.model.PriceChangedEvent;
import com.chicu.marketbot.market.model.RawFrame;
import lombok.RequiredArgsConstructor;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Нормализация BitSkins data JSON → MarketEvent.
 *
 * Цены приходят целыми в тысячных долях USD (330 → 0.330 USD).
 * Ошибка в обязательном поле → {@link EventParseException} с именем поля.
 */
@Component
@RequiredArgsConstructor
public class EventRouter {

    /** BitSkins: price / 1000 = USD */
    private static final BigDecimal PRICE_SCALE = new BigDecimal("1000");
    private static final int USD_SCALE = 3;
    private static final int PERCENT_SCALE = 2;

    /** Всё, что меньше, считаем epoch seconds */
    private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

    private final EventKind kind;

    public MarketEvent parse(RawFrame frame) {
        if (frame == null) {
            throw new EventParseException("frame", "null frame");
        }

        EventKind frameKind = EventKind.fromChannel(frame.channel());
        if (frameKind == null) {
            throw new EventParseException("channel", "unknown channel '" + frame.channel() + "'");
        }
        if (frameKind != kind) {
            throw new EventParseException("channel",
                    "channel '" + frame.channel() + "' does not belong to " + kind);
        }

        JSONObject data;
        try {
            data = new JSONObject(frame.payloadAsString());
        } catch (JSONException e) {
            throw new EventParseException("data", "payload is not a JSON object", e);
        }

        String itemId = requireText(data, "id");
        String itemName = requireText(data, "name");
        Double floatValue = optionalFloat(data);
        Instant timestamp = timestamp(data, frame.receivedAt());

        BigDecimal oldPriceRaw = kind == EventKind.PRICE_CHANGED ? requireRawPrice(data, "old_price") : null;
        BigDecimal priceRaw = requireRawPrice(data, "price");
        ItemDetails details = details(data, frame.payloadAsString(), priceRaw, oldPriceRaw);

        return switch (kind) {
            case LISTED -> new ListedEvent(
                    itemId, itemName, details,
                    toUsd(priceRaw),
                    floatValue, timestamp, null
            );
            case PRICE_CHANGED -> {
                BigDecimal oldPrice = toUsd(oldPriceRaw);
                BigDecimal newPrice = toUsd(priceRaw);
                yield new PriceChangedEvent(
                        itemId, itemName, details,
                        oldPrice, newPrice, changePercent(oldPrice, newPrice),
                        floatValue, timestamp, null
                );
            }
            case DELISTED_SOLD -> new DelistedSoldEvent(
                    itemId, itemName, details,
                    toUsd(priceRaw),
                    DelistReason.parse(data.optString("reason", null)),
                    floatValue, timestamp, null
            );
        };
    }

    /**
     * (new - old) / old * 100, HALF_UP до 2 знаков; null при old = 0.
     */
    public static BigDecimal changePercent(BigDecimal oldPrice, BigDecimal newPrice) {
        if (oldPrice == null || newPrice == null || oldPrice.signum() == 0) return null;

        return newPrice.subtract(oldPrice)
                .multiply(BigDecimal.valueOf(100))
                .divide(oldPrice, PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    // =====================================================================
    // FIELDS
    // =====================================================================

    private String requireText(JSONObject data, String field) {
        Object v = data.opt(field);
        if (v == null || v == JSONObject.NULL) {
            throw new EventParseException(field, "missing");
        }
        if (!(v instanceof String) && !(v instanceof Number)) {
            throw new EventParseException(field, "expected string or number, got " + v.getClass().getSimpleName());
        }
        String s = String.valueOf(v).trim();
        if (s.isEmpty()) {
            throw new EventParseException(field, "blank");
        }
        return s;
    }

    /** Цена в единицах провода (тысячные USD), без масштабирования */
    private BigDecimal requireRawPrice(JSONObject data, String field) {
        Object v = data.opt(field);
        if (v == null || v == JSONObject.NULL) {
            throw new EventParseException(field, "missing");
        }

        BigDecimal raw;
        try {
            raw = new BigDecimal(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new EventParseException(field, "not a decimal: '" + v + "'", e);
        }

        if (raw.signum() < 0) {
            throw new EventParseException(field, "negative price " + raw);
        }
        return raw;
    }

    private static BigDecimal toUsd(BigDecimal raw) {
        return raw == null ? null : raw.divide(PRICE_SCALE, USD_SCALE, RoundingMode.HALF_UP);
    }

    private Double optionalFloat(JSONObject data) {
        Object v = data.opt("float_value");
        if (v == null || v == JSONObject.NULL) return null;

        if (v instanceof Number n) return n.doubleValue();

        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new EventParseException("float_value", "not a number: '" + v + "'", e);
        }
    }

    /**
     * timestamp → updated_at → created_at, иначе время прихода кадра.
     */
    private Instant timestamp(JSONObject data, Instant fallback) {
        for (String field : new String[]{"timestamp", "updated_at", "created_at"}) {
            Object v = data.opt(field);
            if (v == null || v == JSONObject.NULL) continue;

            if (v instanceof Number n) {
                long ts = n.longValue();
                if (ts <= 0) throw new EventParseException(field, "non-positive epoch " + ts);
                return ts < EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochSecond(ts) : Instant.ofEpochMilli(ts);
            }

            String s = String.valueOf(v).trim();
            if (s.isEmpty()) continue;
            try {
                return Instant.parse(s);
            } catch (DateTimeParseException e) {
                throw new EventParseException(field, "not ISO-8601: '" + s + "'", e);
            }
        }
        return fallback != null ? fallback : Instant.now();
    }

    private ItemDetails details(JSONObject data, String rawData, BigDecimal priceRaw, BigDecimal oldPriceRaw) {
        BigDecimal suggestedRaw = null;
        if (data.has("suggested_price") && !data.isNull("suggested_price")) {
            suggestedRaw = requireRawPrice(data, "suggested_price");
        }

        return ItemDetails.builder()
                .skinId(optLong(data, "skin_id"))
                .collectionName(optText(data, "collection_name"))
                .assetId(optText(data, "asset_id"))
                .appId(optInt(data, "app_id"))
                .classId(optText(data, "class_id"))
                .paintSeed(optInt(data, "paint_seed"))
                .tradehold(optInt(data, "tradehold"))
                .botSteamId(optText(data, "bot_steam_id"))
                .suggestedPriceUsd(toUsd(suggestedRaw))
                .rawData(rawData)
                .priceRaw(priceRaw)
                .oldPriceRaw(oldPriceRaw)
                .suggestedPriceRaw(suggestedRaw)
                .build();
    }

    private static String optText(JSONObject data, String field) {
        if (data.isNull(field)) return null;
        String s = String.valueOf(data.get(field)).trim();
        return s.isEmpty() ? null : s;
    }

    private static Long optLong(JSONObject data, String field) {
        if (data.isNull(field)) return null;
        long v = data.optLong(field, Long.MIN_VALUE);
        return v == Long.MIN_VALUE ? null : v;
    }

    private static Integer optInt(JSONObject data, String field) {
        if (data.isNull(field)) return null;
        int v = data.optInt(field, Integer.MIN_VALUE);
        return v == Integer.MIN_VALUE ? null : v;
    }
}
