package com.chicu.marketbot.common.enums;

import java.util.ArrayList;
import java.util.List;

/**
 * Таблица вариантов бота: один экземпляр = один вид событий.
 * Канал подписки, коллекция Mongo и индексы берутся только отсюда.
 */
public enum EventKind {

    LISTED(
            "listed",
            "listed_items",
            "price_usd",
            List.of("float_value", "skin_id")
    ),

    PRICE_CHANGED(
            "price_changed",
            "price_changed_items",
            "new_price_usd",
            List.of("price_change_percent")
    ),

    DELISTED_SOLD(
            "delisted_or_sold",
            "delisted_sold_items",
            "price_usd",
            List.of("reason")
    );

    /** Общие индексы для всех коллекций */
    private static final List<String> COMMON_INDEXES =
            List.of("timestamp", "item_id", "item_name", "wear");

    private final String channel;
    private final String collection;
    private final String priceField;
    private final List<String> extraIndexes;

    EventKind(String channel, String collection, String priceField, List<String> extraIndexes) {
        this.channel = channel;
        this.collection = collection;
        this.priceField = priceField;
        this.extraIndexes = extraIndexes;
    }

    /** Имя канала BitSkins WS (WS_SUB) */
    public String channel() {
        return channel;
    }

    public String collection() {
        return collection;
    }

    /** Основное ценовое поле документа */
    public String priceField() {
        return priceField;
    }

    /**
     * Все одиночные индексы коллекции:
     * timestamp, item_id, item_name, wear + ценовое поле + специфичные для вида.
     */
    public List<String> indexedFields() {
        var fields = new ArrayList<>(COMMON_INDEXES);
        fields.add(priceField);
        extraIndexes.stream()
                .filter(f -> !fields.contains(f))
                .forEach(fields::add);
        return List.copyOf(fields);
    }

    public static EventKind fromChannel(String channel) {
        if (channel == null) return null;
        for (EventKind k : values()) {
            if (k.channel.equalsIgnoreCase(channel.trim())) {
                return k;
            }
        }
        return null;
    }
}
