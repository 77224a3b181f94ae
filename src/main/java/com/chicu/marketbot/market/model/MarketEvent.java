package com.chicu.marketbot.market.model;

import com.chicu.marketbot.common.enums.EventKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Типизированное событие маркетплейса.
 * Декодируется один раз в EventRouter, дальше по конвейеру идёт только этот тип.
 */
public sealed interface MarketEvent permits ListedEvent, PriceChangedEvent, DelistedSoldEvent {

    EventKind kind();

    String itemId();

    String itemName();

    ItemDetails details();

    /** null: float не пришёл */
    Double floatValue();

    Instant timestamp();

    /** Основная цена в USD: price_usd, для PRICE_CHANGED: new_price_usd */
    BigDecimal priceUsd();

    /** null до обогащения */
    Enrichment enrichment();

    MarketEvent withEnrichment(Enrichment enrichment);

    default boolean isEnriched() {
        return enrichment() != null;
    }
}
