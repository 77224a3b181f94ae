package com.chicu.marketbot.market.model;

import com.chicu.marketbot.common.enums.EventKind;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Изменение цены лота.
 * priceChangePercent = (new - old) / old * 100, округление до 2 знаков;
 * null, если old = 0.
 */
public record PriceChangedEvent(
        String itemId,
        String itemName,
        ItemDetails details,
        BigDecimal oldPriceUsd,
        BigDecimal newPriceUsd,
        BigDecimal priceChangePercent,
        Double floatValue,
        Instant timestamp,
        Enrichment enrichment
) implements MarketEvent {

    @Override
    public EventKind kind() {
        return EventKind.PRICE_CHANGED;
    }

    @Override
    public BigDecimal priceUsd() {
        return newPriceUsd;
    }

    @Override
    public PriceChangedEvent withEnrichment(Enrichment enrichment) {
        return new PriceChangedEvent(
                itemId, itemName, details,
                oldPriceUsd, newPriceUsd, priceChangePercent,
                floatValue, timestamp, enrichment
        );
    }
}
