package com.chicu.marketbot.market.model;

import com.chicu.marketbot.common.enums.EventKind;

import java.math.BigDecimal;
import java.time.Instant;

public record ListedEvent(
        String itemId,
        String itemName,
        ItemDetails details,
        BigDecimal priceUsd,
        Double floatValue,
        Instant timestamp,
        Enrichment enrichment
) implements MarketEvent {

    @Override
    public EventKind kind() {
        return EventKind.LISTED;
    }

    @Override
    public ListedEvent withEnrichment(Enrichment enrichment) {
        return new ListedEvent(itemId, itemName, details, priceUsd, floatValue, timestamp, enrichment);
    }
}
