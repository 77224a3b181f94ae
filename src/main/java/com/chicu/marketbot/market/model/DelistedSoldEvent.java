package com.chicu.marketbot.market.model;

import com.chicu.marketbot.common.enums.DelistReason;
import com.chicu.marketbot.common.enums.EventKind;

import java.math.BigDecimal;
import java.time.Instant;

public record DelistedSoldEvent(
        String itemId,
        String itemName,
        ItemDetails details,
        BigDecimal priceUsd,
        DelistReason reason,
        Double floatValue,
        Instant timestamp,
        Enrichment enrichment
) implements MarketEvent {

    @Override
    public EventKind kind() {
        return EventKind.DELISTED_SOLD;
    }

    @Override
    public DelistedSoldEvent withEnrichment(Enrichment enrichment) {
        return new DelistedSoldEvent(itemId, itemName, details, priceUsd, reason, floatValue, timestamp, enrichment);
    }
}
