package com.chicu.marketbot.market.model;

import com.chicu.marketbot.common.enums.Wear;
import lombok.Builder;

import java.math.BigDecimal;

/**
 * Производные атрибуты, которые добавляет Enricher.
 * Поля oldPriceEur / priceChangeUsd / priceChangeEur заполнены только для PRICE_CHANGED.
 */
@Builder
public record Enrichment(
        BigDecimal rate,
        BigDecimal priceEur,
        BigDecimal suggestedPriceEur,
        BigDecimal oldPriceEur,
        BigDecimal priceChangeUsd,
        BigDecimal priceChangeEur,
        Wear wear,
        Wear wearFromName
) {}
