package com.chicu.marketbot.market.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * Необязательные атрибуты лота, общие для всех видов событий.
 */
@Builder
public record ItemDetails(
        Long skinId,
        String collectionName,
        String assetId,
        Integer appId,
        String classId,
        Integer paintSeed,
        Integer tradehold,
        String botSteamId,
        BigDecimal suggestedPriceUsd,
        // как пришло по проводу: для сверки с BitSkins
        String rawData,
        BigDecimal priceRaw,
        BigDecimal oldPriceRaw,
        BigDecimal suggestedPriceRaw
) {

    public static ItemDetails empty() {
        return ItemDetails.builder().build();
    }
}
