package com.chicu.marketbot.market.enrich;

import com.chicu.marketbot.common.enums.Wear;
import com.chicu.marketbot.market.model.Enrichment;
import com.chicu.marketbot.market.model.MarketEvent;
import com.chicu.marketbot.market.model.PriceChangedEvent;
import com.chicu.marketbot.market.rate.ExchangeRateService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Добавляет EUR-цены и износ. Кроме чтения закэшированного курса: без I/O.
 */
@Component
@RequiredArgsConstructor
public class Enricher {

    /** Точность EUR: суб-центовые изменения цен на BitSkins */
    public static final int EUR_SCALE = 3;

    private final ExchangeRateService rateService;

    public MarketEvent enrich(MarketEvent event) {
        return enrich(event, rateService.currentRate());
    }

    /**
     * Детерминированно: одинаковое событие + курс → одинаковый результат.
     */
    public MarketEvent enrich(MarketEvent event, BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new IllegalArgumentException("EUR rate must be positive, got " + rate);
        }

        Enrichment.EnrichmentBuilder b = Enrichment.builder()
                .rate(rate)
                .priceEur(toEur(event.priceUsd(), rate))
                .suggestedPriceEur(toEur(event.details().suggestedPriceUsd(), rate))
                .wear(Wear.fromFloat(event.floatValue()))
                .wearFromName(Wear.fromItemName(event.itemName()));

        if (event instanceof PriceChangedEvent pc) {
            BigDecimal oldEur = toEur(pc.oldPriceUsd(), rate);
            BigDecimal newEur = toEur(pc.newPriceUsd(), rate);
            b.oldPriceEur(oldEur)
             .priceChangeUsd(pc.newPriceUsd().subtract(pc.oldPriceUsd()))
             .priceChangeEur(newEur.subtract(oldEur));
        }

        return event.withEnrichment(b.build());
    }

    public static BigDecimal toEur(BigDecimal usd, BigDecimal rate) {
        if (usd == null) return null;
        return usd.multiply(rate).setScale(EUR_SCALE, RoundingMode.HALF_UP);
    }
}
