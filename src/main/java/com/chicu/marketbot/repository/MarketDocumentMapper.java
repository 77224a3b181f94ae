package com.chicu.marketbot.repository;

import com.chicu.marketbot.market.model.DelistedSoldEvent;
import com.chicu.marketbot.market.model.Enrichment;
import com.chicu.marketbot.market.model.ItemDetails;
import com.chicu.marketbot.market.model.ListedEvent;
import com.chicu.marketbot.market.model.MarketEvent;
import com.chicu.marketbot.market.model.PriceChangedEvent;
import org.bson.Document;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Date;

/**
 * MarketEvent → BSON документ коллекции.
 * Имена полей: snake_case, их читают дашборды и отчёты.
 */
@Component
public class MarketDocumentMapper {

    public static final String ITEM_ID = "item_id";
    public static final String TIMESTAMP = "timestamp";

    public Document toDocument(MarketEvent event, Instant processedAt) {
        if (!event.isEnriched()) {
            throw new IllegalArgumentException("event " + event.itemId() + " is not enriched");
        }
        Enrichment en = event.enrichment();
        ItemDetails d = event.details();

        Document doc = new Document();
        doc.put(ITEM_ID, event.itemId());
        doc.put(TIMESTAMP, Date.from(event.timestamp()));
        doc.put("event_type", event.kind().channel());
        doc.put("item_name", event.itemName());
        doc.put("float_value", event.floatValue());
        doc.put("wear", en.wear().label());
        doc.put("wear_from_name", en.wearFromName().label());
        doc.put("eur_rate", num(en.rate()));
        doc.put("price_eur", num(en.priceEur()));

        if (event instanceof ListedEvent listed) {
            doc.put("price_usd", num(listed.priceUsd()));
            doc.put("price_raw", raw(d.priceRaw()));
        } else if (event instanceof PriceChangedEvent pc) {
            doc.put("old_price_raw", raw(d.oldPriceRaw()));
            doc.put("new_price_raw", raw(d.priceRaw()));
            doc.put("old_price_usd", num(pc.oldPriceUsd()));
            doc.put("new_price_usd", num(pc.newPriceUsd()));
            doc.put("old_price_eur", num(en.oldPriceEur()));
            doc.put("new_price_eur", num(en.priceEur()));
            doc.put("price_change_usd", num(en.priceChangeUsd()));
            doc.put("price_change_eur", num(en.priceChangeEur()));
            doc.put("price_change_percent", num(pc.priceChangePercent()));
        } else if (event instanceof DelistedSoldEvent ds) {
            doc.put("price_usd", num(ds.priceUsd()));
            doc.put("price_raw", raw(d.priceRaw()));
            doc.put("reason", ds.reason().value());
        }

        doc.put("skin_id", d.skinId());
        doc.put("collection_name", d.collectionName());
        doc.put("asset_id", d.assetId());
        doc.put("app_id", d.appId());
        doc.put("class_id", d.classId());
        doc.put("paint_seed", d.paintSeed());
        doc.put("tradehold", d.tradehold());
        doc.put("bot_steam_id", d.botSteamId());
        doc.put("suggested_price_usd", num(d.suggestedPriceUsd()));
        doc.put("suggested_price_eur", num(en.suggestedPriceEur()));
        doc.put("suggested_price_raw", raw(d.suggestedPriceRaw()));
        doc.put("raw_data", d.rawData() == null ? null : Document.parse(d.rawData()));

        doc.put("processed_at", Date.from(processedAt));
        return doc;
    }

    /** В Mongo храним double: BigDecimal по умолчанию уходит строкой */
    private static Double num(BigDecimal v) {
        return v == null ? null : v.doubleValue();
    }

    /** Провод шлёт целые: храним как long, дробное как есть */
    private static Number raw(BigDecimal v) {
        if (v == null) return null;
        return v.stripTrailingZeros().scale() <= 0 ? (Number) v.longValue() : (Number) v.doubleValue();
    }
}
