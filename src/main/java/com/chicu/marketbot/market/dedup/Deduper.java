package com.chicu.marketbot.market.dedup;

import com.chicu.marketbot.common.enums.EventKind;
import com.chicu.marketbot.config.BotProperties;
import com.chicu.marketbot.market.model.MarketEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 🧹 Защита от повторной доставки после реконнекта.
 *
 * Хранит последние ключи (itemId, timestamp, kind) в пределах окна и ёмкости,
 * самые старые вытесняются первыми. Только экономит лишние upsert-ы:
 * настоящая гарантия уникальности: ключ upsert в StoreWriter.
 */
@Slf4j
@Component
public class Deduper {

    private final int capacity;
    private final Duration window;
    private final Clock clock;

    /** key → момент первого появления, порядок вставки */
    private final LinkedHashMap<DedupKey, Instant> seen;

    @Autowired
    public Deduper(BotProperties props, Clock clock) {
        this(props.getDedup().getCapacity(), props.getDedup().getWindow(), clock);
    }

    public Deduper(int capacity, Duration window, Clock clock) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        this.capacity = capacity;
        this.window = window;
        this.clock = clock;
        this.seen = new LinkedHashMap<>(Math.min(capacity, 1 << 16), 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<DedupKey, Instant> eldest) {
                return size() > Deduper.this.capacity;
            }
        };
    }

    public synchronized boolean accept(MarketEvent event) {
        Instant now = Instant.now(clock);
        expire(now);

        DedupKey key = new DedupKey(event.itemId(), event.timestamp(), event.kind());
        if (seen.containsKey(key)) {
            log.debug("🔁 duplicate {} item_id={} ts={}", key.kind(), key.itemId(), key.timestamp());
            return false;
        }

        seen.put(key, now);
        return true;
    }

    /**
     * Снимает ключ, если событие так и не записалось: повторная доставка должна дойти до записи.
     */
    public synchronized boolean forget(MarketEvent event) {
        return seen.remove(new DedupKey(event.itemId(), event.timestamp(), event.kind())) != null;
    }

    public synchronized int size() {
        return seen.size();
    }

    /** Записи вставлялись по возрастанию времени: режем с головы */
    private void expire(Instant now) {
        Instant cutoff = now.minus(window);
        Iterator<Map.Entry<DedupKey, Instant>> it = seen.entrySet().iterator();
        while (it.hasNext()) {
            if (it.next().getValue().isAfter(cutoff)) break;
            it.remove();
        }
    }

    record DedupKey(String itemId, Instant timestamp, EventKind kind) {}
}
