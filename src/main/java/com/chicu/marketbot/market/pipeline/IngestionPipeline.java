package com.chicu.marketbot.market.pipeline;

import com.chicu.marketbot.common.enums.EventKind;
import com.chicu.marketbot.exception.EventParseException;
import com.chicu.marketbot.market.dedup.Deduper;
import com.chicu.marketbot.market.enrich.Enricher;
import com.chicu.marketbot.market.model.MarketEvent;
import com.chicu.marketbot.market.model.RawFrame;
import com.chicu.marketbot.market.router.EventRouter;
import com.chicu.marketbot.repository.PersistResult;
import com.chicu.marketbot.repository.StoreWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Единственный потребитель очереди кадров.
 * Каждый кадр проходит parse → enrich → dedupe → persist целиком,
 * только потом берётся следующий (FIFO в пределах соединения).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IngestionPipeline {

    private static final long POLL_MS = 500;
    private static final Duration STOP_TIMEOUT = Duration.ofSeconds(30);

    private final BlockingQueue<RawFrame> frameQueue;
    private final EventRouter router;
    private final Enricher enricher;
    private final Deduper deduper;
    private final StoreWriter storeWriter;
    private final EventKind kind;

    private final AtomicLong stored = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile boolean running = false;
    private Thread worker;

    public enum Outcome {
        STORED,
        DUPLICATE,
        REJECTED,
        FAILED
    }

    // =====================================================================
    // LIFECYCLE
    // =====================================================================

    public synchronized void start() {
        if (running) return;
        running = true;

        worker = new Thread(this::runLoop, "ingest-" + kind.channel());
        worker.start();
        log.info("▶️ [{}] pipeline started → {}", kind, storeWriter.collection());
    }

    /**
     * Дожидается текущего кадра. Оставшиеся в очереди кадры отбрасываются.
     */
    public synchronized void stop() {
        if (!running) return;
        running = false;

        Thread w = worker;
        if (w != null) {
            try {
                w.join(STOP_TIMEOUT.toMillis());
                if (w.isAlive()) {
                    log.warn("⚠ [{}] pipeline did not finish in {}, interrupting", kind, STOP_TIMEOUT);
                    w.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        int left = frameQueue.size();
        frameQueue.clear();
        log.info("⏹ [{}] pipeline stopped: stored={} duplicates={} rejected={} failed={} droppedQueued={}",
                kind, stored.get(), duplicates.get(), rejected.get(), failed.get(), left);
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        while (running) {
            RawFrame frame;
            try {
                frame = frameQueue.poll(POLL_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("⚠ [{}] pipeline interrupted", kind);
                return;
            }
            if (frame == null) continue;

            process(frame);
        }
    }

    // =====================================================================
    // ONE FRAME
    // =====================================================================

    public Outcome process(RawFrame frame) {
        MarketEvent event;
        try {
            event = router.parse(frame);
        } catch (EventParseException e) {
            rejected.incrementAndGet();
            log.warn("🚫 [{}] frame rejected channel={} field={} session={}: {}",
                    kind, frame.channel(), e.getField(), frame.sessionId(), e.getMessage());
            return Outcome.REJECTED;
        }

        MarketEvent enriched;
        try {
            enriched = enricher.enrich(event);
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            log.error("❌ [{}] enrich failed item_id={} ts={}: {}",
                    kind, event.itemId(), event.timestamp(), e.getMessage(), e);
            return Outcome.FAILED;
        }

        if (!deduper.accept(enriched)) {
            duplicates.incrementAndGet();
            log.info("🔁 [{}] duplicate skipped item_id={} ts={} session={}",
                    kind, enriched.itemId(), enriched.timestamp(), frame.sessionId());
            return Outcome.DUPLICATE;
        }

        PersistResult result;
        try {
            result = storeWriter.persist(enriched);
        } catch (RuntimeException e) {
            log.error("❌ [{}] persist error item_id={} ts={}: {}",
                    kind, enriched.itemId(), enriched.timestamp(), e.getMessage(), e);
            result = PersistResult.FAILED;
        }

        if (!result.isStored()) {
            deduper.forget(enriched);
            failed.incrementAndGet();
            return Outcome.FAILED;
        }

        stored.incrementAndGet();
        log.info("✅ [{}] {} item_id={} name='{}' ts={} price_usd={} price_eur={} wear={} session={}",
                kind, result, enriched.itemId(), enriched.itemName(), enriched.timestamp(),
                enriched.priceUsd(), enriched.enrichment().priceEur(),
                enriched.enrichment().wear().label(), frame.sessionId());
        return Outcome.STORED;
    }

    public long storedCount() {
        return stored.get();
    }

    public long duplicateCount() {
        return duplicates.get();
    }

    public long rejectedCount() {
        return rejected.get();
    }

    public long failedCount() {
        return failed.get();
    }
}
