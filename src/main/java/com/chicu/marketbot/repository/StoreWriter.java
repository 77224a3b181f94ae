package com.chicu.marketbot.repository;

import com.chicu.marketbot.common.enums.EventKind;
import com.chicu.marketbot.config.BotProperties;
import com.chicu.marketbot.exception.PersistenceException;
import com.chicu.marketbot.market.model.MarketEvent;
import com.mongodb.client.result.UpdateResult;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.chicu.marketbot.repository.MarketDocumentMapper.ITEM_ID;
import static com.chicu.marketbot.repository.MarketDocumentMapper.TIMESTAMP;
import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * 💾 Идемпотентная запись событий в коллекцию своего вида.
 *
 * Upsert по (item_id, timestamp): повтор после реконнекта не создаёт дубль,
 * поля перезаписываются значениями последней записи.
 */
@Slf4j
@Repository
public class StoreWriter {

    public static final String IDENTITY_INDEX = "item_id_timestamp_uq";

    private final MongoTemplate mongoTemplate;
    private final MarketDocumentMapper mapper;
    private final Clock clock;

    private final EventKind kind;
    private final String collection;
    private final int maxAttempts;
    private final Duration retryDelay;

    private final AtomicBoolean indexesReady = new AtomicBoolean(false);

    public StoreWriter(MongoTemplate mongoTemplate,
                       MarketDocumentMapper mapper,
                       BotProperties props,
                       Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.mapper = mapper;
        this.clock = clock;
        this.kind = props.getKind();
        this.collection = props.collectionName();
        this.maxAttempts = Math.max(1, props.getStore().getMaxAttempts());
        this.retryDelay = props.getStore().getRetryDelay();
    }

    public String collection() {
        return collection;
    }

    public PersistResult persist(MarketEvent event) {
        if (event.kind() != kind) {
            throw new IllegalArgumentException("StoreWriter for " + kind + " got " + event.kind());
        }

        ensureIndexes();

        Document doc = mapper.toDocument(event, Instant.now(clock));
        Query identity = Query.query(
                where(ITEM_ID).is(event.itemId())
                        .and(TIMESTAMP).is(Date.from(event.timestamp()))
        );
        Update update = new Update();
        doc.forEach(update::set);

        DataAccessException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                UpdateResult r = mongoTemplate.upsert(identity, update, collection);
                return r.getUpsertedId() != null ? PersistResult.INSERTED : PersistResult.UPDATED;

            } catch (DataAccessException e) {
                lastError = e;
                log.warn("⚠ [{}] upsert attempt {}/{} failed item_id={} ts={}: {}",
                        kind, attempt, maxAttempts, event.itemId(), event.timestamp(), e.getMessage());

                if (attempt < maxAttempts && !pause()) {
                    break;
                }
            }
        }

        PersistenceException failure = new PersistenceException(
                "upsert into " + collection + " failed after " + maxAttempts + " attempts", lastError);
        log.error("❌ [{}] DROPPED item_id={} ts={}: {}",
                kind, event.itemId(), event.timestamp(), failure.getMessage(), failure);
        return PersistResult.FAILED;
    }

    // =====================================================================
    // INDEXES
    // =====================================================================

    /**
     * Идемпотентно, безопасно на каждом старте. Ошибка индекса не останавливает запись.
     */
    public void ensureIndexes() {
        if (!indexesReady.compareAndSet(false, true)) return;

        IndexOperations ops = mongoTemplate.indexOps(collection);

        for (String field : kind.indexedFields()) {
            try {
                ops.ensureIndex(new Index().on(field, Sort.Direction.ASC));
            } catch (DataAccessException e) {
                log.warn("⚠ [{}] index {}.{} not created: {}", kind, collection, field, e.getMessage());
            }
        }

        try {
            ops.ensureIndex(new Index()
                    .on(ITEM_ID, Sort.Direction.ASC)
                    .on(TIMESTAMP, Sort.Direction.ASC)
                    .unique()
                    .named(IDENTITY_INDEX));
        } catch (DataAccessException e) {
            // старые данные с дублями: upsert всё равно не плодит новых
            log.warn("⚠ [{}] unique index {} not created: {}", kind, IDENTITY_INDEX, e.getMessage());
        }

        log.info("🗂 [{}] indexes ensured on {}: {}", kind, collection, kind.indexedFields());
    }

    private boolean pause() {
        if (retryDelay == null || retryDelay.isZero() || retryDelay.isNegative()) return true;
        try {
            Thread.sleep(retryDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
