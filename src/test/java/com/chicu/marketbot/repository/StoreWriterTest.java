package com.chicu.marketbot.repository;

import com.chicu.marketbot.TestClock;
import com.chicu.marketbot.common.enums.EventKind;
import com.chicu.marketbot.common.enums.Wear;
import com.chicu.marketbot.config.BotProperties;
import com.chicu.marketbot.market.model.Enrichment;
import com.chicu.marketbot.market.model.ItemDetails;
import com.chicu.marketbot.market.model.ListedEvent;
import com.chicu.marketbot.market.model.PriceChangedEvent;
import com.mongodb.client.result.UpdateResult;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StoreWriterTest {

    private static final Instant TS = Instant.parse("2024-05-01T10:00:00Z");
    private static final String COLLECTION = "listed_items";
    private static final String RAW =
            "{\"id\":6237035,\"name\":\"AK-47 | Redline (Factory New)\",\"price\":330,\"float_value\":0.06}";

    @Mock private MongoTemplate mongoTemplate;
    @Mock private IndexOperations indexOps;
    @Mock private UpdateResult inserted;
    @Mock private UpdateResult updated;

    private final TestClock clock = new TestClock(TS.plusSeconds(2));
    private final MarketDocumentMapper mapper = new MarketDocumentMapper();
    private BotProperties props;

    @BeforeEach
    void setUp() {
        props = new BotProperties();
        props.setKind(EventKind.LISTED);
        props.getStore().setRetryDelay(Duration.ZERO);
    }

    private StoreWriter writer() {
        return new StoreWriter(mongoTemplate, mapper, props, clock);
    }

    private static ListedEvent listed() {
        Enrichment en = Enrichment.builder()
                .rate(new BigDecimal("0.92"))
                .priceEur(new BigDecimal("0.304"))
                .wear(Wear.FACTORY_NEW)
                .wearFromName(Wear.FACTORY_NEW)
                .build();
        return new ListedEvent("6237035", "AK-47 | Redline (Factory New)",
                ItemDetails.builder()
                        .skinId(1234L)
                        .rawData(RAW)
                        .priceRaw(new BigDecimal("330"))
                        .build(),
                new BigDecimal("0.330"), 0.06, TS, en);
    }

    @Test
    void persist_shouldUpsertByIdentity_insertThenUpdate() {
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(inserted.getUpsertedId()).thenReturn(new BsonObjectId());
        when(updated.getUpsertedId()).thenReturn(null);
        when(mongoTemplate.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION)))
                .thenReturn(inserted)
                .thenReturn(updated);

        StoreWriter w = writer();
        assertEquals(PersistResult.INSERTED, w.persist(listed()));
        assertEquals(PersistResult.UPDATED, w.persist(listed()));

        ArgumentCaptor<Query> queries = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate, times(2)).upsert(queries.capture(), any(UpdateDefinition.class), eq(COLLECTION));

        List<Query> q = queries.getAllValues();
        assertEquals(q.get(0).getQueryObject(), q.get(1).getQueryObject(), "тот же ключ идентичности");
        assertEquals("6237035", q.get(0).getQueryObject().get("item_id"));
        assertEquals(Date.from(TS), q.get(0).getQueryObject().get("timestamp"));
    }

    @Test
    void persist_shouldSetAllDocumentFields() {
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(inserted.getUpsertedId()).thenReturn(new BsonObjectId());
        when(mongoTemplate.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION))).thenReturn(inserted);

        writer().persist(listed());

        ArgumentCaptor<UpdateDefinition> update = ArgumentCaptor.forClass(UpdateDefinition.class);
        verify(mongoTemplate).upsert(any(Query.class), update.capture(), eq(COLLECTION));

        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertEquals("listed", set.get("event_type"));
        assertEquals(0.33, (Double) set.get("price_usd"), 1e-9);
        assertEquals(0.304, (Double) set.get("price_eur"), 1e-9);
        assertEquals("Factory New", set.get("wear"));
        assertEquals(1234L, set.get("skin_id"));
        assertEquals(Date.from(TS.plusSeconds(2)), set.get("processed_at"));

        assertEquals(330L, set.get("price_raw"));
        assertNull(set.get("suggested_price_raw"));
        Document raw = (Document) set.get("raw_data");
        assertEquals(6237035, raw.get("id"));
        assertEquals("AK-47 | Redline (Factory New)", raw.get("name"));
    }

    @Test
    void mapper_priceChanged_shouldKeepWirePrices() {
        Enrichment en = Enrichment.builder()
                .rate(new BigDecimal("0.92"))
                .priceEur(new BigDecimal("0.294"))
                .oldPriceEur(new BigDecimal("0.304"))
                .wear(Wear.UNKNOWN)
                .wearFromName(Wear.UNKNOWN)
                .build();
        PriceChangedEvent pc = new PriceChangedEvent("77", "Sticker", ItemDetails.builder()
                        .rawData("{\"id\":\"77\",\"old_price\":330,\"price\":320,\"suggested_price\":400.5}")
                        .priceRaw(new BigDecimal("320"))
                        .oldPriceRaw(new BigDecimal("330"))
                        .suggestedPriceRaw(new BigDecimal("400.5"))
                        .build(),
                new BigDecimal("0.330"), new BigDecimal("0.320"), new BigDecimal("-3.03"), null, TS, en);

        Document doc = mapper.toDocument(pc, TS);

        assertEquals(330L, doc.get("old_price_raw"));
        assertEquals(320L, doc.get("new_price_raw"));
        assertEquals(400.5, doc.get("suggested_price_raw"));
        assertFalse(doc.containsKey("price_raw"));
        assertEquals("77", ((Document) doc.get("raw_data")).get("id"));
    }

    @Test
    void ensureIndexes_shouldRunOnce_withUniqueIdentity() {
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);

        StoreWriter w = writer();
        w.ensureIndexes();
        w.ensureIndexes();

        ArgumentCaptor<IndexDefinition> defs = ArgumentCaptor.forClass(IndexDefinition.class);
        verify(indexOps, times(EventKind.LISTED.indexedFields().size() + 1)).ensureIndex(defs.capture());
        verify(mongoTemplate, times(1)).indexOps(COLLECTION);

        IndexDefinition identity = defs.getValue();
        assertEquals(new Document("item_id", 1).append("timestamp", 1), identity.getIndexKeys());
        assertEquals(Boolean.TRUE, identity.getIndexOptions().get("unique"));
        assertEquals(StoreWriter.IDENTITY_INDEX, identity.getIndexOptions().get("name"));
    }

    @Test
    void indexFailure_shouldNotBlockWrites() {
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(indexOps.ensureIndex(any(IndexDefinition.class)))
                .thenThrow(new DataAccessResourceFailureException("E11000 duplicate key"));
        when(mongoTemplate.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION))).thenReturn(updated);

        assertEquals(PersistResult.UPDATED, writer().persist(listed()));
    }

    @Test
    void persist_shouldRetryThenReportFailure() {
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(mongoTemplate.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION)))
                .thenThrow(new DataAccessResourceFailureException("no primary"));

        PersistResult r = writer().persist(listed());

        assertEquals(PersistResult.FAILED, r);
        assertFalse(r.isStored());
        verify(mongoTemplate, times(3)).upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION));
    }

    @Test
    void persist_shouldRecoverOnRetry() {
        when(mongoTemplate.indexOps(COLLECTION)).thenReturn(indexOps);
        when(inserted.getUpsertedId()).thenReturn(new BsonObjectId());
        when(mongoTemplate.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION)))
                .thenThrow(new DataAccessResourceFailureException("socket timeout"))
                .thenReturn(inserted);

        assertEquals(PersistResult.INSERTED, writer().persist(listed()));
    }

    @Test
    void persist_shouldRejectForeignKind() {
        PriceChangedEvent pc = new PriceChangedEvent("1", "x", ItemDetails.empty(),
                BigDecimal.ONE, BigDecimal.TEN, null, null, TS, null);

        assertThrows(IllegalArgumentException.class, () -> writer().persist(pc));
        verifyNoInteractions(mongoTemplate);
    }
}
