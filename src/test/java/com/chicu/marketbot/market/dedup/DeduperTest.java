package com.chicu.marketbot.market.dedup;

import com.chicu.marketbot.TestClock;
import com.chicu.marketbot.market.model.ItemDetails;
import com.chicu.marketbot.market.model.ListedEvent;
import com.chicu.marketbot.market.model.PriceChangedEvent;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DeduperTest {

    private static final Instant TS = Instant.parse("2024-05-01T10:00:00Z");

    private final TestClock clock = new TestClock(TS);

    private static ListedEvent listed(String id, Instant ts, String price) {
        return new ListedEvent(id, "AK-47 | Redline (Field-Tested)", ItemDetails.empty(),
                new BigDecimal(price), 0.2, ts, null);
    }

    @Test
    void sameKey_shouldBeAcceptedOnce() {
        Deduper deduper = new Deduper(100, Duration.ofMinutes(15), clock);

        assertTrue(deduper.accept(listed("1", TS, "0.330")));
        assertFalse(deduper.accept(listed("1", TS, "0.330")));
        assertFalse(deduper.accept(listed("1", TS, "0.999")), "ключ не зависит от цены");
        assertEquals(1, deduper.size());
    }

    @Test
    void differentTimestampOrKind_shouldNotCollide() {
        Deduper deduper = new Deduper(100, Duration.ofMinutes(15), clock);

        assertTrue(deduper.accept(listed("1", TS, "0.330")));
        assertTrue(deduper.accept(listed("1", TS.plusSeconds(1), "0.330")));
        assertTrue(deduper.accept(new PriceChangedEvent("1", "x", ItemDetails.empty(),
                new BigDecimal("0.330"), new BigDecimal("0.320"), null, null, TS, null)));
    }

    @Test
    void entriesOutsideWindow_shouldExpire() {
        Deduper deduper = new Deduper(100, Duration.ofMinutes(15), clock);
        assertTrue(deduper.accept(listed("1", TS, "0.330")));

        clock.advance(Duration.ofMinutes(14));
        assertFalse(deduper.accept(listed("1", TS, "0.330")));

        clock.advance(Duration.ofMinutes(2));
        assertTrue(deduper.accept(listed("1", TS, "0.330")), "окно 15 минут прошло");
    }

    @Test
    void capacity_shouldEvictOldestFirst() {
        Deduper deduper = new Deduper(2, Duration.ofMinutes(15), clock);

        assertTrue(deduper.accept(listed("1", TS, "1")));
        assertTrue(deduper.accept(listed("2", TS, "1")));
        assertTrue(deduper.accept(listed("3", TS, "1")));

        assertEquals(2, deduper.size());
        assertFalse(deduper.accept(listed("3", TS, "1")));
        assertTrue(deduper.accept(listed("1", TS, "1")), "вытеснен как самый старый");
    }

    @Test
    void forgottenKey_shouldBeAcceptedAgain() {
        Deduper deduper = new Deduper(100, Duration.ofMinutes(15), clock);
        ListedEvent e = listed("1", TS, "0.330");

        assertTrue(deduper.accept(e));
        assertTrue(deduper.forget(e));
        assertFalse(deduper.forget(e));
        assertTrue(deduper.accept(e));
        assertEquals(1, deduper.size());
    }

    @Test
    void zeroCapacity_shouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Deduper(0, Duration.ofMinutes(1), clock));
    }
}
