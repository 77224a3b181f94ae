package com.chicu.marketbot.market.stream;

import com.chicu.marketbot.config.BotProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectBackoffTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private static BotProperties.Reconnect cfg(double jitter) {
        BotProperties.Reconnect c = new BotProperties.Reconnect();
        c.setBaseDelay(Duration.ofSeconds(1));
        c.setMultiplier(2.0);
        c.setMaxDelay(Duration.ofSeconds(30));
        c.setJitter(jitter);
        c.setStabilityThreshold(Duration.ofMinutes(2));
        return c;
    }

    @Test
    void nextDelay_shouldGrowExponentially_withoutJitter() {
        ReconnectBackoff b = new ReconnectBackoff(cfg(0.0), () -> 0.5);

        List<Long> delays = new ArrayList<>();
        for (int i = 0; i < 7; i++) {
            delays.add(b.nextDelay(T0).toMillis());
        }

        assertEquals(List.of(1_000L, 2_000L, 4_000L, 8_000L, 16_000L, 30_000L, 30_000L), delays);
        assertEquals(7, b.attempt());
    }

    @Test
    void nextDelay_shouldBeNonDecreasingAndBounded_withJitter() {
        Random rnd = new Random(42);
        ReconnectBackoff b = new ReconnectBackoff(cfg(0.5), rnd::nextDouble);

        long prev = 0;
        for (int i = 0; i < 50; i++) {
            long d = b.nextDelay(T0).toMillis();
            assertTrue(d >= prev, "задержка уменьшилась: " + prev + " → " + d);
            assertTrue(d <= 30_000, "выше maxDelay: " + d);
            assertTrue(d > 0);
            prev = d;
        }
        assertTrue(prev >= 15_000, "после многих попыток задержка у потолка: " + prev);
    }

    @Test
    void nextDelay_shouldResetAttempts_afterSustainedStreaming() {
        ReconnectBackoff b = new ReconnectBackoff(cfg(0.0), () -> 0.0);

        for (int i = 0; i < 5; i++) b.nextDelay(T0);
        assertEquals(5, b.attempt());

        Instant streamingAt = T0.plusSeconds(60);
        b.onStreaming(streamingAt);

        Duration d = b.nextDelay(streamingAt.plus(Duration.ofMinutes(3)));

        assertEquals(Duration.ofSeconds(1), d, "после стабильной сессии снова с базовой задержки");
        assertEquals(1, b.attempt());
    }

    @Test
    void nextDelay_shouldKeepGrowing_whenStreamingWasShort() {
        ReconnectBackoff b = new ReconnectBackoff(cfg(0.0), () -> 0.0);

        b.nextDelay(T0);
        b.nextDelay(T0);

        b.onStreaming(T0);
        Duration d = b.nextDelay(T0.plusSeconds(30));

        assertEquals(Duration.ofSeconds(4), d);
        assertEquals(3, b.attempt());
    }
}
