package com.chicu.marketbot.market.rate;

import com.chicu.marketbot.TestClock;
import com.chicu.marketbot.config.BotProperties;
import com.chicu.marketbot.exception.RateSourceException;
import com.chicu.marketbot.exchange.bitskins.BitSkinsApiClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExchangeRateServiceTest {

    @Mock
    private BitSkinsApiClient apiClient;

    private final TestClock clock = new TestClock(Instant.parse("2024-05-01T10:00:00Z"));
    private ExchangeRateService service;

    @BeforeEach
    void setUp() {
        BotProperties props = new BotProperties();
        props.getRate().setDefaultEurRate(new BigDecimal("0.92"));
        service = new ExchangeRateService(apiClient, props, clock);
    }

    @Test
    void beforeFirstRefresh_shouldServeConfiguredDefault() {
        assertEquals(new BigDecimal("0.92"), service.currentRate());
        assertFalse(service.snapshot().fetched());
        assertNull(service.snapshot().fetchedAt());
    }

    @Test
    void refresh_shouldReplaceRate() {
        when(apiClient.fetchRate("EUR")).thenReturn(new BigDecimal("0.9312"));

        service.refresh();

        assertEquals(new BigDecimal("0.9312"), service.currentRate());
        assertTrue(service.snapshot().fetched());
        assertEquals(clock.instant(), service.snapshot().fetchedAt());
    }

    @Test
    void failedRefresh_shouldKeepLastKnownRate() {
        when(apiClient.fetchRate("EUR"))
                .thenReturn(new BigDecimal("0.95"))
                .thenThrow(new RateSourceException("HTTP 503"));

        service.refresh();
        Instant fetchedAt = service.snapshot().fetchedAt();

        clock.advance(Duration.ofHours(1));
        service.refresh();

        assertEquals(new BigDecimal("0.95"), service.currentRate());
        assertEquals(fetchedAt, service.snapshot().fetchedAt());
    }

    @Test
    void failedFirstRefresh_shouldKeepDefault() {
        when(apiClient.fetchRate("EUR")).thenThrow(new RateSourceException("no api key"));

        service.refresh();

        assertEquals(new BigDecimal("0.92"), service.currentRate());
        assertFalse(service.snapshot().fetched());
    }
}
