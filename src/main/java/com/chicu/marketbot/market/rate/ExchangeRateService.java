package com.chicu.marketbot.market.rate;

import com.chicu.marketbot.config.BotProperties;
import com.chicu.marketbot.exception.RateSourceException;
import com.chicu.marketbot.exchange.bitskins.BitSkinsApiClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 💶 Кэш курса USD → EUR.
 *
 * Обновляется по расписанию, last-writer-wins. Ошибка обновления
 * не трогает последний известный курс. До первого успешного обновления
 * отдаётся курс по умолчанию из конфигурации.
 */
@Slf4j
@Service
public class ExchangeRateService {

    public static final String DISPLAY_CURRENCY = "EUR";

    private final BitSkinsApiClient apiClient;
    private final Clock clock;

    private final AtomicReference<CachedRate> current;

    public ExchangeRateService(BitSkinsApiClient apiClient, BotProperties props, Clock clock) {
        this.apiClient = apiClient;
        this.clock = clock;
        this.current = new AtomicReference<>(
                new CachedRate(props.getRate().getDefaultEurRate(), null, false)
        );
    }

    public BigDecimal currentRate() {
        return current.get().rate();
    }

    public CachedRate snapshot() {
        return current.get();
    }

    @Scheduled(
            initialDelayString = "PT0S",
            fixedDelayString = "${bot.rate.refresh-interval:PT1H}"
    )
    public void refresh() {
        try {
            BigDecimal fresh = apiClient.fetchRate(DISPLAY_CURRENCY);
            BigDecimal previous = current.getAndSet(new CachedRate(fresh, Instant.now(clock), true)).rate();

            if (previous.compareTo(fresh) != 0) {
                log.info("💶 EUR rate updated {} → {}", previous, fresh);
            } else {
                log.debug("💶 EUR rate unchanged {}", fresh);
            }

        } catch (RateSourceException e) {
            CachedRate last = current.get();
            log.warn("⚠ EUR rate refresh failed, keep {} (fetched={} at {}): {}",
                    last.rate(), last.fetched(), last.fetchedAt(), e.getMessage());
        }
    }

    /**
     * @param fetched false: курс по умолчанию, с API ещё не приходил
     */
    public record CachedRate(BigDecimal rate, Instant fetchedAt, boolean fetched) {}
}
