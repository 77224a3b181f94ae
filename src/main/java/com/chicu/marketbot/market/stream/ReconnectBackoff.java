package com.chicu.marketbot.market.stream;

import com.chicu.marketbot.config.BotProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Экспоненциальная задержка реконнекта с jitter.
 *
 * delay = base * multiplier^attempt, срезается jitter-ом вниз, ограничена maxDelay.
 * Между сбросами последовательность не убывает. Счётчик попыток сбрасывается,
 * если перед обрывом сессия простояла в STREAMING дольше stabilityThreshold.
 */
public class ReconnectBackoff {

    /** Дальше рост всё равно упирается в maxDelay */
    private static final int MAX_EXPONENT = 32;

    private final Duration baseDelay;
    private final double multiplier;
    private final Duration maxDelay;
    private final double jitter;
    private final Duration stabilityThreshold;
    private final DoubleSupplier random;

    private int attempt;
    private Duration lastDelay = Duration.ZERO;
    private Instant streamingSince;

    public ReconnectBackoff(BotProperties.Reconnect cfg) {
        this(cfg, () -> ThreadLocalRandom.current().nextDouble());
    }

    public ReconnectBackoff(BotProperties.Reconnect cfg, DoubleSupplier random) {
        this.baseDelay = positive(cfg.getBaseDelay(), Duration.ofSeconds(1));
        Duration max = positive(cfg.getMaxDelay(), Duration.ofSeconds(60));
        this.maxDelay = max.compareTo(baseDelay) < 0 ? baseDelay : max;
        this.multiplier = Math.max(1.0, cfg.getMultiplier());
        this.jitter = Math.min(1.0, Math.max(0.0, cfg.getJitter()));
        this.stabilityThreshold = positive(cfg.getStabilityThreshold(), Duration.ofMinutes(2));
        this.random = random;
    }

    public synchronized void onStreaming(Instant now) {
        this.streamingSince = now;
    }

    /**
     * Задержка перед следующей попыткой. Увеличивает счётчик.
     */
    public synchronized Duration nextDelay(Instant now) {
        if (streamingSince != null
                && Duration.between(streamingSince, now).compareTo(stabilityThreshold) >= 0) {
            reset();
        }
        streamingSince = null;

        double exp = Math.pow(multiplier, Math.min(attempt, MAX_EXPONENT));
        double rawMs = Math.min(maxDelay.toMillis(), baseDelay.toMillis() * exp);
        double jitteredMs = rawMs * (1.0 - jitter * random.getAsDouble());

        long delayMs = Math.max(lastDelay.toMillis(), Math.round(jitteredMs));
        delayMs = Math.min(delayMs, maxDelay.toMillis());

        attempt++;
        lastDelay = Duration.ofMillis(delayMs);
        return lastDelay;
    }

    public synchronized void reset() {
        attempt = 0;
        lastDelay = Duration.ZERO;
    }

    public synchronized int attempt() {
        return attempt;
    }

    public Duration maxDelay() {
        return maxDelay;
    }

    private static Duration positive(Duration d, Duration fallback) {
        return d == null || d.isZero() || d.isNegative() ? fallback : d;
    }
}
