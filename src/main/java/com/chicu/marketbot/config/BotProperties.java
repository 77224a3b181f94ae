package com.chicu.marketbot.config;

import com.chicu.marketbot.common.enums.EventKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "bot")
public class BotProperties {

    /**
     * Вид событий этого экземпляра: LISTED / PRICE_CHANGED / DELISTED_SOLD.
     */
    private EventKind kind = EventKind.LISTED;

    /**
     * Ключ BitSkins API (x-apikey / WS_AUTH_APIKEY).
     */
    private String apiKey = "";

    private Stream stream = new Stream();
    private Reconnect reconnect = new Reconnect();
    private Rate rate = new Rate();
    private Dedup dedup = new Dedup();
    private Store store = new Store();

    @Data
    public static class Stream {
        private String url = "wss://ws.bitskins.com";

        /** WS ping; нет pong за интервал → обрыв */
        private Duration pingInterval = Duration.ofSeconds(20);

        private Duration connectTimeout = Duration.ofSeconds(10);

        /** Сколько ждём ответ на WS_AUTH_APIKEY */
        private Duration authTimeout = Duration.ofSeconds(15);

        /** Ёмкость очереди кадров между WS и конвейером */
        private int queueCapacity = 1_000;
    }

    @Data
    public static class Reconnect {
        private Duration baseDelay = Duration.ofSeconds(1);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(60);

        /** Доля случайного сокращения задержки, 0..1 */
        private double jitter = 0.2;

        /** Сколько нужно простоять в STREAMING, чтобы сбросить счётчик попыток */
        private Duration stabilityThreshold = Duration.ofMinutes(2);
    }

    @Data
    public static class Rate {
        private String apiBaseUrl = "https://api.bitskins.com";
        private Duration refreshInterval = Duration.ofHours(1);

        /** Курс USD→EUR до первого успешного обновления */
        private BigDecimal defaultEurRate = new BigDecimal("0.92");

        private Duration requestTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Dedup {
        private int capacity = 10_000;
        private Duration window = Duration.ofMinutes(15);
    }

    @Data
    public static class Store {
        private int maxAttempts = 3;
        private Duration retryDelay = Duration.ofMillis(500);

        /** Переопределение имени коллекции (пусто → из EventKind) */
        private String collection = "";
    }

    public String collectionName() {
        String override = store.getCollection();
        return override == null || override.isBlank() ? kind.collection() : override.trim();
    }
}
