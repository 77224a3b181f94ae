package com.chicu.marketbot.config;

import com.chicu.marketbot.common.enums.EventKind;
import com.chicu.marketbot.market.model.RawFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Slf4j
@Configuration
@EnableScheduling
@EnableConfigurationProperties(BotProperties.class)
public class BotConfig {

    @Bean
    public EventKind eventKind(BotProperties props) {
        EventKind kind = props.getKind();
        log.info("🤖 Bot kind={} channel={} collection={}",
                kind, kind.channel(), props.collectionName());
        return kind;
    }

    /**
     * Очередь кадров WS → конвейер. Ограничена: при переполнении
     * поток чтения OkHttp блокируется (backpressure).
     */
    @Bean
    public BlockingQueue<RawFrame> frameQueue(BotProperties props) {
        return new ArrayBlockingQueue<>(Math.max(1, props.getStream().getQueueCapacity()));
    }

    /** Реконнекты и таймауты авторизации */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService streamScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bitskins-reconnect");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
