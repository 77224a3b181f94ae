package com.chicu.marketbot.engine;

import com.chicu.marketbot.common.enums.EventKind;
import com.chicu.marketbot.exception.AuthenticationException;
import com.chicu.marketbot.exchange.bitskins.BitSkinsApiClient;
import com.chicu.marketbot.market.pipeline.IngestionPipeline;
import com.chicu.marketbot.market.stream.StreamConnectionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

/**
 * 🤖 Жизненный цикл бота.
 *
 * Старт: конвейер → проверка аккаунта → WS.
 * Стоп: конвейер дорабатывает текущий кадр → WS_UNSUB и закрытие сессии.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MarketEventBot implements SmartLifecycle {

    private final IngestionPipeline pipeline;
    private final StreamConnectionManager connectionManager;
    private final BitSkinsApiClient apiClient;
    private final EventKind kind;

    private volatile boolean running = false;

    @Override
    public void start() {
        log.info("🚀 Starting {} bot...", kind);

        if (!apiClient.hasApiKey()) {
            throw new AuthenticationException("BitSkins API key is not configured (bot.api-key / BITSKINS_API_KEY)");
        }

        pipeline.start();
        logAccountInfo();
        connectionManager.connect();

        running = true;
    }

    @Override
    public void stop() {
        log.info("🛑 Stopping {} bot...", kind);
        try {
            pipeline.stop();
        } finally {
            connectionManager.close();
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void logAccountInfo() {
        try {
            apiClient.fetchUsername()
                    .ifPresent(u -> log.info("📋 Account profile: {}", u));
            apiClient.fetchBalance()
                    .ifPresent(b -> log.info("💰 Account balance: ${}", b));
        } catch (IllegalStateException e) {
            log.warn("⚠ Could not retrieve account info: {}", e.getMessage());
        }
    }
}
