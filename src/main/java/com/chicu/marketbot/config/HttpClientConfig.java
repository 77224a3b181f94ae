package com.chicu.marketbot.config;

import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final BotProperties props;

    /**
     * 🌐 ЕДИНЫЙ OkHttpClient для всего приложения
     * Используется BitSkins WS (ping/pong heartbeat) и REST.
     * readTimeout = 0: WS живёт бесконечно, живость проверяет ping.
     */
    @Bean
    public OkHttpClient okHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(props.getStream().getConnectTimeout())
                .readTimeout(Duration.ZERO)
                .writeTimeout(Duration.ofSeconds(30))
                .pingInterval(props.getStream().getPingInterval())
                .retryOnConnectionFailure(true)
                .build();
    }
}
