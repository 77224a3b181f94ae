package com.chicu.marketbot.engine;

import com.chicu.marketbot.exception.AuthenticationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ⛔ Завершение процесса при фатальной ошибке авторизации.
 * Контекст закрывается штатно (конвейер дорабатывает кадр, WS закрывается).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BotTerminator {

    public static final int AUTH_FAILURE_EXIT_CODE = 2;

    private final ConfigurableApplicationContext context;

    private final AtomicBoolean terminating = new AtomicBoolean(false);

    public void terminate(AuthenticationException cause) {
        if (!terminating.compareAndSet(false, true)) return;

        log.error("⛔ FATAL authentication error, stopping bot: {}", cause.getMessage());

        // не из потока OkHttp: закрытие контекста сам закрывает WS
        Thread t = new Thread(() -> {
            int code = SpringApplication.exit(context, () -> AUTH_FAILURE_EXIT_CODE);
            System.exit(code);
        }, "bot-terminator");
        t.start();
    }
}
