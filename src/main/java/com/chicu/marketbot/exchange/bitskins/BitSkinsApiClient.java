package com.chicu.marketbot.exchange.bitskins;

import com.chicu.marketbot.config.BotProperties;
import com.chicu.marketbot.exception.RateSourceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * REST BitSkins: курсы валют и профиль аккаунта.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BitSkinsApiClient {

    private static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");

    private final OkHttpClient baseClient;
    private final ObjectMapper objectMapper;
    private final BotProperties props;

    private OkHttpClient restClient() {
        return baseClient.newBuilder()
                .callTimeout(props.getRate().getRequestTimeout())
                .pingInterval(Duration.ZERO)
                .build();
    }

    // =====================================================================
    // CURRENCY
    // =====================================================================

    /**
     * Курс USD → currency из /config/currency/list.
     * Формат ответа плавает: курсы лежат в data, rates или прямо в корне.
     */
    public BigDecimal fetchRate(String currency) {
        if (!hasApiKey()) {
            throw new RateSourceException("no API key configured, currency list unavailable");
        }

        JsonNode root;
        try {
            root = get("/config/currency/list");
        } catch (IllegalStateException e) {
            throw new RateSourceException("currency request failed: " + e.getMessage(), e);
        }

        JsonNode rates = root;
        if (root.path("data").isObject()) {
            rates = root.path("data");
        } else if (root.path("rates").isObject()) {
            rates = root.path("rates");
        }

        return findRate(rates, currency)
                .orElseThrow(() -> new RateSourceException("no " + currency + " rate in response"));
    }

    private Optional<BigDecimal> findRate(JsonNode rates, String currency) {
        Iterator<Map.Entry<String, JsonNode>> it = rates.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getKey().equalsIgnoreCase(currency)) continue;

            JsonNode v = e.getValue();
            // {"EUR": 0.92} или {"EUR": {"rate": 0.92}}
            JsonNode num = v.isObject() ? v.path("rate") : v;
            if (num.isNumber() || num.isTextual()) {
                try {
                    BigDecimal rate = new BigDecimal(num.asText().trim());
                    if (rate.signum() > 0) return Optional.of(rate);
                } catch (NumberFormatException ex) {
                    log.warn("⚠ Bad {} rate value '{}'", currency, num.asText());
                }
            }
        }
        return Optional.empty();
    }

    // =====================================================================
    // ACCOUNT
    // =====================================================================

    public Optional<String> fetchUsername() {
        JsonNode root = get("/account/profile/me");
        String username = root.path("data").path("username").asText(null);
        return Optional.ofNullable(username);
    }

    public Optional<BigDecimal> fetchBalance() {
        JsonNode root = post("/account/profile/balance", Map.of());
        JsonNode balance = root.path("data").path("balance");
        if (balance.isMissingNode() || balance.isNull()) return Optional.empty();
        return Optional.of(balance.decimalValue());
    }

    public boolean hasApiKey() {
        return props.getApiKey() != null && !props.getApiKey().isBlank();
    }

    // =====================================================================
    // HTTP
    // =====================================================================

    private JsonNode get(String path) {
        return execute(path, new Request.Builder().url(url(path)).get());
    }

    private JsonNode post(String path, Object body) {
        try {
            String json = objectMapper.writeValueAsString(body);
            return execute(path, new Request.Builder().url(url(path)).post(RequestBody.create(json, JSON)));
        } catch (IOException e) {
            throw new IllegalStateException("BitSkins request encode error: " + path, e);
        }
    }

    private JsonNode execute(String path, Request.Builder rb) {
        rb.header("x-apikey", props.getApiKey().trim());

        try (Response resp = restClient().newCall(rb.build()).execute()) {

            String respBody = resp.body() != null ? resp.body().string() : "";

            if (!resp.isSuccessful()) {
                log.warn("🌐 BitSkins API error: {} -> {} body={}", path, resp.code(), shrink(respBody));
                throw new IllegalStateException("BitSkins HTTP " + resp.code() + ": " + shrink(respBody));
            }

            if (respBody.isBlank()) {
                throw new IllegalStateException("BitSkins empty response: " + path);
            }

            return objectMapper.readTree(respBody);

        } catch (IOException e) {
            throw new IllegalStateException("BitSkins IO error: " + path + " -> " + e.getMessage(), e);
        }
    }

    private String url(String path) {
        return props.getRate().getApiBaseUrl().replaceAll("/+$", "") + path;
    }

    private static String shrink(String s) {
        if (s == null) return "null";
        String x = s.trim().replaceAll("\\s+", " ");
        if (x.length() <= 400) return x;
        return x.substring(0, 400) + "...";
    }
}
