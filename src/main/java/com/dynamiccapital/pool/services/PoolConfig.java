package com.dynamiccapital.pool.services;

import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Pool tunables. Each key is looked up in the process environment first, then in
 * secrets.json, then falls back to its default.
 */
public class PoolConfig {

    public static final String NOTICE_PERIOD_DAYS = "POOL_NOTICE_PERIOD_DAYS";
    public static final String INIT_DATA_MAX_AGE_SECONDS = "POOL_INIT_DATA_MAX_AGE_SECONDS";
    public static final String DEFAULT_REINVEST_PERCENT = "POOL_DEFAULT_REINVEST_PERCENT";
    public static final String TELEGRAM_BOT_TOKEN = "TELEGRAM_BOT_TOKEN";

    public static final int DEFAULT_NOTICE_PERIOD_DAYS = 7;
    public static final long DEFAULT_INIT_DATA_MAX_AGE_SECONDS = 86400;
    public static final double DEFAULT_REINVEST_PERCENT_VALUE = 16.0;

    private final Function<String, String> lookup;

    public PoolConfig(Function<String, String> lookup) {
        this.lookup = lookup;
    }

    public static PoolConfig fromEnvironment() {
        return new PoolConfig(key -> {
            String value = System.getenv(key);
            return value != null && !value.isBlank() ? value : SecretsProvider.getString(key);
        });
    }

    public int getNoticePeriodDays() {
        long days = getLong(NOTICE_PERIOD_DAYS, DEFAULT_NOTICE_PERIOD_DAYS);
        return (int) Math.max(0, Math.min(days, 365));
    }

    public Duration getInitDataMaxAge() {
        return Duration.ofSeconds(Math.max(0, getLong(INIT_DATA_MAX_AGE_SECONDS, DEFAULT_INIT_DATA_MAX_AGE_SECONDS)));
    }

    public Duration getNoticePeriod() {
        return Duration.ofDays(getNoticePeriodDays());
    }

    /**
     * Share of a withdrawal kept in the pool when the request names none. Clamped to 0..100.
     */
    public double getDefaultReinvestPercent() {
        String raw = lookup.apply(DEFAULT_REINVEST_PERCENT);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_REINVEST_PERCENT_VALUE;
        }
        try {
            double value = Double.parseDouble(raw.trim());
            if (!Double.isFinite(value)) {
                throw new NumberFormatException("not finite");
            }
            return PoolMath.clamp(value, 0.0, 100.0);
        } catch (NumberFormatException e) {
            LoggingService.warn("pool_config_invalid_number", Map.of("key", DEFAULT_REINVEST_PERCENT, "value", raw));
            return DEFAULT_REINVEST_PERCENT_VALUE;
        }
    }

    /**
     * Bot token used to verify Mini App launch payloads. Empty when not configured.
     */
    public String getTelegramBotToken() {
        String value = lookup.apply(TELEGRAM_BOT_TOKEN);
        return value != null ? value.trim() : "";
    }

    private long getLong(String key, long defaultValue) {
        String raw = lookup.apply(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            LoggingService.warn("pool_config_invalid_number", Map.of("key", key, "value", raw));
            return defaultValue;
        }
    }
}
