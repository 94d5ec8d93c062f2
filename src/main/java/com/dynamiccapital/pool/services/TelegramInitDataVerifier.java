package com.dynamiccapital.pool.services;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Verifies Telegram Mini App {@code initData} launch payloads.
 *
 * <p>The data-check-string is every {@code key=value} pair except {@code hash}, sorted by
 * key and joined with newlines. The expected hash is
 * {@code hex(HMAC_SHA256(HMAC_SHA256("WebAppData", botToken), dataCheckString))}.</p>
 */
public class TelegramInitDataVerifier {

    static final String WEB_APP_DATA_KEY = "WebAppData";
    private static final long FUTURE_SKEW_SECONDS = 60;

    private final String botToken;
    private final Duration maxAge;
    private final Clock clock;

    public TelegramInitDataVerifier(String botToken, Duration maxAge, Clock clock) {
        this.botToken = botToken;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    /**
     * Returns the Telegram user id carried by a valid payload, or null when the payload is
     * malformed, unsigned, tampered with or stale.
     */
    public String verify(String initData) throws NoSuchAlgorithmException, InvalidKeyException {
        if (initData == null || initData.isBlank()) {
            return null;
        }
        if (botToken == null || botToken.isEmpty()) {
            LoggingService.warn("telegram_bot_token_missing");
            return null;
        }

        Map<String, String> fields = parse(initData);
        String receivedHash = fields.remove("hash");
        if (receivedHash == null || receivedHash.isEmpty()) {
            LoggingService.warn("init_data_hash_missing");
            return null;
        }

        byte[] secret = hmacSha256(WEB_APP_DATA_KEY.getBytes(StandardCharsets.UTF_8), botToken);
        String expectedHash = toHex(hmacSha256(secret, dataCheckString(fields)));
        if (!MessageDigest.isEqual(
                expectedHash.getBytes(StandardCharsets.UTF_8),
                receivedHash.toLowerCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8))) {
            LoggingService.warn("init_data_hash_mismatch");
            return null;
        }

        if (!isFresh(fields.get("auth_date"))) {
            return null;
        }
        return extractUserId(fields.get("user"));
    }

    private boolean isFresh(String authDate) {
        long authSeconds;
        try {
            authSeconds = Long.parseLong(authDate);
        } catch (NumberFormatException e) {
            LoggingService.warn("init_data_auth_date_invalid", Map.of("authDate", String.valueOf(authDate)));
            return false;
        }
        long now = Instant.now(clock).getEpochSecond();
        if (authSeconds > now + FUTURE_SKEW_SECONDS) {
            LoggingService.warn("init_data_auth_date_in_future", Map.of("authDate", authSeconds));
            return false;
        }
        if (now - authSeconds > maxAge.getSeconds()) {
            LoggingService.warn("init_data_expired", Map.of("ageSeconds", now - authSeconds));
            return false;
        }
        return true;
    }

    static Map<String, String> parse(String initData) {
        Map<String, String> fields = new TreeMap<>();
        for (String pair : initData.split("&")) {
            if (pair.isEmpty()) continue;
            String[] kv = pair.split("=", 2);
            String key = URLDecoder.decode(kv[0], StandardCharsets.UTF_8);
            String value = kv.length == 2 ? URLDecoder.decode(kv[1], StandardCharsets.UTF_8) : "";
            fields.put(key, value);
        }
        return fields;
    }

    /**
     * Sorted {@code key=value} lines. {@code fields} must not contain the hash.
     */
    static String dataCheckString(Map<String, String> fields) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : new TreeMap<>(fields).entrySet()) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
        }
        return sb.toString();
    }

    private static String extractUserId(String userJson) {
        if (userJson == null || userJson.isEmpty()) {
            return null;
        }
        try {
            JsonObject user = JsonParser.parseString(userJson).getAsJsonObject();
            JsonElement id = user.get("id");
            if (id == null || id.isJsonNull()) {
                return null;
            }
            return id.getAsJsonPrimitive().isNumber()
                    ? String.valueOf(id.getAsLong())
                    : id.getAsString();
        } catch (RuntimeException e) {
            LoggingService.warn("init_data_user_invalid", Map.of("error", String.valueOf(e.getMessage())));
            return null;
        }
    }

    static byte[] hmacSha256(byte[] key, String message) throws NoSuchAlgorithmException, InvalidKeyException {
        Mac sha256Hmac = Mac.getInstance("HmacSHA256");
        sha256Hmac.init(new SecretKeySpec(key, "HmacSHA256"));
        return sha256Hmac.doFinal(message.getBytes(StandardCharsets.UTF_8));
    }

    static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder();
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}
