package com.dynamiccapital.pool.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Cached provider for secrets.json values.
 * Reads the file once on first access (double-checked locking) and keeps every
 * key-value pair in memory for the life of the Lambda container.
 *
 * Package-private, only used by {@link PoolConfig}.
 */
class SecretsProvider {

    static final String SECRETS_FILE = "secrets.json";

    private static volatile Map<String, String> cache;

    private SecretsProvider() {}

    /**
     * Returns the value for the given key, or an empty string if the key is absent.
     */
    static String getString(String key) {
        if (cache == null) {
            synchronized (SecretsProvider.class) {
                if (cache == null) {
                    cache = loadSecrets(new File(SECRETS_FILE));
                }
            }
        }
        return cache.getOrDefault(key, "");
    }

    static Map<String, String> loadSecrets(File file) {
        Map<String, String> map = new HashMap<>();
        if (!file.exists()) {
            LoggingService.warn("secrets_file_missing", Map.of("path", file.getPath()));
            return map;
        }
        try {
            JsonNode rootNode = new ObjectMapper().readTree(file);
            Iterator<Map.Entry<String, JsonNode>> fields = rootNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                map.put(entry.getKey(), entry.getValue().asText(""));
            }
        } catch (Exception e) {
            LoggingService.error("secrets_provider_load_failed", e);
        }
        return map;
    }

    /** Drops the cached values. */
    static void reset() {
        synchronized (SecretsProvider.class) {
            cache = null;
        }
    }
}
