package com.dynamiccapital.pool.services;

import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import com.google.firebase.auth.FirebaseToken;

import java.util.Map;

/**
 * Firebase ID token verification and Authorization header handling.
 */
public class AuthenticationService {

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Verifies a Firebase ID token and returns the decoded token.
     *
     * @param idToken The token, with or without the "Bearer " prefix
     * @return The decoded FirebaseToken, or null for a blank token
     * @throws FirebaseAuthException If token verification fails
     */
    public static FirebaseToken verifyToken(String idToken) throws FirebaseAuthException {
        String token = stripBearerPrefix(idToken);
        if (token == null || token.isEmpty()) {
            return null;
        }

        try {
            return FirebaseAuth.getInstance().verifyIdToken(token);
        } catch (FirebaseAuthException e) {
            LoggingService.warn("firebase_token_verification_failed", Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }
    }

    /**
     * Extracts the Authorization header value. Header names are matched case-insensitively
     * since Function URL events deliver them lower-cased.
     *
     * @return The header value or null if not found
     */
    public static String extractTokenFromHeaders(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            if (entry.getKey() != null && entry.getKey().equalsIgnoreCase("authorization")) {
                return entry.getValue();
            }
        }
        return null;
    }

    /**
     * Returns the bearer token from the headers without its prefix, or null when absent or blank.
     */
    public static String extractBearerToken(Map<String, String> headers) {
        String token = stripBearerPrefix(extractTokenFromHeaders(headers));
        return token == null || token.isBlank() ? null : token.trim();
    }

    static String stripBearerPrefix(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase(BEARER_PREFIX.trim())) {
            return "";
        }
        if (trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return trimmed.substring(BEARER_PREFIX.length()).trim();
        }
        return trimmed;
    }
}
