package com.dynamiccapital.pool.rest;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

/**
 * Turns the JSON strings returned by the pool handlers into {@link ApiResponse}s.
 *
 * <p>A body with {@code success:false} is mapped to an HTTP status by its {@code errorCode}:</p>
 * <pre>
 *   NOT_FOUND          → 404
 *   UNAUTHORIZED       → 401
 *   FORBIDDEN          → 403
 *   CONFLICT           → 409   (illegal state transitions, duplicates)
 *   VALIDATION_ERROR   → 422
 *   anything else      → 400
 * </pre>
 */
public class ResponseConverter {

    public static final String NOT_FOUND = "NOT_FOUND";
    public static final String UNAUTHORIZED = "UNAUTHORIZED";
    public static final String FORBIDDEN = "FORBIDDEN";
    public static final String CONFLICT = "CONFLICT";
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";

    public static ApiResponse fromHandlerResponse(String handlerResult) {
        return fromHandlerResponse(handlerResult, false);
    }

    /**
     * Same as {@link #fromHandlerResponse(String)} but uses 201 Created on success.
     */
    public static ApiResponse fromHandlerResponseCreated(String handlerResult) {
        return fromHandlerResponse(handlerResult, true);
    }

    private static ApiResponse fromHandlerResponse(String handlerResult, boolean created) {
        if (handlerResult == null) {
            return ApiResponse.errorMessage("No response from handler");
        }

        JsonObject json;
        try {
            json = JsonParser.parseString(handlerResult).getAsJsonObject();
        } catch (JsonSyntaxException | IllegalStateException e) {
            return ApiResponse.errorMessage("Handler returned a non-JSON response");
        }

        if (!json.has("success") || json.get("success").getAsBoolean()) {
            return created ? ApiResponse.created(handlerResult) : ApiResponse.ok(handlerResult);
        }
        return determineErrorStatus(json, handlerResult);
    }

    private static ApiResponse determineErrorStatus(JsonObject json, String rawJson) {
        String errorCode = json.has("errorCode") ? json.get("errorCode").getAsString() : "";
        switch (errorCode) {
            case NOT_FOUND:
                return ApiResponse.notFound(rawJson);
            case UNAUTHORIZED:
                return ApiResponse.unauthorized(rawJson);
            case FORBIDDEN:
                return ApiResponse.forbidden(rawJson);
            case CONFLICT:
                return ApiResponse.conflict(rawJson);
            case VALIDATION_ERROR:
                return ApiResponse.unprocessable(rawJson);
            default:
                return ApiResponse.badRequest(rawJson);
        }
    }
}
