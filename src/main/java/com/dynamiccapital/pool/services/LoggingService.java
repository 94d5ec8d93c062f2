package com.dynamiccapital.pool.services;

import com.amazonaws.services.lambda.runtime.Context;
import com.google.gson.Gson;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.util.HashMap;
import java.util.Map;

/**
 * Structured logging facade for CloudWatch Logs Insights.
 *
 * Messages are snake_case event names. Request-scoped identifiers live in the
 * Log4j ThreadContext; per-call details are serialized as JSON into the "data" key.
 *
 * <pre>
 * -- Follow one withdrawal from request to fulfillment
 * fields @timestamp, message, profileId, data
 * | filter data like "wd-123"
 * | sort @timestamp asc
 *
 * -- Share recomputations that took longer than a second
 * fields @timestamp, cycleId, data
 * | filter message = "recompute_shares_completed" and data like /"durationMs":[0-9]{4,}/
 * </pre>
 */
public class LoggingService {

    private static final Logger logger = LogManager.getLogger(LoggingService.class);
    private static final Gson gson = new Gson();

    // ThreadContext (MDC) keys
    public static final String KEY_REQUEST_ID = "requestId";
    public static final String KEY_PROFILE_ID = "profileId";
    public static final String KEY_INVESTOR_ID = "investorId";
    public static final String KEY_CYCLE_ID = "cycleId";
    public static final String KEY_FUNCTION = "function";
    public static final String KEY_DATA = "data";

    /**
     * Initialize logging context with Lambda request information.
     * Call this at the start of every Lambda invocation.
     */
    public static void initRequest(Context context) {
        clearContext();
        if (context != null) {
            ThreadContext.put(KEY_REQUEST_ID, context.getAwsRequestId());
        }
    }

    /**
     * Initialize logging context with a custom request ID.
     */
    public static void initRequest(String requestId) {
        clearContext();
        if (requestId != null) {
            ThreadContext.put(KEY_REQUEST_ID, requestId);
        }
    }

    /**
     * Set the current function being executed (e.g. "pool_request_withdrawal").
     */
    public static void setFunction(String function) {
        if (function != null) {
            ThreadContext.put(KEY_FUNCTION, function);
        }
    }

    public static void setProfileId(String profileId) {
        if (profileId != null) {
            ThreadContext.put(KEY_PROFILE_ID, profileId);
        }
    }

    public static void setInvestorId(String investorId) {
        if (investorId != null) {
            ThreadContext.put(KEY_INVESTOR_ID, investorId);
        }
    }

    public static void setCycleId(String cycleId) {
        if (cycleId != null) {
            ThreadContext.put(KEY_CYCLE_ID, cycleId);
        }
    }

    /**
     * Clear all logging context. Call at the end of request processing.
     */
    public static void clearContext() {
        ThreadContext.clearAll();
    }

    // =========================================================================
    // Logging Methods
    // =========================================================================

    public static void debug(String message) {
        logger.debug(message);
    }

    public static void debug(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.debug(message);
        clearDataContext();
    }

    public static void info(String message) {
        logger.info(message);
    }

    public static void info(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.info(message);
        clearDataContext();
    }

    public static void warn(String message) {
        logger.warn(message);
    }

    public static void warn(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.warn(message);
        clearDataContext();
    }

    public static void error(String message) {
        logger.error(message);
    }

    public static void error(String message, Throwable t) {
        logger.error(message, t);
    }

    public static void error(String message, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message);
        clearDataContext();
    }

    public static void error(String message, Throwable t, Map<String, Object> data) {
        setDataContext(data);
        logger.error(message, t);
        clearDataContext();
    }

    // =========================================================================
    // Operation timing
    // =========================================================================

    /**
     * Log the start of an operation. Returns start time for use with logOperationEnd.
     */
    public static long logOperationStart(String operation, Map<String, Object> data) {
        info(operation + "_started", data);
        return System.currentTimeMillis();
    }

    public static void logOperationEnd(String operation, long startTime, Map<String, Object> additionalData) {
        long duration = System.currentTimeMillis() - startTime;
        Map<String, Object> data = new HashMap<>(additionalData);
        data.put("durationMs", duration);
        info(operation + "_completed", data);
    }

    public static void logOperationFailed(String operation, long startTime, Throwable t) {
        long duration = System.currentTimeMillis() - startTime;
        error(operation + "_failed", t, Map.of("durationMs", duration));
    }

    // =========================================================================
    // Helper Methods
    // =========================================================================

    private static void setDataContext(Map<String, Object> data) {
        if (data != null && !data.isEmpty()) {
            ThreadContext.put(KEY_DATA, gson.toJson(data));
        }
    }

    private static void clearDataContext() {
        ThreadContext.remove(KEY_DATA);
    }

    /**
     * Create a mutable map with the given key-value pairs. Null values are kept.
     */
    public static Map<String, Object> data(Object... keyValuePairs) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keyValuePairs.length - 1; i += 2) {
            map.put(String.valueOf(keyValuePairs[i]), keyValuePairs[i + 1]);
        }
        return map;
    }
}
