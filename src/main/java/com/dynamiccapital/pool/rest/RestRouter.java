package com.dynamiccapital.pool.rest;

import com.dynamiccapital.pool.handlers.PoolAdminHandler;
import com.dynamiccapital.pool.handlers.PoolHandler;
import com.dynamiccapital.pool.pojos.AuthContext;
import com.dynamiccapital.pool.pojos.RequestBody;
import com.dynamiccapital.pool.services.LoggingService;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps HTTP method + path to pool handler actions.
 */
public class RestRouter {

    public static final String PREFIX = "/api/v1/pool/";

    private final List<Route> routes = new ArrayList<>();

    private final PoolHandler poolHandler;
    private final PoolAdminHandler poolAdminHandler;

    public RestRouter(PoolHandler poolHandler, PoolAdminHandler poolAdminHandler) {
        this.poolHandler = poolHandler;
        this.poolAdminHandler = poolAdminHandler;

        registerRoutes();
    }

    /**
     * Attempt to route a request. Returns null if no route matches.
     */
    public ApiResponse route(String method, String path, AuthContext auth, RequestBody body) {
        if (body == null) {
            body = new RequestBody();
        }

        for (Route route : routes) {
            if (!route.method.equalsIgnoreCase(method)) continue;

            Matcher matcher = route.pattern.matcher(path);
            if (!matcher.matches()) continue;

            Map<String, String> pathParams = new HashMap<>();
            for (int i = 0; i < route.paramNames.size(); i++) {
                pathParams.put(route.paramNames.get(i), URLDecoder.decode(matcher.group(i + 1), StandardCharsets.UTF_8));
            }

            LoggingService.setFunction(route.functionName);

            try {
                ApiResponse response = route.handler.handle(auth, body, pathParams);
                if (response == null) {
                    return ApiResponse.errorMessage("No response from handler");
                }
                return response;
            } catch (Exception e) {
                LoggingService.error("rest_handler_exception", e, LoggingService.data("route", route.functionName));
                return ApiResponse.errorMessage(e.getMessage() != null ? e.getMessage() : "Internal server error");
            }
        }

        return null;
    }

    public static boolean isRestPath(String path) {
        return path != null && path.startsWith(PREFIX);
    }

    // ============= Route Registration =============

    private void registerRoutes() {
        // --- Investor ---
        get(PREFIX + "me", "pool_me", (auth, body, pathParams) -> {
            String result = poolHandler.handleRequest("pool_me", auth, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post(PREFIX + "deposits", "pool_record_deposit", (auth, body, pathParams) -> {
            String result = poolHandler.handleRequest("pool_record_deposit", auth, body);
            return ResponseConverter.fromHandlerResponseCreated(result);
        });

        post(PREFIX + "withdrawals", "pool_request_withdrawal", (auth, body, pathParams) -> {
            String result = poolHandler.handleRequest("pool_request_withdrawal", auth, body);
            return ResponseConverter.fromHandlerResponseCreated(result);
        });

        get(PREFIX + "withdrawals/{withdrawalId}", "pool_get_withdrawal", (auth, body, pathParams) -> {
            body.setWithdrawalId(pathParams.get("withdrawalId"));
            String result = poolHandler.handleRequest("pool_get_withdrawal", auth, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        // --- Admin ---
        get(PREFIX + "admin/cycles/active/shares", "pool_admin_active_shares", (auth, body, pathParams) -> {
            String result = poolAdminHandler.handleRequest("pool_admin_active_shares", auth, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post(PREFIX + "admin/cycles/{cycleId}/pending-settlement", "pool_admin_mark_pending_settlement", (auth, body, pathParams) -> {
            body.setCycleId(pathParams.get("cycleId"));
            String result = poolAdminHandler.handleRequest("pool_admin_mark_pending_settlement", auth, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post(PREFIX + "admin/cycles/{cycleId}/settle", "pool_admin_settle_cycle", (auth, body, pathParams) -> {
            body.setCycleId(pathParams.get("cycleId"));
            String result = poolAdminHandler.handleRequest("pool_admin_settle_cycle", auth, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post(PREFIX + "admin/withdrawals/{withdrawalId}/approve", "pool_admin_approve_withdrawal", (auth, body, pathParams) -> {
            body.setWithdrawalId(pathParams.get("withdrawalId"));
            String result = poolAdminHandler.handleRequest("pool_admin_approve_withdrawal", auth, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post(PREFIX + "admin/withdrawals/{withdrawalId}/deny", "pool_admin_deny_withdrawal", (auth, body, pathParams) -> {
            body.setWithdrawalId(pathParams.get("withdrawalId"));
            String result = poolAdminHandler.handleRequest("pool_admin_deny_withdrawal", auth, body);
            return ResponseConverter.fromHandlerResponse(result);
        });

        post(PREFIX + "admin/withdrawals/{withdrawalId}/fulfill", "pool_admin_fulfill_withdrawal", (auth, body, pathParams) -> {
            body.setWithdrawalId(pathParams.get("withdrawalId"));
            String result = poolAdminHandler.handleRequest("pool_admin_fulfill_withdrawal", auth, body);
            return ResponseConverter.fromHandlerResponse(result);
        });
    }

    private void get(String pathPattern, String functionName, RouteHandler handler) {
        routes.add(new Route("GET", pathPattern, functionName, handler));
    }

    private void post(String pathPattern, String functionName, RouteHandler handler) {
        routes.add(new Route("POST", pathPattern, functionName, handler));
    }

    // ============= Route Model =============

    @FunctionalInterface
    interface RouteHandler {
        ApiResponse handle(AuthContext auth, RequestBody body, Map<String, String> pathParams) throws Exception;
    }

    static class Route {
        final String method;
        final Pattern pattern;
        final List<String> paramNames;
        final String functionName;
        final RouteHandler handler;

        Route(String method, String pathTemplate, String functionName, RouteHandler handler) {
            this.method = method;
            this.functionName = functionName;
            this.handler = handler;
            this.paramNames = new ArrayList<>();

            // /api/v1/pool/withdrawals/{withdrawalId} -> /api/v1/pool/withdrawals/([^/]+)
            Matcher m = Pattern.compile("\\{(\\w+)}").matcher(pathTemplate);
            while (m.find()) {
                paramNames.add(m.group(1));
            }
            String regex = pathTemplate.replaceAll("\\{\\w+}", "([^/]+)");
            this.pattern = Pattern.compile("^" + regex + "$");
        }
    }
}
