package com.dynamiccapital.pool;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.dynamiccapital.pool.handlers.PoolAdminHandler;
import com.dynamiccapital.pool.handlers.PoolHandler;
import com.dynamiccapital.pool.pojos.AuthContext;
import com.dynamiccapital.pool.pojos.RequestBody;
import com.dynamiccapital.pool.pojos.RequestEvent;
import com.dynamiccapital.pool.pojos.RequestContextHttp;
import com.dynamiccapital.pool.rest.ApiResponse;
import com.dynamiccapital.pool.rest.Json;
import com.dynamiccapital.pool.rest.RestRouter;
import com.dynamiccapital.pool.services.CycleSettlementService;
import com.dynamiccapital.pool.services.FirebaseIdentityProvider;
import com.dynamiccapital.pool.services.FirestorePrivatePoolStore;
import com.dynamiccapital.pool.services.LoggingService;
import com.dynamiccapital.pool.services.PoolBootstrapService;
import com.dynamiccapital.pool.services.PoolConfig;
import com.dynamiccapital.pool.services.PrivatePoolStore;
import com.dynamiccapital.pool.services.ProfileResolver;
import com.dynamiccapital.pool.services.ShareRecomputationService;
import com.dynamiccapital.pool.services.TelegramInitDataVerifier;
import com.dynamiccapital.pool.services.WithdrawalService;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;

/**
 * Lambda Function URL entry point for the private pool API.
 */
public class Handler implements RequestHandler<RequestEvent, Object> {

    private final Gson gson = Json.create();
    private final RestRouter restRouter;
    private final ProfileResolver profileResolver;

    public Handler() {
        Firestore db = initFirestore();
        PoolConfig config = PoolConfig.fromEnvironment();
        Clock clock = Clock.systemUTC();

        PrivatePoolStore store = new FirestorePrivatePoolStore(db);
        TelegramInitDataVerifier initDataVerifier = new TelegramInitDataVerifier(
                config.getTelegramBotToken(), config.getInitDataMaxAge(), clock);
        this.profileResolver = new ProfileResolver(store, new FirebaseIdentityProvider(initDataVerifier));

        ShareRecomputationService shareService = new ShareRecomputationService(store);
        PoolBootstrapService bootstrapService = new PoolBootstrapService(store);
        WithdrawalService withdrawalService = new WithdrawalService(
                store, shareService, config.getNoticePeriod(), config.getDefaultReinvestPercent());
        CycleSettlementService settlementService = new CycleSettlementService(store, shareService);

        this.restRouter = new RestRouter(
                new PoolHandler(store, profileResolver, bootstrapService, shareService, withdrawalService, clock),
                new PoolAdminHandler(store, profileResolver, shareService, settlementService, withdrawalService, clock));
    }

    Handler(RestRouter restRouter, ProfileResolver profileResolver) {
        this.restRouter = restRouter;
        this.profileResolver = profileResolver;
    }

    private Firestore initFirestore() {
        try {
            if (FirebaseApp.getApps().isEmpty()) {
                String keyFile = isTest() ? "/serviceAccountKeyTest.json" : "/serviceAccountKey.json";
                try (InputStream credentials = getClass().getResourceAsStream(keyFile)) {
                    if (credentials == null) {
                        throw new IOException("Missing service account resource " + keyFile);
                    }
                    FirebaseOptions options = FirebaseOptions.builder()
                            .setCredentials(GoogleCredentials.fromStream(credentials))
                            .build();
                    FirebaseApp.initializeApp(options);
                }
            }
            return FirestoreClient.getFirestore();
        } catch (IOException e) {
            LoggingService.error("handler_init_failed", e);
            throw new RuntimeException("Failed to initialize Firebase", e);
        }
    }

    @Override
    public Object handleRequest(RequestEvent event, Context context) {
        LoggingService.initRequest(context);
        if (context == null && event.getRequestContext() != null) {
            LoggingService.initRequest(event.getRequestContext().getRequestId());
        }
        try {
            if ("aws.events".equals(event.getSource())) {
                LoggingService.debug("warmup_ping", LoggingService.data("detailType", String.valueOf(event.getDetailType())));
                return "Warmed up!";
            }
            return handleHttp(event).toLambdaResponse();
        } finally {
            LoggingService.clearContext();
        }
    }

    ApiResponse handleHttp(RequestEvent event) {
        RequestContextHttp http = event.getRequestContext() != null ? event.getRequestContext().getHttp() : null;
        if (http == null || http.getPath() == null) {
            return ApiResponse.badRequestMessage("Missing HTTP request context");
        }
        String method = http.getMethod() != null ? http.getMethod() : "GET";
        String path = http.getPath();

        if ("OPTIONS".equalsIgnoreCase(method)) {
            return ApiResponse.options();
        }
        if (!RestRouter.isRestPath(path)) {
            return ApiResponse.notFoundMessage("Route not found: " + method + " " + path);
        }

        RequestBody body;
        try {
            String rawBody = event.getBody();
            body = rawBody == null || rawBody.isBlank() ? new RequestBody() : gson.fromJson(rawBody, RequestBody.class);
        } catch (JsonParseException e) {
            LoggingService.warn("request_body_invalid", LoggingService.data("path", path, "error", e.getMessage()));
            return ApiResponse.badRequestMessage("Request body is not valid JSON");
        }
        if (body == null) {
            body = new RequestBody();
        }

        AuthContext auth = profileResolver.resolveProfile(event.getHeaders(), body);
        if (auth == null) {
            LoggingService.info("request_unauthenticated", LoggingService.data("method", method, "path", path));
            return ApiResponse.unauthorizedMessage("Authentication required");
        }
        LoggingService.setProfileId(auth.profileId);

        long start = LoggingService.logOperationStart("pool_request", LoggingService.data("method", method, "path", path));
        ApiResponse response = restRouter.route(method, path, auth, body);
        if (response == null) {
            response = ApiResponse.notFoundMessage("Route not found: " + method + " " + path);
        }
        LoggingService.logOperationEnd("pool_request", start, LoggingService.data("status", response.getStatusCode()));
        return response;
    }

    private boolean isTest() {
        return "test".equals(System.getenv("ENVIRONMENT"));
    }
}
