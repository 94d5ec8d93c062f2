package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.AuthContext;
import com.dynamiccapital.pool.pojos.BearerSession;
import com.dynamiccapital.pool.pojos.Profile;
import com.dynamiccapital.pool.pojos.RequestBody;

import java.util.Map;

/**
 * Resolves the caller's profile from a bearer token or, failing that, from the Mini App
 * initData in the request body.
 *
 * <p>A failure in one path is logged and the next path is tried. Returns null when neither
 * path yields a known profile.</p>
 */
public class ProfileResolver {

    private final PrivatePoolStore store;
    private final IdentityProvider identityProvider;

    public ProfileResolver(PrivatePoolStore store, IdentityProvider identityProvider) {
        this.store = store;
        this.identityProvider = identityProvider;
    }

    public AuthContext resolveProfile(Map<String, String> headers, RequestBody body) {
        String token = AuthenticationService.extractBearerToken(headers);
        if (token != null) {
            AuthContext context = resolveFromBearer(token);
            if (context != null) {
                return context;
            }
        }

        String initData = body != null ? body.getInitData() : null;
        if (initData != null && !initData.isBlank()) {
            return resolveFromInitData(initData);
        }
        return null;
    }

    private AuthContext resolveFromBearer(String token) {
        try {
            BearerSession session = identityProvider.verifyBearerSession(token);
            if (session == null || session.subjectId == null) {
                return null;
            }
            Profile profile = store.findProfileById(session.subjectId);
            if (profile == null) {
                LoggingService.warn("bearer_profile_not_found", Map.of("subjectId", session.subjectId));
                return null;
            }
            String telegramId = profile.getTelegramId() != null ? profile.getTelegramId() : session.telegramId;
            return new AuthContext(profile.getId(), telegramId);
        } catch (Exception e) {
            LoggingService.error("resolve_profile_bearer_failed", e);
            return null;
        }
    }

    private AuthContext resolveFromInitData(String initData) {
        try {
            String platformUserId = identityProvider.verifySignedPayload(initData);
            if (platformUserId == null) {
                return null;
            }
            Profile profile = store.findProfileByTelegramId(platformUserId);
            if (profile == null) {
                LoggingService.warn("init_data_profile_not_found", Map.of("telegramId", platformUserId));
                return null;
            }
            String telegramId = profile.getTelegramId() != null ? profile.getTelegramId() : platformUserId;
            return new AuthContext(profile.getId(), telegramId);
        } catch (Exception e) {
            LoggingService.error("resolve_profile_init_data_failed", e);
            return null;
        }
    }

    /**
     * True only for an existing profile with the admin role.
     */
    public boolean requireAdmin(String profileId) {
        if (profileId == null) {
            return false;
        }
        Profile profile = store.findProfileById(profileId);
        return profile != null && profile.isAdmin();
    }
}
