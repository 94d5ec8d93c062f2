package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.BearerSession;
import com.google.firebase.auth.FirebaseAuthException;
import com.google.firebase.auth.FirebaseToken;

/**
 * Bearer tokens are Firebase ID tokens; signed payloads are Telegram Mini App initData.
 */
public class FirebaseIdentityProvider implements IdentityProvider {

    static final String TELEGRAM_ID_CLAIM = "telegram_id";

    private final TelegramInitDataVerifier initDataVerifier;

    public FirebaseIdentityProvider(TelegramInitDataVerifier initDataVerifier) {
        this.initDataVerifier = initDataVerifier;
    }

    @Override
    public BearerSession verifyBearerSession(String token) throws FirebaseAuthException {
        FirebaseToken decoded = AuthenticationService.verifyToken(token);
        if (decoded == null || decoded.getUid() == null) {
            return null;
        }
        Object telegramClaim = decoded.getClaims() != null ? decoded.getClaims().get(TELEGRAM_ID_CLAIM) : null;
        return new BearerSession(decoded.getUid(), telegramClaim != null ? telegramClaim.toString() : null);
    }

    @Override
    public String verifySignedPayload(String payload) throws Exception {
        return initDataVerifier.verify(payload);
    }
}
