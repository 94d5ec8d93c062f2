package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.BearerSession;

/**
 * Verifies the two credential kinds a pool request can carry.
 */
public interface IdentityProvider {

    /**
     * Verify a bearer token.
     *
     * @return the verified session, or null when the token carries no subject
     * @throws Exception if the token is invalid or expired
     */
    BearerSession verifyBearerSession(String token) throws Exception;

    /**
     * Verify a signed launch payload and return the platform user id it names, or null.
     */
    String verifySignedPayload(String payload) throws Exception;
}
