package com.dynamiccapital.pool.pojos;

/**
 * Caller identity resolved for a single request.
 */
public final class AuthContext {

    public final String profileId;
    public final String telegramId;

    public AuthContext(String profileId, String telegramId) {
        this.profileId = profileId;
        this.telegramId = telegramId;
    }

    @Override
    public String toString() {
        return "AuthContext{profileId='" + profileId + "', telegramId='" + telegramId + "'}";
    }
}
