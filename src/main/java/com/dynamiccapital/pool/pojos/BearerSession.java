package com.dynamiccapital.pool.pojos;

/**
 * Verified bearer credential: the identity provider's subject id and, when the provider
 * carries one, the caller's Telegram id.
 */
public final class BearerSession {

    public final String subjectId;
    public final String telegramId;

    public BearerSession(String subjectId, String telegramId) {
        this.subjectId = subjectId;
        this.telegramId = telegramId;
    }
}
