package com.dynamiccapital.pool.pojos;

import com.google.gson.annotations.SerializedName;

/**
 * Lifecycle of a fund cycle: active → pending_settlement → settled.
 */
public enum CycleStatus {
    @SerializedName("active")
    ACTIVE("active"),
    @SerializedName("pending_settlement")
    PENDING_SETTLEMENT("pending_settlement"),
    @SerializedName("settled")
    SETTLED("settled");

    private final String value;

    CycleStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CycleStatus fromValue(String value) {
        if (value == null) return null;
        for (CycleStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return null;
    }
}
