package com.dynamiccapital.pool.pojos;

import com.google.gson.annotations.SerializedName;

/**
 * Origin of a deposit.
 */
public enum DepositType {
    @SerializedName("external")
    EXTERNAL("external"),
    @SerializedName("reinvestment")
    REINVESTMENT("reinvestment"),   // Share of a withdrawal or payout kept in the pool
    @SerializedName("carryover")
    CARRYOVER("carryover"),         // Balance brought forward from the previous cycle
    @SerializedName("adjustment")
    ADJUSTMENT("adjustment");       // Manual correction by an admin

    private final String value;

    DepositType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Returns null if the string doesn't match any deposit type.
     */
    public static DepositType fromValue(String value) {
        if (value == null) return null;
        for (DepositType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return null;
    }
}
