package com.dynamiccapital.pool.pojos;

import com.google.gson.annotations.SerializedName;

/**
 * Role stored on a profile. Only {@link #ADMIN} may settle cycles or act on withdrawals.
 */
public enum UserRole {
    @SerializedName("user")
    USER("user"),
    @SerializedName("admin")
    ADMIN("admin");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    /**
     * Value as stored in the profiles collection.
     */
    public String getValue() {
        return value;
    }

    /**
     * Convert a stored string to the enum.
     * Returns null if the string doesn't match any role.
     */
    public static UserRole fromValue(String value) {
        if (value == null) return null;
        for (UserRole role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return role;
            }
        }
        return null;
    }
}
