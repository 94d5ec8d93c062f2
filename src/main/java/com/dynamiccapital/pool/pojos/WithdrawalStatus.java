package com.dynamiccapital.pool.pojos;

import com.google.gson.annotations.SerializedName;

import java.util.EnumSet;
import java.util.Set;

/**
 * Withdrawal request states and the legal transitions between them.
 *
 * <pre>
 *   pending  → approved | denied
 *   approved → fulfilled
 *   denied, fulfilled: terminal
 * </pre>
 */
public enum WithdrawalStatus {
    @SerializedName("pending")
    PENDING("pending"),
    @SerializedName("approved")
    APPROVED("approved"),
    @SerializedName("denied")
    DENIED("denied"),
    @SerializedName("fulfilled")
    FULFILLED("fulfilled");

    private final String value;

    WithdrawalStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * States this status may move to. Empty for terminal states.
     */
    public Set<WithdrawalStatus> nextStates() {
        switch (this) {
            case PENDING:
                return EnumSet.of(APPROVED, DENIED);
            case APPROVED:
                return EnumSet.of(FULFILLED);
            default:
                return EnumSet.noneOf(WithdrawalStatus.class);
        }
    }

    public boolean isTerminal() {
        return nextStates().isEmpty();
    }

    /**
     * Rewriting the current status is a no-op transition, allowed only while not terminal.
     */
    public boolean canTransitionTo(WithdrawalStatus target) {
        if (target == null || isTerminal()) {
            return false;
        }
        return target == this || nextStates().contains(target);
    }

    /**
     * Withdrawals in these states reduce an investor's contribution.
     */
    public boolean countsAgainstContribution() {
        return this == APPROVED || this == FULFILLED;
    }

    public static WithdrawalStatus fromValue(String value) {
        if (value == null) return null;
        for (WithdrawalStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        return null;
    }
}
