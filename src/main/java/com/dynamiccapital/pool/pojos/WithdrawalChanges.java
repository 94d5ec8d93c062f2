package com.dynamiccapital.pool.pojos;

import java.time.Instant;

/**
 * Partial update for a withdrawal. Null fields are left untouched.
 *
 * <p>When {@code expectedStatus} is set the store applies the update only if the stored
 * status still equals it.</p>
 */
public class WithdrawalChanges {
    private WithdrawalStatus status;
    private Double netAmountUsdt;
    private Double reinvestedAmountUsdt;
    private Instant noticeExpiresAt;
    private Instant fulfilledAt;
    private String adminNotes;
    private WithdrawalStatus expectedStatus;

    public WithdrawalChanges() {}

    public static WithdrawalChanges status(WithdrawalStatus status) {
        return new WithdrawalChanges().setStatus(status);
    }

    public WithdrawalStatus getStatus() { return status; }
    public WithdrawalChanges setStatus(WithdrawalStatus status) { this.status = status; return this; }

    public Double getNetAmountUsdt() { return netAmountUsdt; }
    public WithdrawalChanges setNetAmountUsdt(Double netAmountUsdt) { this.netAmountUsdt = netAmountUsdt; return this; }

    public Double getReinvestedAmountUsdt() { return reinvestedAmountUsdt; }
    public WithdrawalChanges setReinvestedAmountUsdt(Double reinvestedAmountUsdt) { this.reinvestedAmountUsdt = reinvestedAmountUsdt; return this; }

    public Instant getNoticeExpiresAt() { return noticeExpiresAt; }
    public WithdrawalChanges setNoticeExpiresAt(Instant noticeExpiresAt) { this.noticeExpiresAt = noticeExpiresAt; return this; }

    public Instant getFulfilledAt() { return fulfilledAt; }
    public WithdrawalChanges setFulfilledAt(Instant fulfilledAt) { this.fulfilledAt = fulfilledAt; return this; }

    public String getAdminNotes() { return adminNotes; }
    public WithdrawalChanges setAdminNotes(String adminNotes) { this.adminNotes = adminNotes; return this; }

    public WithdrawalStatus getExpectedStatus() { return expectedStatus; }
    public WithdrawalChanges setExpectedStatus(WithdrawalStatus expectedStatus) { this.expectedStatus = expectedStatus; return this; }

    public boolean isEmpty() {
        return status == null && netAmountUsdt == null && reinvestedAmountUsdt == null
                && noticeExpiresAt == null && fulfilledAt == null && adminNotes == null;
    }
}
