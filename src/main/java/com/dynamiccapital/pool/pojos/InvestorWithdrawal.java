package com.dynamiccapital.pool.pojos;

import java.time.Instant;

/**
 * Outbound capital request. Stored in investor_withdrawals/{withdrawalId}.
 *
 * <p>{@code netAmountUsdt} leaves the pool, {@code reinvestedAmountUsdt} stays in it;
 * together they make up {@code amountUsdt}.</p>
 */
public class InvestorWithdrawal {
    private String id;
    private String investorId;
    private String cycleId;
    private double amountUsdt;
    private Double netAmountUsdt;
    private Double reinvestedAmountUsdt;
    private WithdrawalStatus status;
    private Instant requestedAt;

    // Funds may not be released before this instant
    private Instant noticeExpiresAt;
    private Instant fulfilledAt;
    private String adminNotes;

    public InvestorWithdrawal() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getInvestorId() { return investorId; }
    public void setInvestorId(String investorId) { this.investorId = investorId; }

    public String getCycleId() { return cycleId; }
    public void setCycleId(String cycleId) { this.cycleId = cycleId; }

    public double getAmountUsdt() { return amountUsdt; }
    public void setAmountUsdt(double amountUsdt) { this.amountUsdt = amountUsdt; }

    public Double getNetAmountUsdt() { return netAmountUsdt; }
    public void setNetAmountUsdt(Double netAmountUsdt) { this.netAmountUsdt = netAmountUsdt; }

    public Double getReinvestedAmountUsdt() { return reinvestedAmountUsdt; }
    public void setReinvestedAmountUsdt(Double reinvestedAmountUsdt) { this.reinvestedAmountUsdt = reinvestedAmountUsdt; }

    public WithdrawalStatus getStatus() { return status; }
    public void setStatus(WithdrawalStatus status) { this.status = status; }

    public Instant getRequestedAt() { return requestedAt; }
    public void setRequestedAt(Instant requestedAt) { this.requestedAt = requestedAt; }

    public Instant getNoticeExpiresAt() { return noticeExpiresAt; }
    public void setNoticeExpiresAt(Instant noticeExpiresAt) { this.noticeExpiresAt = noticeExpiresAt; }

    public Instant getFulfilledAt() { return fulfilledAt; }
    public void setFulfilledAt(Instant fulfilledAt) { this.fulfilledAt = fulfilledAt; }

    public String getAdminNotes() { return adminNotes; }
    public void setAdminNotes(String adminNotes) { this.adminNotes = adminNotes; }

    @Override
    public String toString() {
        return "InvestorWithdrawal{" +
                "id='" + id + '\'' +
                ", investorId='" + investorId + '\'' +
                ", cycleId='" + cycleId + '\'' +
                ", amountUsdt=" + amountUsdt +
                ", netAmountUsdt=" + netAmountUsdt +
                ", reinvestedAmountUsdt=" + reinvestedAmountUsdt +
                ", status=" + status +
                '}';
    }
}
