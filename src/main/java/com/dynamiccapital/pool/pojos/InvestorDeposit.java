package com.dynamiccapital.pool.pojos;

import java.time.Instant;

/**
 * Inbound capital event. Stored in investor_deposits/{depositId}; immutable once written.
 *
 * <p>Also used as the insert payload: id is assigned by the store, a null type means
 * EXTERNAL and a null createdAt means "now".</p>
 */
public class InvestorDeposit {
    private String id;
    private String investorId;
    private String cycleId;
    private double amountUsdt;
    private DepositType depositType;
    private String txHash;
    private String notes;
    private Instant createdAt;

    public InvestorDeposit() {}

    public InvestorDeposit(String investorId, String cycleId, double amountUsdt, DepositType depositType) {
        this.investorId = investorId;
        this.cycleId = cycleId;
        this.amountUsdt = amountUsdt;
        this.depositType = depositType;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getInvestorId() { return investorId; }
    public void setInvestorId(String investorId) { this.investorId = investorId; }

    public String getCycleId() { return cycleId; }
    public void setCycleId(String cycleId) { this.cycleId = cycleId; }

    public double getAmountUsdt() { return amountUsdt; }
    public void setAmountUsdt(double amountUsdt) { this.amountUsdt = amountUsdt; }

    public DepositType getDepositType() { return depositType; }
    public void setDepositType(DepositType depositType) { this.depositType = depositType; }

    public String getTxHash() { return txHash; }
    public void setTxHash(String txHash) { this.txHash = txHash; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    @Override
    public String toString() {
        return "InvestorDeposit{" +
                "id='" + id + '\'' +
                ", investorId='" + investorId + '\'' +
                ", cycleId='" + cycleId + '\'' +
                ", amountUsdt=" + amountUsdt +
                ", depositType=" + depositType +
                '}';
    }
}
