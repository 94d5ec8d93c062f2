package com.dynamiccapital.pool.pojos;

import java.time.Instant;
import java.util.Map;

/**
 * Final totals for a cycle, supplied by the reconciliation process.
 * The ledger persists these as given after checking that they balance.
 */
public class CycleSettlement {
    private CycleStatus status = CycleStatus.SETTLED;
    private double profitTotalUsdt;
    private double investorPayoutUsdt;
    private double reinvestedTotalUsdt;
    private double performanceFeeUsdt;
    private Map<String, Object> payoutSummary;
    private Instant closedAt;
    private String notes;

    public CycleSettlement() {}

    public CycleSettlement(double profitTotalUsdt, double investorPayoutUsdt,
                           double reinvestedTotalUsdt, double performanceFeeUsdt, Instant closedAt) {
        this.profitTotalUsdt = profitTotalUsdt;
        this.investorPayoutUsdt = investorPayoutUsdt;
        this.reinvestedTotalUsdt = reinvestedTotalUsdt;
        this.performanceFeeUsdt = performanceFeeUsdt;
        this.closedAt = closedAt;
    }

    public CycleStatus getStatus() { return status; }
    public void setStatus(CycleStatus status) { this.status = status; }

    public double getProfitTotalUsdt() { return profitTotalUsdt; }
    public void setProfitTotalUsdt(double profitTotalUsdt) { this.profitTotalUsdt = profitTotalUsdt; }

    public double getInvestorPayoutUsdt() { return investorPayoutUsdt; }
    public void setInvestorPayoutUsdt(double investorPayoutUsdt) { this.investorPayoutUsdt = investorPayoutUsdt; }

    public double getReinvestedTotalUsdt() { return reinvestedTotalUsdt; }
    public void setReinvestedTotalUsdt(double reinvestedTotalUsdt) { this.reinvestedTotalUsdt = reinvestedTotalUsdt; }

    public double getPerformanceFeeUsdt() { return performanceFeeUsdt; }
    public void setPerformanceFeeUsdt(double performanceFeeUsdt) { this.performanceFeeUsdt = performanceFeeUsdt; }

    public Map<String, Object> getPayoutSummary() { return payoutSummary; }
    public void setPayoutSummary(Map<String, Object> payoutSummary) { this.payoutSummary = payoutSummary; }

    public Instant getClosedAt() { return closedAt; }
    public void setClosedAt(Instant closedAt) { this.closedAt = closedAt; }

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }
}
