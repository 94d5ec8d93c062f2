package com.dynamiccapital.pool.pojos;

import java.time.Instant;
import java.util.Map;

/**
 * One monthly accounting period of the pool.
 * Stored in fund_cycles/{cycleId}. At most one cycle is ACTIVE at a time.
 */
public class FundCycle {
    private String id;
    private int cycleMonth;
    private int cycleYear;
    private CycleStatus status;

    // Settlement totals, zero until the cycle is closed
    private double profitTotalUsdt;
    private double investorPayoutUsdt;
    private double reinvestedTotalUsdt;
    private double performanceFeeUsdt;

    // Opaque audit record written at settlement
    private Map<String, Object> payoutSummary;
    private String notes;
    private Instant openedAt;
    private Instant closedAt;

    public FundCycle() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public int getCycleMonth() { return cycleMonth; }
    public void setCycleMonth(int cycleMonth) { this.cycleMonth = cycleMonth; }

    public int getCycleYear() { return cycleYear; }
    public void setCycleYear(int cycleYear) { this.cycleYear = cycleYear; }

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

    public String getNotes() { return notes; }
    public void setNotes(String notes) { this.notes = notes; }

    public Instant getOpenedAt() { return openedAt; }
    public void setOpenedAt(Instant openedAt) { this.openedAt = openedAt; }

    public Instant getClosedAt() { return closedAt; }
    public void setClosedAt(Instant closedAt) { this.closedAt = closedAt; }

    public CycleMonthYear getMonthYear() {
        return new CycleMonthYear(cycleMonth, cycleYear);
    }

    @Override
    public String toString() {
        return "FundCycle{" +
                "id='" + id + '\'' +
                ", cycle=" + cycleYear + "-" + cycleMonth +
                ", status=" + status +
                ", openedAt=" + openedAt +
                ", closedAt=" + closedAt +
                '}';
    }
}
