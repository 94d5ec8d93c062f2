package com.dynamiccapital.pool.pojos;

import java.time.Instant;

/**
 * Derived per-cycle ownership snapshot. Stored in investor_shares/{cycleId}_{investorId}
 * and rewritten in full on every recomputation.
 */
public final class InvestorShare {

    private final String investorId;
    private final String cycleId;

    /** Percentage of the cycle's pool, 0-100, rounded to 6 decimals. */
    private final double sharePercentage;

    /** Net contribution in USDT, never negative, rounded to 2 decimals. */
    private final double contributionUsdt;

    private final Instant updatedAt;

    public InvestorShare(String investorId, String cycleId, double sharePercentage,
                         double contributionUsdt, Instant updatedAt) {
        this.investorId = investorId;
        this.cycleId = cycleId;
        this.sharePercentage = sharePercentage;
        this.contributionUsdt = contributionUsdt;
        this.updatedAt = updatedAt;
    }

    public String getInvestorId() { return investorId; }
    public String getCycleId() { return cycleId; }
    public double getSharePercentage() { return sharePercentage; }
    public double getContributionUsdt() { return contributionUsdt; }
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return String.format("InvestorShare{investor=%s, cycle=%s, share=%.6f%%, contribution=%.2f}",
                investorId, cycleId, sharePercentage, contributionUsdt);
    }
}
