package com.dynamiccapital.pool.pojos;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of a share recomputation for one cycle.
 */
public final class ShareComputationResult {

    /** Sum of all non-negative contributions, rounded to 2 decimals. */
    public final double totalContribution;

    /** Unrounded net contribution per investor id. */
    public final Map<String, Double> contributions;

    /** Rows written to the store, ordered by investor id. */
    public final List<InvestorShare> records;

    public ShareComputationResult(double totalContribution, Map<String, Double> contributions,
                                  List<InvestorShare> records) {
        this.totalContribution = totalContribution;
        this.contributions = Collections.unmodifiableMap(contributions);
        this.records = Collections.unmodifiableList(records);
    }

    public InvestorShare recordFor(String investorId) {
        for (InvestorShare record : records) {
            if (record.getInvestorId().equals(investorId)) {
                return record;
            }
        }
        return null;
    }
}
