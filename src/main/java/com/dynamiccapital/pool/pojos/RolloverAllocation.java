package com.dynamiccapital.pool.pojos;

/**
 * Amount an investor keeps in the pool when a cycle rolls over into the next one.
 * Recorded as a deposit of {@link #getDepositType()} in the new cycle.
 */
public class RolloverAllocation {
    private String investorId;
    private double amountUsdt;
    private String depositType;

    public RolloverAllocation() {}

    public RolloverAllocation(String investorId, double amountUsdt, DepositType depositType) {
        this.investorId = investorId;
        this.amountUsdt = amountUsdt;
        this.depositType = depositType != null ? depositType.getValue() : null;
    }

    public String getInvestorId() { return investorId; }
    public void setInvestorId(String investorId) { this.investorId = investorId; }

    public double getAmountUsdt() { return amountUsdt; }
    public void setAmountUsdt(double amountUsdt) { this.amountUsdt = amountUsdt; }

    /**
     * Defaults to CARRYOVER when absent.
     *
     * @throws IllegalArgumentException if a type is given but not recognised
     */
    public DepositType getDepositType() {
        if (depositType == null || depositType.isBlank()) {
            return DepositType.CARRYOVER;
        }
        DepositType type = DepositType.fromValue(depositType.trim());
        if (type == null) {
            throw new IllegalArgumentException("Unknown deposit type: " + depositType);
        }
        return type;
    }

    public void setDepositType(String depositType) { this.depositType = depositType; }
}
