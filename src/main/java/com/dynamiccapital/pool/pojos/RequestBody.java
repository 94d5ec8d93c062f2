package com.dynamiccapital.pool.pojos;

import java.util.List;
import java.util.Map;

public class RequestBody {
    // Telegram Mini App launch payload, used when no bearer token is sent
    private String initData;

    private String withdrawalId; // Filled from the path
    private String cycleId;      // Filled from the path

    // Deposits
    private Double amount;
    private String depositType;
    private String txHash;
    private String notes;

    // Withdrawals
    private Double reinvestPercent;
    private String adminNotes;

    // Settlement
    private Double profitTotalUsdt;
    private Double investorPayoutUsdt;
    private Double reinvestedTotalUsdt;
    private Double performanceFeeUsdt;
    private Map<String, Object> payoutSummary;
    private List<RolloverAllocation> allocations;

    public RequestBody() {
    }

    public String getInitData() {
        return initData;
    }

    public void setInitData(String initData) {
        this.initData = initData;
    }

    public String getWithdrawalId() {
        return withdrawalId;
    }

    public void setWithdrawalId(String withdrawalId) {
        this.withdrawalId = withdrawalId;
    }

    public String getCycleId() {
        return cycleId;
    }

    public void setCycleId(String cycleId) {
        this.cycleId = cycleId;
    }

    public Double getAmount() {
        return amount;
    }

    public void setAmount(Double amount) {
        this.amount = amount;
    }

    public String getDepositType() {
        return depositType;
    }

    public void setDepositType(String depositType) {
        this.depositType = depositType;
    }

    public String getTxHash() {
        return txHash;
    }

    public void setTxHash(String txHash) {
        this.txHash = txHash;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public Double getReinvestPercent() {
        return reinvestPercent;
    }

    public void setReinvestPercent(Double reinvestPercent) {
        this.reinvestPercent = reinvestPercent;
    }

    public String getAdminNotes() {
        return adminNotes;
    }

    public void setAdminNotes(String adminNotes) {
        this.adminNotes = adminNotes;
    }

    public Double getProfitTotalUsdt() {
        return profitTotalUsdt;
    }

    public void setProfitTotalUsdt(Double profitTotalUsdt) {
        this.profitTotalUsdt = profitTotalUsdt;
    }

    public Double getInvestorPayoutUsdt() {
        return investorPayoutUsdt;
    }

    public void setInvestorPayoutUsdt(Double investorPayoutUsdt) {
        this.investorPayoutUsdt = investorPayoutUsdt;
    }

    public Double getReinvestedTotalUsdt() {
        return reinvestedTotalUsdt;
    }

    public void setReinvestedTotalUsdt(Double reinvestedTotalUsdt) {
        this.reinvestedTotalUsdt = reinvestedTotalUsdt;
    }

    public Double getPerformanceFeeUsdt() {
        return performanceFeeUsdt;
    }

    public void setPerformanceFeeUsdt(Double performanceFeeUsdt) {
        this.performanceFeeUsdt = performanceFeeUsdt;
    }

    public Map<String, Object> getPayoutSummary() {
        return payoutSummary;
    }

    public void setPayoutSummary(Map<String, Object> payoutSummary) {
        this.payoutSummary = payoutSummary;
    }

    public List<RolloverAllocation> getAllocations() {
        return allocations;
    }

    public void setAllocations(List<RolloverAllocation> allocations) {
        this.allocations = allocations;
    }
}
