package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.CycleMonthYear;
import com.dynamiccapital.pool.pojos.CycleSettlement;
import com.dynamiccapital.pool.pojos.CycleStatus;
import com.dynamiccapital.pool.pojos.DepositType;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.InvestorDeposit;
import com.dynamiccapital.pool.pojos.RolloverAllocation;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Closes fund cycles with caller-supplied, already reconciled totals.
 *
 * <p>The ledger does not derive profit. It only checks that the supplied figures are
 * internally consistent:</p>
 * <pre>
 *   investorPayout + reinvestedTotal + performanceFee == profitTotal   (to the cent)
 * </pre>
 */
public class CycleSettlementService {

    private final PrivatePoolStore store;
    private final ShareRecomputationService shareRecomputationService;

    public CycleSettlementService(PrivatePoolStore store, ShareRecomputationService shareRecomputationService) {
        this.store = store;
        this.shareRecomputationService = shareRecomputationService;
    }

    /**
     * Record the settlement on the cycle in a single store update.
     *
     * @throws IllegalArgumentException if the settlement is incomplete or its totals do not balance
     */
    public void closeCycle(String cycleId, CycleSettlement settlement) {
        if (cycleId == null || cycleId.isEmpty()) {
            throw new IllegalArgumentException("cycleId is required");
        }
        CycleSettlement rounded = validateAndRound(settlement);
        store.closeCycle(cycleId, rounded);
        LoggingService.info("fund_cycle_closed", LoggingService.data(
                "cycleId", cycleId,
                "status", rounded.getStatus().getValue(),
                "profitTotalUsdt", rounded.getProfitTotalUsdt(),
                "investorPayoutUsdt", rounded.getInvestorPayoutUsdt(),
                "reinvestedTotalUsdt", rounded.getReinvestedTotalUsdt(),
                "performanceFeeUsdt", rounded.getPerformanceFeeUsdt()));
    }

    /**
     * Close the cycle, open the next calendar cycle and seed it with the carried-over balances.
     *
     * @return the next cycle, or null if {@code cycleId} does not exist
     * @throws IllegalStateException if the cycle is already settled
     */
    public FundCycle settleAndRollOver(String cycleId, CycleSettlement settlement,
                                       List<RolloverAllocation> allocations, Instant now) {
        CycleSettlement rounded = validateAndRound(settlement);
        validateAllocations(allocations);

        FundCycle cycle = store.findCycleById(cycleId);
        if (cycle == null) {
            return null;
        }
        if (cycle.getStatus() != CycleStatus.ACTIVE && cycle.getStatus() != CycleStatus.PENDING_SETTLEMENT) {
            throw new IllegalStateException("cycle " + cycleId + " is already "
                    + (cycle.getStatus() != null ? cycle.getStatus().getValue() : "closed"));
        }

        long start = LoggingService.logOperationStart("settle_and_roll_over", LoggingService.data("cycleId", cycleId));
        closeCycle(cycleId, rounded);

        CycleMonthYear next = PoolBootstrapService.getNextCycle(cycle.getCycleMonth(), cycle.getCycleYear());
        FundCycle nextCycle;
        try {
            nextCycle = store.createCycle(next.cycleMonth, next.cycleYear, CycleStatus.ACTIVE, now);
        } catch (DuplicateRecordException e) {
            nextCycle = store.getActiveCycle();
            if (nextCycle == null) {
                throw e;
            }
            if (nextCycle.getCycleMonth() != next.cycleMonth || nextCycle.getCycleYear() != next.cycleYear) {
                throw new IllegalStateException("cycle " + nextCycle.getMonthYear() + " is already active; expected "
                        + next + " after settling " + cycle.getMonthYear());
            }
            LoggingService.warn("roll_over_reused_active_cycle", Map.of("cycleId", nextCycle.getId()));
        }

        int carried = 0;
        if (allocations != null) {
            for (RolloverAllocation allocation : allocations) {
                double amount = PoolMath.roundMoney(allocation.getAmountUsdt());
                if (amount <= 0) continue;
                DepositType type = allocation.getDepositType();
                InvestorDeposit deposit = new InvestorDeposit(allocation.getInvestorId(), nextCycle.getId(), amount, type);
                deposit.setNotes("Rolled over from cycle " + cycle.getMonthYear());
                deposit.setCreatedAt(now);
                store.insertDeposit(deposit);
                carried++;
            }
        }
        shareRecomputationService.recomputeShares(nextCycle.getId(), now);

        LoggingService.logOperationEnd("settle_and_roll_over", start, LoggingService.data(
                "cycleId", cycleId,
                "nextCycleId", nextCycle.getId(),
                "allocations", carried));
        return nextCycle;
    }

    /**
     * Stop taking deposits on an active cycle until its settlement is recorded.
     *
     * @return the updated cycle, or null if {@code cycleId} does not exist
     * @throws IllegalStateException if the cycle is not active
     */
    public FundCycle markPendingSettlement(String cycleId, Instant now) {
        FundCycle cycle = store.findCycleById(cycleId);
        if (cycle == null) {
            return null;
        }
        if (cycle.getStatus() != CycleStatus.ACTIVE) {
            throw new IllegalStateException("only an active cycle can move to pending settlement");
        }
        store.updateCycleStatus(cycleId, CycleStatus.PENDING_SETTLEMENT, now);
        cycle.setStatus(CycleStatus.PENDING_SETTLEMENT);
        LoggingService.info("fund_cycle_pending_settlement", Map.of("cycleId", cycleId));
        return cycle;
    }

    static CycleSettlement validateAndRound(CycleSettlement settlement) {
        if (settlement == null) {
            throw new IllegalArgumentException("settlement is required");
        }
        if (settlement.getStatus() == null || settlement.getStatus() == CycleStatus.ACTIVE) {
            throw new IllegalArgumentException("settlement status must be pending_settlement or settled");
        }
        if (settlement.getClosedAt() == null) {
            throw new IllegalArgumentException("closedAt is required");
        }
        requireNonNegative("profitTotalUsdt", settlement.getProfitTotalUsdt());
        requireNonNegative("investorPayoutUsdt", settlement.getInvestorPayoutUsdt());
        requireNonNegative("reinvestedTotalUsdt", settlement.getReinvestedTotalUsdt());
        requireNonNegative("performanceFeeUsdt", settlement.getPerformanceFeeUsdt());

        double distributed = settlement.getInvestorPayoutUsdt()
                + settlement.getReinvestedTotalUsdt()
                + settlement.getPerformanceFeeUsdt();
        if (!PoolMath.moneyEquals(distributed, settlement.getProfitTotalUsdt())) {
            throw new IllegalArgumentException(String.format(
                    "payout + reinvested + fee (%.2f) must equal profit total (%.2f)",
                    PoolMath.roundMoney(distributed), PoolMath.roundMoney(settlement.getProfitTotalUsdt())));
        }

        CycleSettlement rounded = new CycleSettlement(
                PoolMath.roundMoney(settlement.getProfitTotalUsdt()),
                PoolMath.roundMoney(settlement.getInvestorPayoutUsdt()),
                PoolMath.roundMoney(settlement.getReinvestedTotalUsdt()),
                PoolMath.roundMoney(settlement.getPerformanceFeeUsdt()),
                settlement.getClosedAt());
        rounded.setStatus(settlement.getStatus());
        rounded.setPayoutSummary(settlement.getPayoutSummary());
        rounded.setNotes(settlement.getNotes());
        return rounded;
    }

    private static void validateAllocations(List<RolloverAllocation> allocations) {
        if (allocations == null) return;
        for (RolloverAllocation allocation : allocations) {
            if (allocation == null || allocation.getInvestorId() == null || allocation.getInvestorId().isEmpty()) {
                throw new IllegalArgumentException("every allocation needs an investorId");
            }
            if (!Double.isFinite(allocation.getAmountUsdt()) || allocation.getAmountUsdt() < 0) {
                throw new IllegalArgumentException("allocation amount must be >= 0 for investor " + allocation.getInvestorId());
            }
            // rejects unknown types
            allocation.getDepositType();
        }
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new IllegalArgumentException(field + " must be a non-negative number");
        }
    }
}
