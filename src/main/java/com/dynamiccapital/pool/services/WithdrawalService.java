package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.CycleStatus;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.Investor;
import com.dynamiccapital.pool.pojos.InvestorWithdrawal;
import com.dynamiccapital.pool.pojos.WithdrawalChanges;
import com.dynamiccapital.pool.pojos.WithdrawalStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;

/**
 * Withdrawal requests from creation through approval or denial to fulfillment.
 *
 * <p>Status changes are checked against {@link WithdrawalStatus#canTransitionTo} and
 * written with a guard on the status that was read, so a concurrent change makes the
 * update fail instead of overwriting it.</p>
 */
public class WithdrawalService {

    private final PrivatePoolStore store;
    private final ShareRecomputationService shareRecomputationService;
    private final Duration noticePeriod;
    private final double defaultReinvestPercent;

    public WithdrawalService(PrivatePoolStore store, ShareRecomputationService shareRecomputationService,
                             Duration noticePeriod, double defaultReinvestPercent) {
        this.store = store;
        this.shareRecomputationService = shareRecomputationService;
        this.noticePeriod = noticePeriod;
        this.defaultReinvestPercent = defaultReinvestPercent;
    }

    // =========================================================================
    // Store-level operations
    // =========================================================================

    /**
     * Insert a withdrawal, pending unless another status is given.
     */
    public InvestorWithdrawal createWithdrawal(InvestorWithdrawal entry) {
        if (entry == null) {
            throw new IllegalArgumentException("withdrawal is required");
        }
        if (entry.getInvestorId() == null || entry.getCycleId() == null) {
            throw new IllegalArgumentException("investorId and cycleId are required");
        }
        if (!Double.isFinite(entry.getAmountUsdt()) || entry.getAmountUsdt() <= 0) {
            throw new IllegalArgumentException("amount must be greater than 0");
        }
        if (entry.getNetAmountUsdt() != null && entry.getReinvestedAmountUsdt() != null
                && !PoolMath.moneyEquals(entry.getNetAmountUsdt() + entry.getReinvestedAmountUsdt(), entry.getAmountUsdt())) {
            throw new IllegalArgumentException("net and reinvested amounts must add up to the withdrawal amount");
        }
        if (entry.getStatus() == null) {
            entry.setStatus(WithdrawalStatus.PENDING);
        }
        return store.createWithdrawal(entry);
    }

    /**
     * Apply a partial update. Denied and fulfilled withdrawals are immutable.
     *
     * @return the updated withdrawal, or null if no withdrawal has this id
     * @throws IllegalStateException if the withdrawal is terminal or the requested status
     *                               change is not a legal transition
     */
    public InvestorWithdrawal updateWithdrawal(String id, WithdrawalChanges changes) {
        InvestorWithdrawal current = store.findWithdrawalById(id);
        if (current == null) {
            return null;
        }
        if (changes == null || changes.isEmpty()) {
            return current;
        }
        WithdrawalStatus from = current.getStatus();
        if (from == null || from.isTerminal()) {
            throw new IllegalStateException("withdrawal " + id + " is "
                    + (from != null ? from.getValue() : "unknown") + " and can no longer change");
        }
        if (changes.getStatus() != null && !from.canTransitionTo(changes.getStatus())) {
            throw new IllegalStateException("cannot move withdrawal " + id + " from "
                    + from.getValue() + " to " + changes.getStatus().getValue());
        }
        if (changes.getExpectedStatus() == null) {
            changes.setExpectedStatus(from);
        }
        return store.updateWithdrawal(id, changes);
    }

    public InvestorWithdrawal findWithdrawalById(String id) {
        return store.findWithdrawalById(id);
    }

    // =========================================================================
    // Request flow
    // =========================================================================

    /**
     * Create a pending withdrawal for an investor in the active cycle.
     *
     * <pre>
     *   reinvested = round2(amount × reinvestPercent / 100)
     *   net        = clamp(amount − reinvested, 0, amount)
     * </pre>
     *
     * @param reinvestPercent share kept in the pool, or null for the configured default
     * @throws IllegalArgumentException if the amount or percentage is out of range, or the
     *                                  amount exceeds what the investor can still withdraw
     * @throws IllegalStateException    if the cycle is not active
     */
    public InvestorWithdrawal requestWithdrawal(Investor investor, FundCycle cycle, double amount,
                                                Double reinvestPercent, Instant now) {
        if (!Double.isFinite(amount) || amount <= 0) {
            throw new IllegalArgumentException("amount must be greater than 0");
        }
        double percent = reinvestPercent != null ? reinvestPercent : defaultReinvestPercent;
        if (!Double.isFinite(percent) || percent < 0 || percent > 100) {
            throw new IllegalArgumentException("reinvestPercent must be between 0 and 100");
        }
        if (cycle.getStatus() != CycleStatus.ACTIVE) {
            throw new IllegalStateException("withdrawals can only be requested in an active cycle");
        }

        double requested = PoolMath.roundMoney(amount);
        double available = availableBalance(investor.getId(), cycle.getId());
        if (requested > available + PoolMath.MONEY_EPSILON / 2) {
            throw new IllegalArgumentException(String.format(
                    "amount %.2f exceeds available balance %.2f", requested, available));
        }

        double reinvested = PoolMath.roundMoney(requested * percent / 100.0);
        double net = PoolMath.roundMoney(PoolMath.clamp(requested - reinvested, 0.0, requested));

        InvestorWithdrawal entry = new InvestorWithdrawal();
        entry.setInvestorId(investor.getId());
        entry.setCycleId(cycle.getId());
        entry.setAmountUsdt(requested);
        entry.setReinvestedAmountUsdt(reinvested);
        entry.setNetAmountUsdt(net);
        entry.setStatus(WithdrawalStatus.PENDING);
        entry.setRequestedAt(now);
        entry.setNoticeExpiresAt(now.plus(noticePeriod));

        InvestorWithdrawal created = createWithdrawal(entry);
        LoggingService.info("withdrawal_requested", LoggingService.data(
                "withdrawalId", created.getId(),
                "investorId", investor.getId(),
                "cycleId", cycle.getId(),
                "amountUsdt", requested,
                "netAmountUsdt", net,
                "reinvestedAmountUsdt", reinvested));
        return created;
    }

    /**
     * Contribution minus the net of the investor's still-pending requests.
     */
    double availableBalance(String investorId, String cycleId) {
        double contribution = shareRecomputationService.currentContribution(cycleId, investorId);
        double reserved = 0;
        for (InvestorWithdrawal pending : store.listWithdrawalsByCycle(cycleId, EnumSet.of(WithdrawalStatus.PENDING))) {
            if (investorId.equals(pending.getInvestorId())) {
                reserved += pending.getNetAmountUsdt() != null ? pending.getNetAmountUsdt() : pending.getAmountUsdt();
            }
        }
        return PoolMath.roundMoney(Math.max(0.0, contribution - reserved));
    }

    // =========================================================================
    // Admin transitions
    // =========================================================================

    /**
     * @return the approved withdrawal, or null if it does not exist
     */
    public InvestorWithdrawal approve(String id, String adminNotes, Instant now) {
        InvestorWithdrawal updated = updateWithdrawal(id,
                WithdrawalChanges.status(WithdrawalStatus.APPROVED).setAdminNotes(adminNotes));
        if (updated != null) {
            LoggingService.info("withdrawal_approved", Map.of("withdrawalId", id));
            shareRecomputationService.recomputeShares(updated.getCycleId(), now);
        }
        return updated;
    }

    /**
     * @return the denied withdrawal, or null if it does not exist
     */
    public InvestorWithdrawal deny(String id, String adminNotes) {
        InvestorWithdrawal updated = updateWithdrawal(id,
                WithdrawalChanges.status(WithdrawalStatus.DENIED).setAdminNotes(adminNotes));
        if (updated != null) {
            LoggingService.info("withdrawal_denied", Map.of("withdrawalId", id));
        }
        return updated;
    }

    /**
     * Mark an approved withdrawal as paid out.
     *
     * @return the fulfilled withdrawal, or null if it does not exist
     * @throws IllegalStateException if the notice period has not expired yet
     */
    public InvestorWithdrawal fulfill(String id, String adminNotes, Instant now) {
        InvestorWithdrawal current = store.findWithdrawalById(id);
        if (current == null) {
            return null;
        }
        if (current.getNoticeExpiresAt() != null && now.isBefore(current.getNoticeExpiresAt())) {
            throw new IllegalStateException("notice period for withdrawal " + id + " ends at " + current.getNoticeExpiresAt());
        }
        InvestorWithdrawal updated = updateWithdrawal(id, WithdrawalChanges.status(WithdrawalStatus.FULFILLED)
                .setFulfilledAt(now)
                .setAdminNotes(adminNotes));
        if (updated != null) {
            LoggingService.info("withdrawal_fulfilled", Map.of("withdrawalId", id));
            shareRecomputationService.recomputeShares(updated.getCycleId(), now);
        }
        return updated;
    }
}
