package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.CycleSettlement;
import com.dynamiccapital.pool.pojos.CycleStatus;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.Investor;
import com.dynamiccapital.pool.pojos.InvestorContact;
import com.dynamiccapital.pool.pojos.InvestorDeposit;
import com.dynamiccapital.pool.pojos.InvestorShare;
import com.dynamiccapital.pool.pojos.InvestorWithdrawal;
import com.dynamiccapital.pool.pojos.Profile;
import com.dynamiccapital.pool.pojos.WithdrawalChanges;
import com.dynamiccapital.pool.pojos.WithdrawalStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Persistence port for the private pool ledger.
 *
 * <p>Lookups return null when the row does not exist. Every other failure is raised as a
 * {@link StoreException} naming the operation.</p>
 */
public interface PrivatePoolStore {

    Profile findProfileById(String id);

    Profile findProfileByTelegramId(String telegramId);

    Investor getInvestorByProfileId(String profileId);

    /**
     * @throws DuplicateRecordException if the profile already has an investor
     */
    Investor createInvestor(String profileId, Instant joinedAt);

    /**
     * Most recently opened cycle with status ACTIVE, or null.
     */
    FundCycle getActiveCycle();

    /**
     * Most recently opened cycle with the given status, or null.
     */
    FundCycle findLatestCycleByStatus(CycleStatus status);

    FundCycle findCycleById(String cycleId);

    /**
     * @throws DuplicateRecordException if {@code status} is ACTIVE and another active cycle exists
     */
    FundCycle createCycle(int cycleMonth, int cycleYear, CycleStatus status, Instant openedAt);

    /**
     * Single update recording the settlement totals, status, closedAt and notes.
     */
    void closeCycle(String cycleId, CycleSettlement settlement);

    /**
     * Move a cycle to {@code status} without touching its totals.
     */
    void updateCycleStatus(String cycleId, CycleStatus status, Instant updatedAt);

    /**
     * Insert a deposit. The store assigns the id; a null type is stored as EXTERNAL.
     */
    InvestorDeposit insertDeposit(InvestorDeposit entry);

    List<InvestorDeposit> listDepositsByCycle(String cycleId);

    /**
     * Withdrawals of the cycle in any of {@code statuses}; all withdrawals when empty.
     */
    List<InvestorWithdrawal> listWithdrawalsByCycle(String cycleId, Collection<WithdrawalStatus> statuses);

    /**
     * Write all rows in one atomic batch. No-op for an empty list.
     */
    void upsertShares(List<InvestorShare> records);

    List<InvestorShare> listShares(String cycleId);

    /**
     * Insert a withdrawal. The store assigns the id; a null status is stored as PENDING.
     */
    InvestorWithdrawal createWithdrawal(InvestorWithdrawal entry);

    /**
     * Apply the non-null fields of {@code changes}.
     *
     * @return the updated row, or null if no withdrawal has this id
     * @throws IllegalStateException if {@code changes.getExpectedStatus()} is set and the
     *                               stored status differs; nothing is written
     */
    InvestorWithdrawal updateWithdrawal(String id, WithdrawalChanges changes);

    InvestorWithdrawal findWithdrawalById(String id);

    /**
     * Contact details for the given investors. Unknown ids are skipped.
     */
    List<InvestorContact> listInvestorContacts(Collection<String> investorIds);
}
