package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.CycleMonthYear;
import com.dynamiccapital.pool.pojos.CycleStatus;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.Investor;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Get-or-create for the caller's investor row and the pool's active cycle.
 *
 * <p>Both creates are guarded by store-level uniqueness. When two requests race, the loser
 * gets a {@link DuplicateRecordException} and returns the winner's row instead.</p>
 */
public class PoolBootstrapService {

    private final PrivatePoolStore store;

    public PoolBootstrapService(PrivatePoolStore store) {
        this.store = store;
    }

    public Investor ensureInvestor(String profileId, Instant now) {
        if (profileId == null || profileId.isEmpty()) {
            throw new IllegalArgumentException("profileId is required");
        }
        Investor existing = store.getInvestorByProfileId(profileId);
        if (existing != null) {
            return existing;
        }
        try {
            Investor created = store.createInvestor(profileId, now);
            LoggingService.info("investor_created", Map.of("investorId", created.getId(), "profileId", profileId));
            return created;
        } catch (DuplicateRecordException e) {
            LoggingService.info("investor_create_lost_race", Map.of("profileId", profileId));
            Investor winner = store.getInvestorByProfileId(profileId);
            if (winner == null) {
                throw e;
            }
            return winner;
        }
    }

    /**
     * The active cycle, opened for the current UTC month if none exists.
     *
     * @throws IllegalStateException while a cycle is pending settlement, since no cycle
     *                               opens until that one is settled and rolled over
     */
    public FundCycle ensureActiveCycle(Instant now) {
        FundCycle active = store.getActiveCycle();
        if (active != null) {
            return active;
        }
        FundCycle pending = store.findLatestCycleByStatus(CycleStatus.PENDING_SETTLEMENT);
        if (pending != null) {
            throw new IllegalStateException("cycle " + pending.getMonthYear()
                    + " is pending settlement; the pool reopens once it is settled");
        }
        CycleMonthYear monthYear = getCycleMonthYear(now);
        try {
            FundCycle created = store.createCycle(monthYear.cycleMonth, monthYear.cycleYear, CycleStatus.ACTIVE, now);
            LoggingService.info("fund_cycle_opened", Map.of("cycleId", created.getId(), "cycle", monthYear.toString()));
            return created;
        } catch (DuplicateRecordException e) {
            LoggingService.info("fund_cycle_create_lost_race", Map.of("cycle", monthYear.toString()));
            FundCycle winner = store.getActiveCycle();
            if (winner == null) {
                throw e;
            }
            return winner;
        }
    }

    /**
     * The cycle investors currently belong to: the active one, else the one awaiting
     * settlement, else a newly opened one.
     */
    public FundCycle currentCycle(Instant now) {
        FundCycle active = store.getActiveCycle();
        if (active != null) {
            return active;
        }
        FundCycle pending = store.findLatestCycleByStatus(CycleStatus.PENDING_SETTLEMENT);
        return pending != null ? pending : ensureActiveCycle(now);
    }

    /**
     * Month and year of {@code instant} in UTC.
     */
    public static CycleMonthYear getCycleMonthYear(Instant instant) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        return new CycleMonthYear(utc.getMonthValue(), utc.getYear());
    }

    /**
     * The calendar month after the given one; December rolls over to January of the next year.
     *
     * @throws IllegalArgumentException if {@code month} is outside 1..12
     */
    public static CycleMonthYear getNextCycle(int month, int year) {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("cycle month must be between 1 and 12, got " + month);
        }
        return month == 12 ? new CycleMonthYear(1, year + 1) : new CycleMonthYear(month + 1, year);
    }
}
