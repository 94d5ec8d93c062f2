package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.InvestorDeposit;
import com.dynamiccapital.pool.pojos.InvestorShare;
import com.dynamiccapital.pool.pojos.InvestorWithdrawal;
import com.dynamiccapital.pool.pojos.ShareComputationResult;
import com.dynamiccapital.pool.pojos.WithdrawalStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Rebuilds a cycle's ownership table from its deposits and withdrawals.
 *
 * <h2>Core formula</h2>
 * <pre>
 *   contribution[i] = max(0, Σ deposits[i] − Σ net(approved or fulfilled withdrawals[i]))
 *   total           = Σ contribution
 *   share[i]        = total > 0 ? round6(contribution[i] / total × 100) : 0
 * </pre>
 *
 * <p>Every investor that already holds a share row is rewritten too, so one whose
 * contribution drops to zero keeps a zero row. The recompute reads only source events,
 * so calling it again without new events writes the same rows.</p>
 */
public class ShareRecomputationService {

    private static final EnumSet<WithdrawalStatus> NETTED_STATUSES =
            EnumSet.of(WithdrawalStatus.APPROVED, WithdrawalStatus.FULFILLED);

    private final PrivatePoolStore store;

    public ShareRecomputationService(PrivatePoolStore store) {
        this.store = store;
    }

    public ShareComputationResult recomputeShares(String cycleId, Instant now) {
        if (cycleId == null || cycleId.isEmpty()) {
            throw new IllegalArgumentException("cycleId is required");
        }
        long start = LoggingService.logOperationStart("recompute_shares", LoggingService.data("cycleId", cycleId));

        Map<String, Double> contributions = computeContributions(cycleId);

        TreeSet<String> universe = new TreeSet<>(contributions.keySet());
        for (InvestorShare existing : store.listShares(cycleId)) {
            if (existing.getInvestorId() != null) {
                universe.add(existing.getInvestorId());
            }
        }

        double total = 0;
        for (double contribution : contributions.values()) {
            total += contribution;
        }

        List<InvestorShare> records = new ArrayList<>();
        for (String investorId : universe) {
            double contribution = contributions.getOrDefault(investorId, 0.0);
            double percentage = total > 0 ? PoolMath.roundPercentage(contribution / total * 100.0) : 0.0;
            records.add(new InvestorShare(investorId, cycleId, percentage, PoolMath.roundMoney(contribution), now));
        }

        if (!records.isEmpty()) {
            try {
                store.upsertShares(records);
            } catch (StoreException e) {
                LoggingService.logOperationFailed("recompute_shares", start, e);
                throw e;
            }
        }

        double roundedTotal = PoolMath.roundMoney(total);
        LoggingService.logOperationEnd("recompute_shares", start, LoggingService.data(
                "cycleId", cycleId,
                "investors", records.size(),
                "totalContribution", roundedTotal));
        return new ShareComputationResult(roundedTotal, contributions, records);
    }

    /**
     * Net contribution per investor for the cycle, without writing anything. Investors are
     * ordered by id.
     */
    public Map<String, Double> computeContributions(String cycleId) {
        Map<String, Double> contributions = new TreeMap<>();
        for (InvestorDeposit deposit : store.listDepositsByCycle(cycleId)) {
            if (deposit.getInvestorId() == null) continue;
            contributions.merge(deposit.getInvestorId(), deposit.getAmountUsdt(), Double::sum);
        }

        for (InvestorWithdrawal withdrawal : store.listWithdrawalsByCycle(cycleId, NETTED_STATUSES)) {
            Double net = withdrawal.getNetAmountUsdt();
            if (withdrawal.getInvestorId() == null || net == null || net <= 0) continue;
            double current = contributions.getOrDefault(withdrawal.getInvestorId(), 0.0);
            contributions.put(withdrawal.getInvestorId(), Math.max(0.0, current - net));
        }
        return contributions;
    }

    /**
     * Net contribution of one investor, 0 when the investor has no activity in the cycle.
     */
    public double currentContribution(String cycleId, String investorId) {
        return PoolMath.roundMoney(computeContributions(cycleId).getOrDefault(investorId, 0.0));
    }
}
