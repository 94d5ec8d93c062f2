package com.dynamiccapital.pool.handlers;

import com.dynamiccapital.pool.pojos.AuthContext;
import com.dynamiccapital.pool.pojos.DepositType;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.Investor;
import com.dynamiccapital.pool.pojos.InvestorDeposit;
import com.dynamiccapital.pool.pojos.InvestorShare;
import com.dynamiccapital.pool.pojos.InvestorWithdrawal;
import com.dynamiccapital.pool.pojos.RequestBody;
import com.dynamiccapital.pool.pojos.ShareComputationResult;
import com.dynamiccapital.pool.rest.Json;
import com.dynamiccapital.pool.rest.ResponseConverter;
import com.dynamiccapital.pool.services.LoggingService;
import com.dynamiccapital.pool.services.PoolBootstrapService;
import com.dynamiccapital.pool.services.PoolMath;
import com.dynamiccapital.pool.services.PrivatePoolStore;
import com.dynamiccapital.pool.services.ProfileResolver;
import com.dynamiccapital.pool.services.ShareRecomputationService;
import com.dynamiccapital.pool.services.WithdrawalService;
import com.google.gson.Gson;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Investor-facing pool operations: overview, deposits and withdrawal requests.
 */
public class PoolHandler {

    private final PrivatePoolStore store;
    private final ProfileResolver profileResolver;
    private final PoolBootstrapService bootstrapService;
    private final ShareRecomputationService shareRecomputationService;
    private final WithdrawalService withdrawalService;
    private final Clock clock;
    private final Gson gson;

    public PoolHandler(PrivatePoolStore store, ProfileResolver profileResolver, PoolBootstrapService bootstrapService,
                       ShareRecomputationService shareRecomputationService, WithdrawalService withdrawalService,
                       Clock clock) {
        this.store = store;
        this.profileResolver = profileResolver;
        this.bootstrapService = bootstrapService;
        this.shareRecomputationService = shareRecomputationService;
        this.withdrawalService = withdrawalService;
        this.clock = clock;
        this.gson = Json.create();
    }

    public String handleRequest(String action, AuthContext auth, RequestBody requestBody) {
        if (auth == null || auth.profileId == null) {
            return failure(ResponseConverter.UNAUTHORIZED, "Authentication required");
        }
        try {
            return switch (action) {
                case "pool_me" -> handleMe(auth);
                case "pool_record_deposit" -> handleRecordDeposit(auth, requestBody);
                case "pool_request_withdrawal" -> handleRequestWithdrawal(auth, requestBody);
                case "pool_get_withdrawal" -> handleGetWithdrawal(auth, requestBody);
                default -> gson.toJson(Map.of("success", false, "errorMessage", "Unknown action: " + action));
            };
        } catch (IllegalArgumentException e) {
            LoggingService.warn("pool_request_rejected", LoggingService.data("action", action, "reason", e.getMessage()));
            return failure(ResponseConverter.VALIDATION_ERROR, e.getMessage());
        } catch (IllegalStateException e) {
            LoggingService.warn("pool_request_conflict", LoggingService.data("action", action, "reason", e.getMessage()));
            return failure(ResponseConverter.CONFLICT, e.getMessage());
        }
    }

    /**
     * Investor row, current cycle and the caller's share of it. Creates the investor and
     * the cycle on first use. A cycle awaiting settlement is reported as is.
     */
    private String handleMe(AuthContext auth) {
        Instant now = Instant.now(clock);
        Investor investor = bootstrapService.ensureInvestor(auth.profileId, now);
        LoggingService.setInvestorId(investor.getId());
        FundCycle cycle = bootstrapService.currentCycle(now);
        LoggingService.setCycleId(cycle.getId());

        InvestorShare share = null;
        for (InvestorShare candidate : store.listShares(cycle.getId())) {
            if (investor.getId().equals(candidate.getInvestorId())) {
                share = candidate;
                break;
            }
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("investor", investor);
        response.put("cycle", cycle);
        response.put("share", share);
        response.put("telegramId", auth.telegramId);
        return gson.toJson(response);
    }

    private String handleRecordDeposit(AuthContext auth, RequestBody requestBody) {
        Double amount = requestBody.getAmount();
        if (amount == null || !Double.isFinite(amount) || PoolMath.roundMoney(amount) <= 0) {
            return failure(ResponseConverter.VALIDATION_ERROR, "Amount must be greater than 0");
        }
        DepositType depositType = DepositType.EXTERNAL;
        if (requestBody.getDepositType() != null && !requestBody.getDepositType().isBlank()) {
            depositType = DepositType.fromValue(requestBody.getDepositType().trim());
            if (depositType == null) {
                return failure(ResponseConverter.VALIDATION_ERROR, "Unknown deposit type: " + requestBody.getDepositType());
            }
        }
        if (depositType != DepositType.EXTERNAL && !profileResolver.requireAdmin(auth.profileId)) {
            return failure(ResponseConverter.FORBIDDEN, "Only admins can record " + depositType.getValue() + " deposits");
        }

        Instant now = Instant.now(clock);
        Investor investor = bootstrapService.ensureInvestor(auth.profileId, now);
        LoggingService.setInvestorId(investor.getId());
        FundCycle cycle = bootstrapService.ensureActiveCycle(now);
        LoggingService.setCycleId(cycle.getId());

        InvestorDeposit deposit = new InvestorDeposit(investor.getId(), cycle.getId(), PoolMath.roundMoney(amount), depositType);
        deposit.setTxHash(blankToNull(requestBody.getTxHash()));
        deposit.setNotes(blankToNull(requestBody.getNotes()));
        deposit.setCreatedAt(now);
        InvestorDeposit saved = store.insertDeposit(deposit);
        LoggingService.info("deposit_recorded", LoggingService.data(
                "depositId", saved.getId(),
                "amountUsdt", saved.getAmountUsdt(),
                "depositType", depositType.getValue()));

        ShareComputationResult shares = shareRecomputationService.recomputeShares(cycle.getId(), now);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("deposit", saved);
        response.put("share", shares.recordFor(investor.getId()));
        response.put("totalContributionUsdt", shares.totalContribution);
        return gson.toJson(response);
    }

    private String handleRequestWithdrawal(AuthContext auth, RequestBody requestBody) {
        Double amount = requestBody.getAmount();
        if (amount == null) {
            return failure(ResponseConverter.VALIDATION_ERROR, "Amount is required");
        }

        Instant now = Instant.now(clock);
        Investor investor = bootstrapService.ensureInvestor(auth.profileId, now);
        LoggingService.setInvestorId(investor.getId());
        FundCycle cycle = bootstrapService.ensureActiveCycle(now);
        LoggingService.setCycleId(cycle.getId());

        InvestorWithdrawal withdrawal = withdrawalService.requestWithdrawal(
                investor, cycle, amount, requestBody.getReinvestPercent(), now);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("withdrawal", withdrawal);
        return gson.toJson(response);
    }

    /**
     * Investors only see their own withdrawals; anything else reads as not found.
     */
    private String handleGetWithdrawal(AuthContext auth, RequestBody requestBody) {
        String withdrawalId = requestBody.getWithdrawalId();
        if (withdrawalId == null || withdrawalId.isEmpty()) {
            return failure(ResponseConverter.VALIDATION_ERROR, "Withdrawal ID is required");
        }
        InvestorWithdrawal withdrawal = withdrawalService.findWithdrawalById(withdrawalId);
        if (withdrawal == null) {
            return failure(ResponseConverter.NOT_FOUND, "Withdrawal not found");
        }
        Investor investor = store.getInvestorByProfileId(auth.profileId);
        boolean owner = investor != null && investor.getId().equals(withdrawal.getInvestorId());
        if (!owner && !profileResolver.requireAdmin(auth.profileId)) {
            return failure(ResponseConverter.NOT_FOUND, "Withdrawal not found");
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("withdrawal", withdrawal);
        return gson.toJson(response);
    }

    private String failure(String errorCode, String message) {
        return gson.toJson(Map.of(
                "success", false,
                "errorCode", errorCode,
                "errorMessage", message != null ? message : errorCode));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
