package com.dynamiccapital.pool.handlers;

import com.dynamiccapital.pool.pojos.AuthContext;
import com.dynamiccapital.pool.pojos.CycleSettlement;
import com.dynamiccapital.pool.pojos.CycleStatus;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.InvestorContact;
import com.dynamiccapital.pool.pojos.InvestorShare;
import com.dynamiccapital.pool.pojos.InvestorWithdrawal;
import com.dynamiccapital.pool.pojos.RequestBody;
import com.dynamiccapital.pool.pojos.ShareComputationResult;
import com.dynamiccapital.pool.rest.Json;
import com.dynamiccapital.pool.rest.ResponseConverter;
import com.dynamiccapital.pool.services.CycleSettlementService;
import com.dynamiccapital.pool.services.LoggingService;
import com.dynamiccapital.pool.services.PrivatePoolStore;
import com.dynamiccapital.pool.services.ProfileResolver;
import com.dynamiccapital.pool.services.ShareRecomputationService;
import com.dynamiccapital.pool.services.WithdrawalService;
import com.google.gson.Gson;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Admin-only pool operations: cycle overview, withdrawal decisions and settlement.
 */
public class PoolAdminHandler {

    private final PrivatePoolStore store;
    private final ProfileResolver profileResolver;
    private final ShareRecomputationService shareRecomputationService;
    private final CycleSettlementService cycleSettlementService;
    private final WithdrawalService withdrawalService;
    private final Clock clock;
    private final Gson gson;

    public PoolAdminHandler(PrivatePoolStore store, ProfileResolver profileResolver,
                            ShareRecomputationService shareRecomputationService,
                            CycleSettlementService cycleSettlementService,
                            WithdrawalService withdrawalService, Clock clock) {
        this.store = store;
        this.profileResolver = profileResolver;
        this.shareRecomputationService = shareRecomputationService;
        this.cycleSettlementService = cycleSettlementService;
        this.withdrawalService = withdrawalService;
        this.clock = clock;
        this.gson = Json.create();
    }

    public String handleRequest(String action, AuthContext auth, RequestBody requestBody) {
        if (auth == null || auth.profileId == null) {
            return failure(ResponseConverter.UNAUTHORIZED, "Authentication required");
        }
        if (!profileResolver.requireAdmin(auth.profileId)) {
            LoggingService.warn("pool_admin_access_denied", LoggingService.data("action", action));
            return failure(ResponseConverter.FORBIDDEN, "Admin access required");
        }
        try {
            return switch (action) {
                case "pool_admin_active_shares" -> handleActiveShares();
                case "pool_admin_approve_withdrawal" -> handleApprove(requestBody);
                case "pool_admin_deny_withdrawal" -> handleDeny(requestBody);
                case "pool_admin_fulfill_withdrawal" -> handleFulfill(requestBody);
                case "pool_admin_mark_pending_settlement" -> handleMarkPendingSettlement(requestBody);
                case "pool_admin_settle_cycle" -> handleSettleCycle(requestBody);
                default -> gson.toJson(Map.of("success", false, "errorMessage", "Unknown action: " + action));
            };
        } catch (IllegalArgumentException e) {
            LoggingService.warn("pool_admin_request_rejected", LoggingService.data("action", action, "reason", e.getMessage()));
            return failure(ResponseConverter.VALIDATION_ERROR, e.getMessage());
        } catch (IllegalStateException e) {
            LoggingService.warn("pool_admin_request_conflict", LoggingService.data("action", action, "reason", e.getMessage()));
            return failure(ResponseConverter.CONFLICT, e.getMessage());
        }
    }

    /**
     * Recompute the active cycle and list every share with the holder's contact details.
     */
    private String handleActiveShares() {
        FundCycle cycle = store.getActiveCycle();
        if (cycle == null) {
            return failure(ResponseConverter.NOT_FOUND, "No active cycle");
        }
        LoggingService.setCycleId(cycle.getId());
        ShareComputationResult result = shareRecomputationService.recomputeShares(cycle.getId(), Instant.now(clock));

        List<String> investorIds = new ArrayList<>();
        for (InvestorShare record : result.records) {
            investorIds.add(record.getInvestorId());
        }
        Map<String, InvestorContact> contacts = new HashMap<>();
        for (InvestorContact contact : store.listInvestorContacts(investorIds)) {
            contacts.put(contact.getInvestorId(), contact);
        }

        List<Map<String, Object>> shares = new ArrayList<>();
        for (InvestorShare record : result.records) {
            InvestorContact contact = contacts.get(record.getInvestorId());
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("investorId", record.getInvestorId());
            row.put("sharePercentage", record.getSharePercentage());
            row.put("contributionUsdt", record.getContributionUsdt());
            row.put("telegramId", contact != null ? contact.getTelegramId() : null);
            row.put("displayName", contact != null ? contact.getDisplayName() : null);
            shares.add(row);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("cycle", cycle);
        response.put("totalContributionUsdt", result.totalContribution);
        response.put("shares", shares);
        return gson.toJson(response);
    }

    private String handleApprove(RequestBody requestBody) {
        String withdrawalId = requireWithdrawalId(requestBody);
        InvestorWithdrawal updated = withdrawalService.approve(withdrawalId, requestBody.getAdminNotes(), Instant.now(clock));
        return withdrawalResponse(updated);
    }

    private String handleDeny(RequestBody requestBody) {
        String withdrawalId = requireWithdrawalId(requestBody);
        InvestorWithdrawal updated = withdrawalService.deny(withdrawalId, requestBody.getAdminNotes());
        return withdrawalResponse(updated);
    }

    private String handleFulfill(RequestBody requestBody) {
        String withdrawalId = requireWithdrawalId(requestBody);
        InvestorWithdrawal updated = withdrawalService.fulfill(withdrawalId, requestBody.getAdminNotes(), Instant.now(clock));
        return withdrawalResponse(updated);
    }

    private String handleMarkPendingSettlement(RequestBody requestBody) {
        String cycleId = requireCycleId(requestBody);
        FundCycle cycle = cycleSettlementService.markPendingSettlement(cycleId, Instant.now(clock));
        if (cycle == null) {
            return failure(ResponseConverter.NOT_FOUND, "Cycle not found");
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("cycle", cycle);
        return gson.toJson(response);
    }

    private String handleSettleCycle(RequestBody requestBody) {
        String cycleId = requireCycleId(requestBody);
        Instant now = Instant.now(clock);

        CycleSettlement settlement = new CycleSettlement(
                required("profitTotalUsdt", requestBody.getProfitTotalUsdt()),
                required("investorPayoutUsdt", requestBody.getInvestorPayoutUsdt()),
                required("reinvestedTotalUsdt", requestBody.getReinvestedTotalUsdt()),
                required("performanceFeeUsdt", requestBody.getPerformanceFeeUsdt()),
                now);
        settlement.setStatus(CycleStatus.SETTLED);
        settlement.setPayoutSummary(requestBody.getPayoutSummary());
        settlement.setNotes(requestBody.getNotes());

        FundCycle nextCycle = cycleSettlementService.settleAndRollOver(cycleId, settlement, requestBody.getAllocations(), now);
        if (nextCycle == null) {
            return failure(ResponseConverter.NOT_FOUND, "Cycle not found");
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("settledCycleId", cycleId);
        response.put("nextCycle", nextCycle);
        return gson.toJson(response);
    }

    private String withdrawalResponse(InvestorWithdrawal withdrawal) {
        if (withdrawal == null) {
            return failure(ResponseConverter.NOT_FOUND, "Withdrawal not found");
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("withdrawal", withdrawal);
        return gson.toJson(response);
    }

    private static String requireWithdrawalId(RequestBody requestBody) {
        if (requestBody.getWithdrawalId() == null || requestBody.getWithdrawalId().isEmpty()) {
            throw new IllegalArgumentException("Withdrawal ID is required");
        }
        return requestBody.getWithdrawalId();
    }

    private static String requireCycleId(RequestBody requestBody) {
        if (requestBody.getCycleId() == null || requestBody.getCycleId().isEmpty()) {
            throw new IllegalArgumentException("Cycle ID is required");
        }
        return requestBody.getCycleId();
    }

    private static double required(String field, Double value) {
        if (value == null) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value;
    }

    private String failure(String errorCode, String message) {
        return gson.toJson(Map.of(
                "success", false,
                "errorCode", errorCode,
                "errorMessage", message != null ? message : errorCode));
    }
}
