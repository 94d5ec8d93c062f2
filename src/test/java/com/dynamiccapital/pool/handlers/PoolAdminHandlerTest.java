package com.dynamiccapital.pool.handlers;

import com.dynamiccapital.pool.pojos.AuthContext;
import com.dynamiccapital.pool.pojos.CycleStatus;
import com.dynamiccapital.pool.pojos.DepositType;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.Investor;
import com.dynamiccapital.pool.pojos.InvestorDeposit;
import com.dynamiccapital.pool.pojos.InvestorWithdrawal;
import com.dynamiccapital.pool.pojos.RequestBody;
import com.dynamiccapital.pool.pojos.RolloverAllocation;
import com.dynamiccapital.pool.pojos.UserRole;
import com.dynamiccapital.pool.pojos.WithdrawalStatus;
import com.dynamiccapital.pool.services.CycleSettlementService;
import com.dynamiccapital.pool.services.IdentityProvider;
import com.dynamiccapital.pool.services.InMemoryPrivatePoolStore;
import com.dynamiccapital.pool.services.ProfileResolver;
import com.dynamiccapital.pool.services.ShareRecomputationService;
import com.dynamiccapital.pool.services.WithdrawalService;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

public class PoolAdminHandlerTest {

    private static final Instant OPENED = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant NOW = Instant.parse("2024-05-20T09:30:00Z");
    private static final AuthContext ADMIN = new AuthContext("admin-profile", "9000");
    private static final AuthContext USER = new AuthContext("user-profile", "1001");

    private InMemoryPrivatePoolStore store;
    private PoolAdminHandler handler;
    private FundCycle cycle;
    private Investor alice;
    private Investor bob;

    @BeforeEach
    void setUp() {
        store = new InMemoryPrivatePoolStore();
        store.addProfile("admin-profile", UserRole.ADMIN, "9000");
        store.addProfile("user-profile", UserRole.USER, "1001");
        store.addProfile("bob-profile", UserRole.USER, "1002");

        ShareRecomputationService shareService = new ShareRecomputationService(store);
        handler = new PoolAdminHandler(
                store,
                new ProfileResolver(store, mock(IdentityProvider.class)),
                shareService,
                new CycleSettlementService(store, shareService),
                new WithdrawalService(store, shareService, Duration.ofDays(7), 16.0),
                Clock.fixed(NOW, ZoneOffset.UTC));

        cycle = store.createCycle(5, 2024, CycleStatus.ACTIVE, OPENED);
        alice = store.createInvestor("user-profile", OPENED);
        bob = store.createInvestor("bob-profile", OPENED);
        store.addDeposit(alice.getId(), cycle.getId(), 750);
        store.addDeposit(bob.getId(), cycle.getId(), 250);
    }

    private static JsonObject parse(String json) {
        return JsonParser.parseString(json).getAsJsonObject();
    }

    private RequestBody withdrawalRequest(String withdrawalId) {
        RequestBody body = new RequestBody();
        body.setWithdrawalId(withdrawalId);
        return body;
    }

    private RequestBody settlementRequest() {
        RequestBody body = new RequestBody();
        body.setCycleId(cycle.getId());
        body.setProfitTotalUsdt(100.0);
        body.setInvestorPayoutUsdt(60.0);
        body.setReinvestedTotalUsdt(16.0);
        body.setPerformanceFeeUsdt(24.0);
        return body;
    }

    @Test
    void testNonAdmin_isForbiddenForEveryAction() {
        for (String action : List.of("pool_admin_active_shares", "pool_admin_approve_withdrawal",
                "pool_admin_settle_cycle", "pool_admin_mark_pending_settlement")) {
            JsonObject response = parse(handler.handleRequest(action, USER, settlementRequest()));
            assertEquals("FORBIDDEN", response.get("errorCode").getAsString(), action);
        }
        assertEquals(CycleStatus.ACTIVE, store.findCycleById(cycle.getId()).getStatus());
    }

    @Test
    void testActiveShares_listsSharesWithContacts() {
        JsonObject response = parse(handler.handleRequest("pool_admin_active_shares", ADMIN, new RequestBody()));

        assertTrue(response.get("success").getAsBoolean());
        assertEquals(1000.0, response.get("totalContributionUsdt").getAsDouble(), 1e-9);
        JsonArray shares = response.getAsJsonArray("shares");
        assertEquals(2, shares.size());
        for (int i = 0; i < shares.size(); i++) {
            JsonObject row = shares.get(i).getAsJsonObject();
            if (alice.getId().equals(row.get("investorId").getAsString())) {
                assertEquals(75.0, row.get("sharePercentage").getAsDouble(), 1e-9);
                assertEquals("1001", row.get("telegramId").getAsString());
            } else {
                assertEquals(25.0, row.get("sharePercentage").getAsDouble(), 1e-9);
            }
        }
    }

    @Test
    void testActiveShares_noActiveCycle() {
        store.cycles.clear();

        JsonObject response = parse(handler.handleRequest("pool_admin_active_shares", ADMIN, new RequestBody()));

        assertEquals("NOT_FOUND", response.get("errorCode").getAsString());
    }

    @Test
    void testApprove_thenDenyIsConflict() {
        InvestorWithdrawal wd = store.addWithdrawal(alice.getId(), cycle.getId(), 100, 84.0, WithdrawalStatus.PENDING);

        JsonObject approved = parse(handler.handleRequest("pool_admin_approve_withdrawal", ADMIN, withdrawalRequest(wd.getId())));
        JsonObject denied = parse(handler.handleRequest("pool_admin_deny_withdrawal", ADMIN, withdrawalRequest(wd.getId())));

        assertEquals("approved", approved.getAsJsonObject("withdrawal").get("status").getAsString());
        assertEquals("CONFLICT", denied.get("errorCode").getAsString());
        assertEquals(WithdrawalStatus.APPROVED, store.withdrawals.get(wd.getId()).getStatus());
        // alice: 750 - 84 = 666, bob: 250
        assertEquals(666.0, store.shares.get(cycle.getId() + "_" + alice.getId()).getContributionUsdt(), 1e-9);
    }

    @Test
    void testDeny_unknownWithdrawalIsNotFound() {
        JsonObject response = parse(handler.handleRequest("pool_admin_deny_withdrawal", ADMIN, withdrawalRequest("missing")));

        assertEquals("NOT_FOUND", response.get("errorCode").getAsString());
    }

    @Test
    void testApprove_missingIdIsValidationError() {
        JsonObject response = parse(handler.handleRequest("pool_admin_approve_withdrawal", ADMIN, new RequestBody()));

        assertEquals("VALIDATION_ERROR", response.get("errorCode").getAsString());
    }

    @Test
    void testFulfill_beforeNoticeExpiresIsConflict() {
        InvestorWithdrawal wd = store.addWithdrawal(alice.getId(), cycle.getId(), 100, 84.0, WithdrawalStatus.APPROVED);
        wd.setNoticeExpiresAt(NOW.plus(Duration.ofDays(1)));

        JsonObject response = parse(handler.handleRequest("pool_admin_fulfill_withdrawal", ADMIN, withdrawalRequest(wd.getId())));

        assertEquals("CONFLICT", response.get("errorCode").getAsString());
        assertEquals(WithdrawalStatus.APPROVED, store.withdrawals.get(wd.getId()).getStatus());
    }

    @Test
    void testFulfill_afterNoticeStampsFulfilledAt() {
        InvestorWithdrawal wd = store.addWithdrawal(alice.getId(), cycle.getId(), 100, 84.0, WithdrawalStatus.APPROVED);
        wd.setNoticeExpiresAt(NOW.minus(Duration.ofHours(1)));

        JsonObject response = parse(handler.handleRequest("pool_admin_fulfill_withdrawal", ADMIN, withdrawalRequest(wd.getId())));

        JsonObject withdrawal = response.getAsJsonObject("withdrawal");
        assertEquals("fulfilled", withdrawal.get("status").getAsString());
        assertEquals(NOW.toString(), withdrawal.get("fulfilledAt").getAsString());
    }

    @Test
    void testFulfill_twiceIsConflict() {
        InvestorWithdrawal wd = store.addWithdrawal(alice.getId(), cycle.getId(), 100, 84.0, WithdrawalStatus.APPROVED);
        wd.setNoticeExpiresAt(NOW.minus(Duration.ofHours(1)));

        handler.handleRequest("pool_admin_fulfill_withdrawal", ADMIN, withdrawalRequest(wd.getId()));
        JsonObject again = parse(handler.handleRequest("pool_admin_fulfill_withdrawal", ADMIN, withdrawalRequest(wd.getId())));

        assertEquals("CONFLICT", again.get("errorCode").getAsString());
        assertEquals(NOW, store.withdrawals.get(wd.getId()).getFulfilledAt());
    }

    @Test
    void testMarkPendingSettlement() {
        RequestBody body = new RequestBody();
        body.setCycleId(cycle.getId());

        JsonObject response = parse(handler.handleRequest("pool_admin_mark_pending_settlement", ADMIN, body));

        assertEquals("pending_settlement", response.getAsJsonObject("cycle").get("status").getAsString());
        assertEquals(CycleStatus.PENDING_SETTLEMENT, store.findCycleById(cycle.getId()).getStatus());
    }

    @Test
    void testSettle_closesCycleAndRollsOverAllocations() {
        RequestBody body = settlementRequest();
        body.setAllocations(List.of(
                new RolloverAllocation(alice.getId(), 762.0, DepositType.CARRYOVER),
                new RolloverAllocation(bob.getId(), 254.0, null),
                new RolloverAllocation(bob.getId(), 0.0, DepositType.REINVESTMENT)));

        JsonObject response = parse(handler.handleRequest("pool_admin_settle_cycle", ADMIN, body));

        assertTrue(response.get("success").getAsBoolean());
        FundCycle settled = store.findCycleById(cycle.getId());
        assertEquals(CycleStatus.SETTLED, settled.getStatus());
        assertEquals(NOW, settled.getClosedAt());

        FundCycle next = store.getActiveCycle();
        assertEquals(next.getId(), response.getAsJsonObject("nextCycle").get("id").getAsString());
        assertEquals(6, next.getCycleMonth());
        assertEquals(2024, next.getCycleYear());

        List<InvestorDeposit> carried = store.listDepositsByCycle(next.getId());
        assertEquals(2, carried.size());
        for (InvestorDeposit deposit : carried) {
            assertEquals(DepositType.CARRYOVER, deposit.getDepositType());
        }
        assertEquals(75.0, store.shares.get(next.getId() + "_" + alice.getId()).getSharePercentage(), 1e-9);
    }

    @Test
    void testSettle_unbalancedTotalsRejectedBeforeAnyWrite() {
        RequestBody body = settlementRequest();
        body.setPerformanceFeeUsdt(30.0);

        JsonObject response = parse(handler.handleRequest("pool_admin_settle_cycle", ADMIN, body));

        assertEquals("VALIDATION_ERROR", response.get("errorCode").getAsString());
        assertEquals(0, store.closeCycleCalls);
        assertEquals(1, store.cycles.size());
    }

    @Test
    void testSettle_missingTotalIsValidationError() {
        RequestBody body = settlementRequest();
        body.setProfitTotalUsdt(null);

        JsonObject response = parse(handler.handleRequest("pool_admin_settle_cycle", ADMIN, body));

        assertEquals("VALIDATION_ERROR", response.get("errorCode").getAsString());
        assertTrue(response.get("errorMessage").getAsString().contains("profitTotalUsdt"));
    }

    @Test
    void testSettle_unknownCycleIsNotFound() {
        RequestBody body = settlementRequest();
        body.setCycleId("missing");

        JsonObject response = parse(handler.handleRequest("pool_admin_settle_cycle", ADMIN, body));

        assertEquals("NOT_FOUND", response.get("errorCode").getAsString());
    }

    @Test
    void testSettle_twiceIsConflict() {
        handler.handleRequest("pool_admin_settle_cycle", ADMIN, settlementRequest());

        JsonObject response = parse(handler.handleRequest("pool_admin_settle_cycle", ADMIN, settlementRequest()));

        assertEquals("CONFLICT", response.get("errorCode").getAsString());
    }
}
