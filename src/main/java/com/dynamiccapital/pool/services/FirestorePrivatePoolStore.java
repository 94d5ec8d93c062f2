package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.CycleSettlement;
import com.dynamiccapital.pool.pojos.CycleStatus;
import com.dynamiccapital.pool.pojos.DepositType;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.Investor;
import com.dynamiccapital.pool.pojos.InvestorContact;
import com.dynamiccapital.pool.pojos.InvestorDeposit;
import com.dynamiccapital.pool.pojos.InvestorShare;
import com.dynamiccapital.pool.pojos.InvestorWithdrawal;
import com.dynamiccapital.pool.pojos.Profile;
import com.dynamiccapital.pool.pojos.UserRole;
import com.dynamiccapital.pool.pojos.WithdrawalChanges;
import com.dynamiccapital.pool.pojos.WithdrawalStatus;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.WriteBatch;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * {@link PrivatePoolStore} backed by Cloud Firestore.
 *
 * <p>Collections: profiles, investors, fund_cycles, investor_deposits,
 * investor_withdrawals, investor_shares ({cycleId}_{investorId}).</p>
 *
 * <p>Uniqueness is enforced with guard documents written through {@code create()} in the
 * same batch as the guarded row, so the losing writer gets ALREADY_EXISTS:
 * investor_profile_index/{profileId} for investors and fund_cycle_locks/active for the
 * active cycle. The cycle lock is held from opening until settlement.</p>
 */
public class FirestorePrivatePoolStore implements PrivatePoolStore {

    static final String PROFILES = "profiles";
    static final String INVESTORS = "investors";
    static final String INVESTOR_PROFILE_INDEX = "investor_profile_index";
    static final String FUND_CYCLES = "fund_cycles";
    static final String FUND_CYCLE_LOCKS = "fund_cycle_locks";
    static final String ACTIVE_LOCK_ID = "active";
    static final String DEPOSITS = "investor_deposits";
    static final String WITHDRAWALS = "investor_withdrawals";
    static final String SHARES = "investor_shares";

    private final Firestore db;

    public FirestorePrivatePoolStore(Firestore db) {
        this.db = db;
    }

    // =========================================================================
    // Profiles
    // =========================================================================

    @Override
    public Profile findProfileById(String id) {
        try {
            DocumentSnapshot doc = db.collection(PROFILES).document(id).get().get();
            return doc.exists() ? mapProfile(doc.getId(), doc.getData()) : null;
        } catch (InterruptedException | ExecutionException e) {
            throw failure("findProfileById", e);
        }
    }

    @Override
    public Profile findProfileByTelegramId(String telegramId) {
        try {
            List<QueryDocumentSnapshot> docs = db.collection(PROFILES)
                    .whereEqualTo("telegram_id", telegramId)
                    .limit(1)
                    .get().get().getDocuments();
            if (docs.isEmpty()) {
                return null;
            }
            QueryDocumentSnapshot doc = docs.get(0);
            return mapProfile(doc.getId(), doc.getData());
        } catch (InterruptedException | ExecutionException e) {
            throw failure("findProfileByTelegramId", e);
        }
    }

    // =========================================================================
    // Investors
    // =========================================================================

    @Override
    public Investor getInvestorByProfileId(String profileId) {
        try {
            List<QueryDocumentSnapshot> docs = db.collection(INVESTORS)
                    .whereEqualTo("profile_id", profileId)
                    .limit(1)
                    .get().get().getDocuments();
            if (docs.isEmpty()) {
                return null;
            }
            QueryDocumentSnapshot doc = docs.get(0);
            return mapInvestor(doc.getId(), doc.getData());
        } catch (InterruptedException | ExecutionException e) {
            throw failure("getInvestorByProfileId", e);
        }
    }

    @Override
    public Investor createInvestor(String profileId, Instant joinedAt) {
        DocumentReference investorRef = db.collection(INVESTORS).document();
        Map<String, Object> data = new HashMap<>();
        data.put("profile_id", profileId);
        data.put("status", Investor.STATUS_ACTIVE);
        data.put("joined_at", toTimestamp(joinedAt));

        WriteBatch batch = db.batch();
        batch.create(db.collection(INVESTOR_PROFILE_INDEX).document(profileId),
                Map.of("investor_id", investorRef.getId()));
        batch.create(investorRef, data);
        try {
            batch.commit().get();
        } catch (InterruptedException | ExecutionException e) {
            throw failure("createInvestor", e);
        }
        return mapInvestor(investorRef.getId(), data);
    }

    // =========================================================================
    // Cycles
    // =========================================================================

    @Override
    public FundCycle getActiveCycle() {
        return findLatestCycleByStatus(CycleStatus.ACTIVE);
    }

    @Override
    public FundCycle findLatestCycleByStatus(CycleStatus status) {
        try {
            List<QueryDocumentSnapshot> docs = db.collection(FUND_CYCLES)
                    .whereEqualTo("status", status.getValue())
                    .orderBy("opened_at", Query.Direction.DESCENDING)
                    .limit(1)
                    .get().get().getDocuments();
            if (docs.isEmpty()) {
                return null;
            }
            QueryDocumentSnapshot doc = docs.get(0);
            return mapFundCycle(doc.getId(), doc.getData());
        } catch (InterruptedException | ExecutionException e) {
            throw failure("findLatestCycleByStatus", e);
        }
    }

    @Override
    public FundCycle findCycleById(String cycleId) {
        try {
            DocumentSnapshot doc = db.collection(FUND_CYCLES).document(cycleId).get().get();
            return doc.exists() ? mapFundCycle(doc.getId(), doc.getData()) : null;
        } catch (InterruptedException | ExecutionException e) {
            throw failure("findCycleById", e);
        }
    }

    @Override
    public FundCycle createCycle(int cycleMonth, int cycleYear, CycleStatus status, Instant openedAt) {
        CycleStatus effectiveStatus = status != null ? status : CycleStatus.ACTIVE;
        DocumentReference cycleRef = db.collection(FUND_CYCLES).document();
        Map<String, Object> data = new HashMap<>();
        data.put("cycle_month", cycleMonth);
        data.put("cycle_year", cycleYear);
        data.put("status", effectiveStatus.getValue());
        data.put("profit_total_usdt", 0.0);
        data.put("investor_payout_usdt", 0.0);
        data.put("reinvested_total_usdt", 0.0);
        data.put("performance_fee_usdt", 0.0);
        data.put("opened_at", toTimestamp(openedAt != null ? openedAt : Instant.now()));

        WriteBatch batch = db.batch();
        if (effectiveStatus == CycleStatus.ACTIVE) {
            batch.create(activeLockRef(), Map.of("cycle_id", cycleRef.getId()));
        }
        batch.create(cycleRef, data);
        try {
            batch.commit().get();
        } catch (InterruptedException | ExecutionException e) {
            throw failure("createCycle", e);
        }
        return mapFundCycle(cycleRef.getId(), data);
    }

    @Override
    public void closeCycle(String cycleId, CycleSettlement settlement) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("status", settlement.getStatus().getValue());
        payload.put("profit_total_usdt", settlement.getProfitTotalUsdt());
        payload.put("investor_payout_usdt", settlement.getInvestorPayoutUsdt());
        payload.put("reinvested_total_usdt", settlement.getReinvestedTotalUsdt());
        payload.put("performance_fee_usdt", settlement.getPerformanceFeeUsdt());
        payload.put("payout_summary", settlement.getPayoutSummary());
        payload.put("closed_at", toTimestamp(settlement.getClosedAt()));
        payload.put("updated_at", toTimestamp(settlement.getClosedAt()));
        payload.put("notes", settlement.getNotes());
        writeCycleUpdate("closeCycle", cycleId, payload, settlement.getStatus());
    }

    @Override
    public void updateCycleStatus(String cycleId, CycleStatus status, Instant updatedAt) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("status", status.getValue());
        payload.put("updated_at", toTimestamp(updatedAt));
        writeCycleUpdate("updateCycleStatus", cycleId, payload, status);
    }

    /**
     * Update a cycle and, once it is settled, release the active lock if this cycle holds it.
     * A cycle pending settlement keeps the lock so no other cycle can open meanwhile.
     */
    private void writeCycleUpdate(String operation, String cycleId, Map<String, Object> payload, CycleStatus newStatus) {
        DocumentReference cycleRef = db.collection(FUND_CYCLES).document(cycleId);
        DocumentReference lockRef = activeLockRef();
        try {
            db.runTransaction(transaction -> {
                DocumentSnapshot lock = transaction.get(lockRef).get();
                transaction.update(cycleRef, payload);
                if (releasesActiveLock(newStatus) && lock.exists() && cycleId.equals(lock.getString("cycle_id"))) {
                    transaction.delete(lockRef);
                }
                return null;
            }).get();
        } catch (InterruptedException | ExecutionException e) {
            throw failure(operation, e);
        }
    }

    static boolean releasesActiveLock(CycleStatus status) {
        return status != CycleStatus.ACTIVE && status != CycleStatus.PENDING_SETTLEMENT;
    }

    // =========================================================================
    // Deposits
    // =========================================================================

    @Override
    public InvestorDeposit insertDeposit(InvestorDeposit entry) {
        DocumentReference ref = db.collection(DEPOSITS).document();
        Map<String, Object> data = new HashMap<>();
        data.put("investor_id", entry.getInvestorId());
        data.put("cycle_id", entry.getCycleId());
        data.put("amount_usdt", entry.getAmountUsdt());
        data.put("deposit_type", (entry.getDepositType() != null ? entry.getDepositType() : DepositType.EXTERNAL).getValue());
        data.put("tx_hash", entry.getTxHash());
        data.put("notes", entry.getNotes());
        data.put("created_at", toTimestamp(entry.getCreatedAt() != null ? entry.getCreatedAt() : Instant.now()));
        try {
            ref.create(data).get();
        } catch (InterruptedException | ExecutionException e) {
            throw failure("insertDeposit", e);
        }
        return mapDeposit(ref.getId(), data);
    }

    @Override
    public List<InvestorDeposit> listDepositsByCycle(String cycleId) {
        try {
            List<InvestorDeposit> deposits = new ArrayList<>();
            for (QueryDocumentSnapshot doc : db.collection(DEPOSITS)
                    .whereEqualTo("cycle_id", cycleId)
                    .get().get().getDocuments()) {
                deposits.add(mapDeposit(doc.getId(), doc.getData()));
            }
            return deposits;
        } catch (InterruptedException | ExecutionException e) {
            throw failure("listDepositsByCycle", e);
        }
    }

    // =========================================================================
    // Withdrawals
    // =========================================================================

    @Override
    public List<InvestorWithdrawal> listWithdrawalsByCycle(String cycleId, Collection<WithdrawalStatus> statuses) {
        Query query = db.collection(WITHDRAWALS).whereEqualTo("cycle_id", cycleId);
        if (statuses != null && !statuses.isEmpty()) {
            List<String> values = new ArrayList<>();
            for (WithdrawalStatus status : statuses) {
                values.add(status.getValue());
            }
            query = query.whereIn("status", values);
        }
        try {
            List<InvestorWithdrawal> withdrawals = new ArrayList<>();
            for (QueryDocumentSnapshot doc : query.get().get().getDocuments()) {
                withdrawals.add(mapWithdrawal(doc.getId(), doc.getData()));
            }
            return withdrawals;
        } catch (InterruptedException | ExecutionException e) {
            throw failure("listWithdrawalsByCycle", e);
        }
    }

    @Override
    public InvestorWithdrawal createWithdrawal(InvestorWithdrawal entry) {
        DocumentReference ref = db.collection(WITHDRAWALS).document();
        Map<String, Object> data = new HashMap<>();
        data.put("investor_id", entry.getInvestorId());
        data.put("cycle_id", entry.getCycleId());
        data.put("amount_usdt", entry.getAmountUsdt());
        data.put("status", (entry.getStatus() != null ? entry.getStatus() : WithdrawalStatus.PENDING).getValue());
        data.put("net_amount_usdt", entry.getNetAmountUsdt());
        data.put("reinvested_amount_usdt", entry.getReinvestedAmountUsdt());
        data.put("notice_expires_at", toTimestamp(entry.getNoticeExpiresAt()));
        data.put("requested_at", toTimestamp(entry.getRequestedAt() != null ? entry.getRequestedAt() : Instant.now()));
        data.put("fulfilled_at", null);
        data.put("admin_notes", entry.getAdminNotes());
        try {
            ref.create(data).get();
        } catch (InterruptedException | ExecutionException e) {
            throw failure("createWithdrawal", e);
        }
        return mapWithdrawal(ref.getId(), data);
    }

    @Override
    public InvestorWithdrawal updateWithdrawal(String id, WithdrawalChanges changes) {
        Map<String, Object> payload = toWithdrawalPayload(changes);
        DocumentReference ref = db.collection(WITHDRAWALS).document(id);
        try {
            return db.runTransaction(transaction -> {
                DocumentSnapshot snapshot = transaction.get(ref).get();
                if (!snapshot.exists()) {
                    return null;
                }
                Map<String, Object> current = snapshot.getData();
                WithdrawalStatus stored = WithdrawalStatus.fromValue(asString(current.get("status")));
                if (changes.getExpectedStatus() != null && changes.getExpectedStatus() != stored) {
                    throw new IllegalStateException("withdrawal " + id + " is " + valueOf(stored)
                            + ", expected " + changes.getExpectedStatus().getValue());
                }
                if (!payload.isEmpty()) {
                    transaction.update(ref, payload);
                }
                Map<String, Object> merged = new HashMap<>(current);
                merged.putAll(payload);
                return mapWithdrawal(id, merged);
            }).get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IllegalStateException) {
                throw (IllegalStateException) e.getCause();
            }
            throw failure("updateWithdrawal", e);
        } catch (InterruptedException e) {
            throw failure("updateWithdrawal", e);
        }
    }

    @Override
    public InvestorWithdrawal findWithdrawalById(String id) {
        try {
            DocumentSnapshot doc = db.collection(WITHDRAWALS).document(id).get().get();
            return doc.exists() ? mapWithdrawal(doc.getId(), doc.getData()) : null;
        } catch (InterruptedException | ExecutionException e) {
            throw failure("findWithdrawalById", e);
        }
    }

    static Map<String, Object> toWithdrawalPayload(WithdrawalChanges changes) {
        Map<String, Object> payload = new HashMap<>();
        if (changes.getStatus() != null) {
            payload.put("status", changes.getStatus().getValue());
        }
        if (changes.getNetAmountUsdt() != null) {
            payload.put("net_amount_usdt", changes.getNetAmountUsdt());
        }
        if (changes.getReinvestedAmountUsdt() != null) {
            payload.put("reinvested_amount_usdt", changes.getReinvestedAmountUsdt());
        }
        if (changes.getNoticeExpiresAt() != null) {
            payload.put("notice_expires_at", toTimestamp(changes.getNoticeExpiresAt()));
        }
        if (changes.getFulfilledAt() != null) {
            payload.put("fulfilled_at", toTimestamp(changes.getFulfilledAt()));
        }
        if (changes.getAdminNotes() != null) {
            payload.put("admin_notes", changes.getAdminNotes());
        }
        return payload;
    }

    // =========================================================================
    // Shares
    // =========================================================================

    @Override
    public void upsertShares(List<InvestorShare> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        WriteBatch batch = db.batch();
        for (InvestorShare record : records) {
            Map<String, Object> data = new HashMap<>();
            data.put("investor_id", record.getInvestorId());
            data.put("cycle_id", record.getCycleId());
            data.put("share_percentage", record.getSharePercentage());
            data.put("contribution_usdt", record.getContributionUsdt());
            data.put("updated_at", toTimestamp(record.getUpdatedAt()));
            batch.set(db.collection(SHARES).document(shareDocumentId(record.getCycleId(), record.getInvestorId())), data);
        }
        try {
            batch.commit().get();
        } catch (InterruptedException | ExecutionException e) {
            throw failure("upsertShares", e);
        }
    }

    @Override
    public List<InvestorShare> listShares(String cycleId) {
        try {
            List<InvestorShare> shares = new ArrayList<>();
            for (QueryDocumentSnapshot doc : db.collection(SHARES)
                    .whereEqualTo("cycle_id", cycleId)
                    .get().get().getDocuments()) {
                shares.add(mapShare(doc.getData()));
            }
            return shares;
        } catch (InterruptedException | ExecutionException e) {
            throw failure("listShares", e);
        }
    }

    static String shareDocumentId(String cycleId, String investorId) {
        return cycleId + "_" + investorId;
    }

    // =========================================================================
    // Contacts
    // =========================================================================

    @Override
    public List<InvestorContact> listInvestorContacts(Collection<String> investorIds) {
        if (investorIds == null || investorIds.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            Set<String> uniqueIds = new LinkedHashSet<>(investorIds);
            List<DocumentReference> investorRefs = new ArrayList<>();
            for (String investorId : uniqueIds) {
                investorRefs.add(db.collection(INVESTORS).document(investorId));
            }
            List<DocumentSnapshot> investorDocs = db.getAll(investorRefs.toArray(new DocumentReference[0])).get();

            Map<String, String> profileIdByInvestor = new HashMap<>();
            List<DocumentReference> profileRefs = new ArrayList<>();
            for (DocumentSnapshot investorDoc : investorDocs) {
                if (!investorDoc.exists()) continue;
                String profileId = investorDoc.getString("profile_id");
                profileIdByInvestor.put(investorDoc.getId(), profileId);
                if (profileId != null) {
                    profileRefs.add(db.collection(PROFILES).document(profileId));
                }
            }

            Map<String, Profile> profiles = new HashMap<>();
            if (!profileRefs.isEmpty()) {
                for (DocumentSnapshot profileDoc : db.getAll(profileRefs.toArray(new DocumentReference[0])).get()) {
                    if (profileDoc.exists()) {
                        profiles.put(profileDoc.getId(), mapProfile(profileDoc.getId(), profileDoc.getData()));
                    }
                }
            }

            List<InvestorContact> contacts = new ArrayList<>();
            for (String investorId : uniqueIds) {
                if (!profileIdByInvestor.containsKey(investorId)) continue;
                String profileId = profileIdByInvestor.get(investorId);
                Profile profile = profileId != null ? profiles.get(profileId) : null;
                contacts.add(new InvestorContact(investorId, profileId,
                        profile != null ? profile.getTelegramId() : null,
                        profile != null ? profile.getDisplayName() : null));
            }
            return contacts;
        } catch (InterruptedException | ExecutionException e) {
            throw failure("listInvestorContacts", e);
        }
    }

    // =========================================================================
    // Mapping
    // =========================================================================

    static Profile mapProfile(String id, Map<String, Object> data) {
        UserRole role = UserRole.fromValue(asString(data.get("role")));
        return new Profile(
                id,
                role != null ? role : UserRole.USER,
                asString(data.get("telegram_id")),
                asString(data.get("display_name")));
    }

    static Investor mapInvestor(String id, Map<String, Object> data) {
        return new Investor(
                id,
                asString(data.get("profile_id")),
                asString(data.get("status")),
                asInstant(data.get("joined_at")));
    }

    @SuppressWarnings("unchecked")
    static FundCycle mapFundCycle(String id, Map<String, Object> data) {
        FundCycle cycle = new FundCycle();
        cycle.setId(id);
        cycle.setCycleMonth((int) asNumber(data.get("cycle_month")));
        cycle.setCycleYear((int) asNumber(data.get("cycle_year")));
        cycle.setStatus(CycleStatus.fromValue(asString(data.get("status"))));
        cycle.setProfitTotalUsdt(asNumber(data.get("profit_total_usdt")));
        cycle.setInvestorPayoutUsdt(asNumber(data.get("investor_payout_usdt")));
        cycle.setReinvestedTotalUsdt(asNumber(data.get("reinvested_total_usdt")));
        cycle.setPerformanceFeeUsdt(asNumber(data.get("performance_fee_usdt")));
        Object summary = data.get("payout_summary");
        cycle.setPayoutSummary(summary instanceof Map ? (Map<String, Object>) summary : null);
        cycle.setNotes(asString(data.get("notes")));
        cycle.setOpenedAt(asInstant(data.get("opened_at")));
        cycle.setClosedAt(asInstant(data.get("closed_at")));
        return cycle;
    }

    static InvestorDeposit mapDeposit(String id, Map<String, Object> data) {
        InvestorDeposit deposit = new InvestorDeposit();
        deposit.setId(id);
        deposit.setInvestorId(asString(data.get("investor_id")));
        deposit.setCycleId(asString(data.get("cycle_id")));
        deposit.setAmountUsdt(asNumber(data.get("amount_usdt")));
        DepositType type = DepositType.fromValue(asString(data.get("deposit_type")));
        deposit.setDepositType(type != null ? type : DepositType.EXTERNAL);
        deposit.setTxHash(asString(data.get("tx_hash")));
        deposit.setNotes(asString(data.get("notes")));
        deposit.setCreatedAt(asInstant(data.get("created_at")));
        return deposit;
    }

    static InvestorWithdrawal mapWithdrawal(String id, Map<String, Object> data) {
        InvestorWithdrawal withdrawal = new InvestorWithdrawal();
        withdrawal.setId(id);
        withdrawal.setInvestorId(asString(data.get("investor_id")));
        withdrawal.setCycleId(asString(data.get("cycle_id")));
        withdrawal.setAmountUsdt(asNumber(data.get("amount_usdt")));
        withdrawal.setNetAmountUsdt(asNullableNumber(data.get("net_amount_usdt")));
        withdrawal.setReinvestedAmountUsdt(asNullableNumber(data.get("reinvested_amount_usdt")));
        withdrawal.setStatus(WithdrawalStatus.fromValue(asString(data.get("status"))));
        withdrawal.setRequestedAt(asInstant(data.get("requested_at")));
        withdrawal.setNoticeExpiresAt(asInstant(data.get("notice_expires_at")));
        withdrawal.setFulfilledAt(asInstant(data.get("fulfilled_at")));
        withdrawal.setAdminNotes(asString(data.get("admin_notes")));
        return withdrawal;
    }

    static InvestorShare mapShare(Map<String, Object> data) {
        return new InvestorShare(
                asString(data.get("investor_id")),
                asString(data.get("cycle_id")),
                asNumber(data.get("share_percentage")),
                asNumber(data.get("contribution_usdt")),
                asInstant(data.get("updated_at")));
    }

    /**
     * Missing, null or non-numeric values read as 0.
     */
    static double asNumber(Object value) {
        Double parsed = asNullableNumber(value);
        return parsed != null ? parsed : 0.0;
    }

    static Double asNullableNumber(Object value) {
        if (value == null) return null;
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return Double.isFinite(d) ? d : 0.0;
        }
        try {
            double d = Double.parseDouble(value.toString());
            return Double.isFinite(d) ? d : 0.0;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    static Instant asInstant(Object value) {
        if (value == null) return null;
        if (value instanceof Timestamp) {
            Timestamp ts = (Timestamp) value;
            return Instant.ofEpochSecond(ts.getSeconds(), ts.getNanos());
        }
        if (value instanceof java.util.Date) {
            return ((java.util.Date) value).toInstant();
        }
        return Instant.parse(value.toString());
    }

    static Timestamp toTimestamp(Instant instant) {
        if (instant == null) return null;
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    private static String valueOf(WithdrawalStatus status) {
        return status != null ? status.getValue() : "unknown";
    }

    private DocumentReference activeLockRef() {
        return db.collection(FUND_CYCLE_LOCKS).document(ACTIVE_LOCK_ID);
    }

    // =========================================================================
    // Errors
    // =========================================================================

    private static StoreException failure(String operation, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        if (isAlreadyExists(cause)) {
            return new DuplicateRecordException(operation, message, cause);
        }
        return new StoreException(operation, message, cause);
    }

    static boolean isAlreadyExists(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ApiException
                    && ((ApiException) t).getStatusCode().getCode() == StatusCode.Code.ALREADY_EXISTS) {
                return true;
            }
            if (t.getMessage() != null && t.getMessage().contains("ALREADY_EXISTS")) {
                return true;
            }
            if (t.getCause() == t) break;
        }
        return false;
    }
}
