package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.CycleStatus;
import com.dynamiccapital.pool.pojos.FundCycle;
import com.dynamiccapital.pool.pojos.InvestorContact;
import com.dynamiccapital.pool.pojos.InvestorShare;
import com.dynamiccapital.pool.pojos.InvestorWithdrawal;
import com.dynamiccapital.pool.pojos.Profile;
import com.dynamiccapital.pool.pojos.UserRole;
import com.dynamiccapital.pool.pojos.WithdrawalChanges;
import com.dynamiccapital.pool.pojos.WithdrawalStatus;
import com.google.api.core.ApiFutures;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.Query;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import com.google.cloud.firestore.Transaction;
import com.google.cloud.firestore.WriteBatch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class FirestorePrivatePoolStoreTest {

    @Mock
    private Firestore mockDb;
    @Mock
    private CollectionReference mockCollectionRef;
    @Mock
    private DocumentReference mockDocRef;
    @Mock
    private DocumentSnapshot mockDocSnapshot;
    @Mock
    private Query mockQuery;
    @Mock
    private QuerySnapshot mockQuerySnapshot;
    @Mock
    private QueryDocumentSnapshot mockQueryDoc;
    @Mock
    private WriteBatch mockBatch;
    @Mock
    private Transaction mockTransaction;

    private FirestorePrivatePoolStore store;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        store = new FirestorePrivatePoolStore(mockDb);
        when(mockDb.collection(anyString())).thenReturn(mockCollectionRef);
        when(mockCollectionRef.document(anyString())).thenReturn(mockDocRef);
        when(mockCollectionRef.document()).thenReturn(mockDocRef);
        when(mockDocRef.getId()).thenReturn("generated-id");
        when(mockDb.batch()).thenReturn(mockBatch);
    }

    @SuppressWarnings("unchecked")
    private void runTransactionsInline() {
        when(mockDb.runTransaction(any(Transaction.Function.class))).thenAnswer(invocation -> {
            Transaction.Function<Object> fn = invocation.getArgument(0);
            try {
                return ApiFutures.immediateFuture(fn.updateCallback(mockTransaction));
            } catch (Exception e) {
                return ApiFutures.immediateFailedFuture(e);
            }
        });
    }

    @Test
    void testFindProfileById_mapsDocument() {
        Map<String, Object> data = new HashMap<>();
        data.put("role", "admin");
        data.put("telegram_id", "555");
        data.put("display_name", "Ada");
        when(mockDocRef.get()).thenReturn(ApiFutures.immediateFuture(mockDocSnapshot));
        when(mockDocSnapshot.exists()).thenReturn(true);
        when(mockDocSnapshot.getId()).thenReturn("p-1");
        when(mockDocSnapshot.getData()).thenReturn(data);

        Profile profile = store.findProfileById("p-1");

        assertEquals("p-1", profile.getId());
        assertEquals(UserRole.ADMIN, profile.getRole());
        assertEquals("555", profile.getTelegramId());
        verify(mockDb).collection(FirestorePrivatePoolStore.PROFILES);
    }

    @Test
    void testFindProfileById_missingReturnsNull() {
        when(mockDocRef.get()).thenReturn(ApiFutures.immediateFuture(mockDocSnapshot));
        when(mockDocSnapshot.exists()).thenReturn(false);

        assertNull(store.findProfileById("nobody"));
    }

    @Test
    void testFindProfileByTelegramId_queriesByTelegramId() {
        when(mockCollectionRef.whereEqualTo("telegram_id", "42")).thenReturn(mockQuery);
        when(mockQuery.limit(1)).thenReturn(mockQuery);
        when(mockQuery.get()).thenReturn(ApiFutures.immediateFuture(mockQuerySnapshot));
        when(mockQuerySnapshot.getDocuments()).thenReturn(List.of(mockQueryDoc));
        when(mockQueryDoc.getId()).thenReturn("p-42");
        when(mockQueryDoc.getData()).thenReturn(Map.<String, Object>of("telegram_id", "42"));

        Profile profile = store.findProfileByTelegramId("42");

        assertEquals("p-42", profile.getId());
        assertEquals(UserRole.USER, profile.getRole());
    }

    @Test
    void testReadFailure_wrappedWithOperationName() {
        when(mockDocRef.get()).thenReturn(ApiFutures.immediateFailedFuture(new RuntimeException("UNAVAILABLE")));

        StoreException e = assertThrows(StoreException.class, () -> store.findCycleById("c-1"));
        assertEquals("findCycleById", e.getOperation());
        assertEquals("findCycleById failed: UNAVAILABLE", e.getMessage());
        assertFalse(e instanceof DuplicateRecordException);
    }

    @Test
    void testCreateInvestor_guardCollision_throwsDuplicate() {
        ApiException alreadyExists = mock(ApiException.class);
        StatusCode statusCode = mock(StatusCode.class);
        when(alreadyExists.getStatusCode()).thenReturn(statusCode);
        when(statusCode.getCode()).thenReturn(StatusCode.Code.ALREADY_EXISTS);
        when(mockBatch.commit()).thenReturn(ApiFutures.immediateFailedFuture(alreadyExists));

        assertThrows(DuplicateRecordException.class, () -> store.createInvestor("profile-1", Instant.now()));
        verify(mockBatch).create(eq(mockDocRef), eq(Map.<String, Object>of("investor_id", "generated-id")));
    }

    @Test
    void testCreateCycle_activeWritesLockInSameBatch() {
        when(mockBatch.commit()).thenReturn(ApiFutures.immediateFuture(List.of()));

        FundCycle cycle = store.createCycle(5, 2024, CycleStatus.ACTIVE,
                Instant.parse("2024-05-01T00:00:00Z"));

        assertEquals("generated-id", cycle.getId());
        assertEquals(5, cycle.getCycleMonth());
        verify(mockDb).collection(FirestorePrivatePoolStore.FUND_CYCLE_LOCKS);
        verify(mockBatch, times(2)).create(any(DocumentReference.class), anyMap());
    }

    @Test
    void testCreateCycle_duplicateMessage_throwsDuplicate() {
        when(mockBatch.commit()).thenReturn(ApiFutures.immediateFailedFuture(
                new RuntimeException("ALREADY_EXISTS: Document already exists")));

        assertThrows(DuplicateRecordException.class, () -> store.createCycle(5, 2024,
                CycleStatus.ACTIVE, Instant.now()));
    }

    @Test
    void testUpdateWithdrawal_missingReturnsNull() {
        runTransactionsInline();
        when(mockTransaction.get(mockDocRef)).thenReturn(ApiFutures.immediateFuture(mockDocSnapshot));
        when(mockDocSnapshot.exists()).thenReturn(false);

        assertNull(store.updateWithdrawal("wd-1", WithdrawalChanges.status(WithdrawalStatus.APPROVED)));
        verify(mockTransaction, never()).update(any(DocumentReference.class), anyMap());
    }

    @Test
    void testUpdateWithdrawal_expectedStatusMismatch_throwsIllegalState() {
        runTransactionsInline();
        when(mockTransaction.get(mockDocRef)).thenReturn(ApiFutures.immediateFuture(mockDocSnapshot));
        when(mockDocSnapshot.exists()).thenReturn(true);
        when(mockDocSnapshot.getData()).thenReturn(new HashMap<>(Map.<String, Object>of("status", "denied", "amount_usdt", 100.0)));

        WithdrawalChanges changes = WithdrawalChanges.status(WithdrawalStatus.APPROVED)
                .setExpectedStatus(WithdrawalStatus.PENDING);

        assertThrows(IllegalStateException.class, () -> store.updateWithdrawal("wd-1", changes));
        verify(mockTransaction, never()).update(any(DocumentReference.class), anyMap());
    }

    @Test
    void testUpdateWithdrawal_mergesChangesIntoResult() {
        runTransactionsInline();
        Map<String, Object> stored = new HashMap<>();
        stored.put("status", "pending");
        stored.put("investor_id", "inv-1");
        stored.put("cycle_id", "c-1");
        stored.put("amount_usdt", 100L);
        stored.put("net_amount_usdt", 84.0);
        when(mockTransaction.get(mockDocRef)).thenReturn(ApiFutures.immediateFuture(mockDocSnapshot));
        when(mockDocSnapshot.exists()).thenReturn(true);
        when(mockDocSnapshot.getData()).thenReturn(stored);

        InvestorWithdrawal updated = store.updateWithdrawal("wd-1",
                WithdrawalChanges.status(WithdrawalStatus.APPROVED).setExpectedStatus(WithdrawalStatus.PENDING)
                        .setAdminNotes("ok"));

        assertEquals("wd-1", updated.getId());
        assertEquals(WithdrawalStatus.APPROVED, updated.getStatus());
        assertEquals(100.0, updated.getAmountUsdt(), 0.0);
        assertEquals("ok", updated.getAdminNotes());
        verify(mockTransaction).update(eq(mockDocRef), eq(Map.<String, Object>of("status", "approved", "admin_notes", "ok")));
    }

    @Test
    void testUpsertShares_emptyIsNoOp() {
        store.upsertShares(List.of());

        verify(mockDb, never()).batch();
    }

    @Test
    void testUpsertShares_singleBatchKeyedByCycleAndInvestor() {
        when(mockBatch.commit()).thenReturn(ApiFutures.immediateFuture(List.of()));
        Instant now = Instant.parse("2024-05-10T12:00:00Z");

        store.upsertShares(List.of(
                new InvestorShare("A", "c-1", 60.0, 600.0, now),
                new InvestorShare("B", "c-1", 40.0, 400.0, now)));

        verify(mockCollectionRef).document("c-1_A");
        verify(mockCollectionRef).document("c-1_B");
        verify(mockBatch, times(2)).set(any(DocumentReference.class), anyMap());
        verify(mockBatch, times(1)).commit();
    }

    @Test
    void testListInvestorContacts_emptyInputSkipsStore() {
        List<InvestorContact> contacts = store.listInvestorContacts(List.of());

        assertTrue(contacts.isEmpty());
        verifyNoInteractions(mockDb);
    }

    @Test
    void testMapping_toleratesMissingAndNonNumericValues() {
        Map<String, Object> data = new HashMap<>();
        data.put("cycle_month", 5L);
        data.put("cycle_year", "2024");
        data.put("status", "settled");
        data.put("profit_total_usdt", "not-a-number");
        data.put("opened_at", Timestamp.ofTimeSecondsAndNanos(1714521600L, 0));

        FundCycle cycle = FirestorePrivatePoolStore.mapFundCycle("c-1", data);

        assertEquals(5, cycle.getCycleMonth());
        assertEquals(2024, cycle.getCycleYear());
        assertEquals(0.0, cycle.getProfitTotalUsdt(), 0.0);
        assertEquals(0.0, cycle.getInvestorPayoutUsdt(), 0.0);
        assertEquals(Instant.parse("2024-05-01T00:00:00Z"), cycle.getOpenedAt());
        assertNull(cycle.getClosedAt());
    }

    @Test
    void testActiveLock_heldUntilCycleSettles() {
        assertFalse(FirestorePrivatePoolStore.releasesActiveLock(CycleStatus.ACTIVE));
        assertFalse(FirestorePrivatePoolStore.releasesActiveLock(CycleStatus.PENDING_SETTLEMENT));
        assertTrue(FirestorePrivatePoolStore.releasesActiveLock(CycleStatus.SETTLED));
    }

    @Test
    void testTimestampConversion_keepsNanos() {
        Instant instant = Instant.parse("2024-05-10T12:00:00.123456789Z");

        assertEquals(instant, FirestorePrivatePoolStore.asInstant(FirestorePrivatePoolStore.toTimestamp(instant)));
    }
}
