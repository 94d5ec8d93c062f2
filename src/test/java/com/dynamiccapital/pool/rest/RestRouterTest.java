package com.dynamiccapital.pool.rest;

import com.dynamiccapital.pool.handlers.PoolAdminHandler;
import com.dynamiccapital.pool.handlers.PoolHandler;
import com.dynamiccapital.pool.pojos.AuthContext;
import com.dynamiccapital.pool.pojos.RequestBody;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;


import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class RestRouterTest {

    private static final String OK = "{\"success\":true}";
    private static final AuthContext AUTH = new AuthContext("profile-1", "1001");

    @Mock
    private PoolHandler mockPoolHandler;
    @Mock
    private PoolAdminHandler mockAdminHandler;

    private RestRouter router;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        router = new RestRouter(mockPoolHandler, mockAdminHandler);
    }

    @Test
    void testMeRoute() {
        when(mockPoolHandler.handleRequest(eq("pool_me"), eq(AUTH), any(RequestBody.class))).thenReturn(OK);

        ApiResponse response = router.route("GET", "/api/v1/pool/me", AUTH, null);

        assertEquals(200, response.getStatusCode());
        assertEquals(OK, response.getBody());
    }

    @Test
    void testCreateRoutesReturn201() {
        when(mockPoolHandler.handleRequest(anyString(), eq(AUTH), any(RequestBody.class))).thenReturn(OK);

        assertEquals(201, router.route("POST", "/api/v1/pool/deposits", AUTH, new RequestBody()).getStatusCode());
        assertEquals(201, router.route("POST", "/api/v1/pool/withdrawals", AUTH, new RequestBody()).getStatusCode());
    }

    @Test
    void testWithdrawalIdFromPathIsDecoded() {
        when(mockPoolHandler.handleRequest(eq("pool_get_withdrawal"), eq(AUTH), any(RequestBody.class))).thenReturn(OK);

        router.route("GET", "/api/v1/pool/withdrawals/wd%201", AUTH, null);

        ArgumentCaptor<RequestBody> captor = ArgumentCaptor.forClass(RequestBody.class);
        verify(mockPoolHandler).handleRequest(eq("pool_get_withdrawal"), eq(AUTH), captor.capture());
        assertEquals("wd 1", captor.getValue().getWithdrawalId());
    }

    @Test
    void testAdminRoutesFillPathParams() {
        when(mockAdminHandler.handleRequest(anyString(), eq(AUTH), any(RequestBody.class))).thenReturn(OK);

        router.route("POST", "/api/v1/pool/admin/cycles/cycle-7/settle", AUTH, new RequestBody());
        router.route("POST", "/api/v1/pool/admin/withdrawals/wd-3/fulfill", AUTH, new RequestBody());

        ArgumentCaptor<RequestBody> settle = ArgumentCaptor.forClass(RequestBody.class);
        verify(mockAdminHandler).handleRequest(eq("pool_admin_settle_cycle"), eq(AUTH), settle.capture());
        assertEquals("cycle-7", settle.getValue().getCycleId());

        ArgumentCaptor<RequestBody> fulfill = ArgumentCaptor.forClass(RequestBody.class);
        verify(mockAdminHandler).handleRequest(eq("pool_admin_fulfill_withdrawal"), eq(AUTH), fulfill.capture());
        assertEquals("wd-3", fulfill.getValue().getWithdrawalId());
        verifyNoInteractions(mockPoolHandler);
    }

    @Test
    void testActiveSharesIsNotMistakenForCycleId() {
        when(mockAdminHandler.handleRequest(eq("pool_admin_active_shares"), eq(AUTH), any(RequestBody.class))).thenReturn(OK);

        ApiResponse response = router.route("GET", "/api/v1/pool/admin/cycles/active/shares", AUTH, null);

        assertEquals(200, response.getStatusCode());
    }

    @Test
    void testUnknownRouteOrMethodReturnsNull() {
        assertNull(router.route("GET", "/api/v1/pool/unknown", AUTH, null));
        assertNull(router.route("DELETE", "/api/v1/pool/me", AUTH, null));
        assertNull(router.route("GET", "/api/v1/pool/deposits", AUTH, null));
    }

    @Test
    void testHandlerExceptionBecomes500() {
        when(mockPoolHandler.handleRequest(eq("pool_me"), eq(AUTH), any(RequestBody.class)))
                .thenThrow(new RuntimeException("store down"));

        ApiResponse response = router.route("GET", "/api/v1/pool/me", AUTH, null);

        assertEquals(500, response.getStatusCode());
        assertTrue(response.getBody().contains("store down"));
    }

    @Test
    void testIsRestPath() {
        assertTrue(RestRouter.isRestPath("/api/v1/pool/me"));
        assertFalse(RestRouter.isRestPath("/api/v1/wallet"));
        assertFalse(RestRouter.isRestPath(null));
    }
}
