package com.dynamiccapital.pool.services;

import com.dynamiccapital.pool.pojos.AuthContext;
import com.dynamiccapital.pool.pojos.BearerSession;
import com.dynamiccapital.pool.pojos.Profile;
import com.dynamiccapital.pool.pojos.RequestBody;
import com.dynamiccapital.pool.pojos.UserRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

public class ProfileResolverTest {

    @Mock
    private PrivatePoolStore mockStore;
    @Mock
    private IdentityProvider mockIdentityProvider;

    private ProfileResolver resolver;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        resolver = new ProfileResolver(mockStore, mockIdentityProvider);
    }

    private static RequestBody bodyWithInitData(String initData) {
        RequestBody body = new RequestBody();
        body.setInitData(initData);
        return body;
    }

    @Test
    void testBearerToken_resolvesProfileById() throws Exception {
        when(mockIdentityProvider.verifyBearerSession("tok")).thenReturn(new BearerSession("uid-1", null));
        when(mockStore.findProfileById("uid-1")).thenReturn(new Profile("uid-1", UserRole.USER, "555", "Ada"));

        AuthContext auth = resolver.resolveProfile(Map.of("authorization", "Bearer tok"), new RequestBody());

        assertNotNull(auth);
        assertEquals("uid-1", auth.profileId);
        assertEquals("555", auth.telegramId);
        verify(mockIdentityProvider, never()).verifySignedPayload(anyString());
    }

    @Test
    void testBearerToken_fallsBackToSessionTelegramClaim() throws Exception {
        when(mockIdentityProvider.verifyBearerSession("tok")).thenReturn(new BearerSession("uid-1", "777"));
        when(mockStore.findProfileById("uid-1")).thenReturn(new Profile("uid-1", UserRole.USER, null, null));

        AuthContext auth = resolver.resolveProfile(Map.of("Authorization", "Bearer tok"), null);

        assertEquals("777", auth.telegramId);
    }

    @Test
    void testBearerFailure_fallsThroughToInitData() throws Exception {
        when(mockIdentityProvider.verifyBearerSession("bad")).thenThrow(new RuntimeException("expired"));
        when(mockIdentityProvider.verifySignedPayload("signed")).thenReturn("42");
        when(mockStore.findProfileByTelegramId("42")).thenReturn(new Profile("p-42", UserRole.USER, null, null));

        AuthContext auth = resolver.resolveProfile(Map.of("AUTHORIZATION", "Bearer bad"), bodyWithInitData("signed"));

        assertNotNull(auth);
        assertEquals("p-42", auth.profileId);
        assertEquals("42", auth.telegramId);
    }

    @Test
    void testInitDataProviderThrows_returnsNull() throws Exception {
        when(mockIdentityProvider.verifySignedPayload("signed")).thenThrow(new IllegalStateException("boom"));

        assertNull(resolver.resolveProfile(Map.of(), bodyWithInitData("signed")));
    }

    @Test
    void testStoreFailure_isCaughtAndLogged() throws Exception {
        when(mockIdentityProvider.verifyBearerSession("tok")).thenReturn(new BearerSession("uid-1", null));
        when(mockStore.findProfileById("uid-1")).thenThrow(new StoreException("findProfileById", "unavailable"));

        assertNull(resolver.resolveProfile(Map.of("authorization", "Bearer tok"), new RequestBody()));
    }

    @Test
    void testUnknownProfile_returnsNull() throws Exception {
        when(mockIdentityProvider.verifySignedPayload("signed")).thenReturn("42");
        when(mockStore.findProfileByTelegramId("42")).thenReturn(null);

        assertNull(resolver.resolveProfile(null, bodyWithInitData("signed")));
    }

    @Test
    void testNoCredentials_returnsNull() throws Exception {
        assertNull(resolver.resolveProfile(Map.of("content-type", "application/json"), new RequestBody()));
        verifyNoInteractions(mockStore);
    }

    @Test
    void testRequireAdmin() {
        when(mockStore.findProfileById("admin")).thenReturn(new Profile("admin", UserRole.ADMIN, null, null));
        when(mockStore.findProfileById("user")).thenReturn(new Profile("user", UserRole.USER, null, null));
        when(mockStore.findProfileById("ghost")).thenReturn(null);

        assertTrue(resolver.requireAdmin("admin"));
        assertFalse(resolver.requireAdmin("user"));
        assertFalse(resolver.requireAdmin("ghost"));
        assertFalse(resolver.requireAdmin(null));
    }
}
