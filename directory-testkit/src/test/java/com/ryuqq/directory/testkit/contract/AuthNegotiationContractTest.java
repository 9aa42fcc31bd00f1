package com.ryuqq.directory.testkit.contract;

import com.ryuqq.directory.core.auth.AuthAllowed;
import com.ryuqq.directory.core.auth.AuthCredential;
import com.ryuqq.directory.core.auth.AuthRequest;
import com.ryuqq.directory.core.auth.AuthResponse;
import com.ryuqq.directory.core.auth.AuthState;
import com.ryuqq.directory.core.contract.WhoamiResponse;
import com.ryuqq.directory.core.error.OperationError;
import com.ryuqq.directory.core.identity.Application;
import com.ryuqq.directory.core.statemachine.AuthPhase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for authentication negotiation.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Anonymous principal: Init → Continue([Anonymous]) → Success</li>
 *   <li>Unknown principal: Init → Denied immediately</li>
 *   <li>Wrong password and wrong mechanism: Denied with the same generic reason</li>
 *   <li>Successful session backs whoami</li>
 * </ul>
 *
 * @author Directory Team
 * @since 1.0.0
 */
class AuthNegotiationContractTest extends AbstractProtocolContractTest {

    private static final String ALICE_UUID = "00000000-0000-0000-0000-00000000a11c";
    private static final String CAROL_UUID = "00000000-0000-0000-0000-0000000ca201";

    @Test
    void testAnonymousPrincipal_InitThenAnonymousCreds_Succeeds() {
        // Given: alice requires only anonymous access
        registerAnonymous("alice", ALICE_UUID);

        // When: Init
        AuthResponse started = initSession("alice");

        // Then: server asks for anonymous
        assertEquals(new AuthState.Continue(List.of(AuthAllowed.ANONYMOUS)), started.state());

        // When: Creds([Anonymous])
        AuthResponse finished = submit(started, AuthCredential.anonymous());

        // Then: Success with alice's token on the same session
        assertSuccessFor("alice", finished);
        assertEquals(started.sessionId(), finished.sessionId());
        assertEquals(AuthPhase.SUCCESS, negotiator.currentPhase(started.sessionId()).orElseThrow());
    }

    @Test
    void testUnknownPrincipal_Init_DeniedImmediately() {
        // When: Init for a principal nobody registered
        AuthResponse response = initSession("bob");

        // Then: denied at once, and the session cannot advance
        assertDenied(response);
        assertErrorKind(OperationError.Kind.INVALID_SESSION_STATE,
                submitRaw(response, AuthCredential.anonymous()));
        assertEquals(AuthPhase.DENIED, negotiator.currentPhase(response.sessionId()).orElseThrow());
    }

    @Test
    void testDenials_DoNotRevealWhichCheckFailed() {
        // Given: carol requires a password
        registerPassword("carol", CAROL_UUID, "correct horse");

        // When: wrong password on one session, wrong mechanism on another, unknown principal on a third
        AuthResponse wrongPassword = submit(initSession("carol"), AuthCredential.password("battery staple"));
        AuthResponse wrongMechanism = submit(initSession("carol"), AuthCredential.anonymous());
        AuthResponse unknown = initSession("mallory");

        // Then: all three carry the identical generic reason
        assertDenied(wrongPassword);
        assertDenied(wrongMechanism);
        assertDenied(unknown);
        assertEquals(wrongPassword.state(), unknown.state());
    }

    @Test
    void testPasswordPrincipal_CorrectPassword_Succeeds() {
        // Given
        registerPassword("carol", CAROL_UUID, "correct horse");

        // When
        AuthResponse started = initSession("carol");
        AuthResponse finished = submit(started, AuthCredential.password("correct horse"));

        // Then
        assertEquals(new AuthState.Continue(List.of(AuthAllowed.PASSWORD)), started.state());
        assertSuccessFor("carol", finished);
    }

    @Test
    void testApplicationBinding_KnownApplication_TokenCarriesIt() {
        // Given
        registerAnonymous("alice", ALICE_UUID);
        verifier.registerApplication("mail", new Application("mail", "app-uuid-1"));

        // When
        AuthResponse started = expectOk(server.auth(AuthRequest.init("alice", "mail")));
        AuthResponse finished = submit(started, AuthCredential.anonymous());

        // Then
        AuthState.Success success = assertInstanceOf(AuthState.Success.class, finished.state());
        assertEquals(new Application("mail", "app-uuid-1"), success.token().application());
    }

    @Test
    void testApplicationBinding_UnknownApplication_Denied() {
        // Given
        registerAnonymous("alice", ALICE_UUID);

        // When
        AuthResponse started = expectOk(server.auth(AuthRequest.init("alice", "no-such-app")));
        AuthResponse finished = submit(started, AuthCredential.anonymous());

        // Then
        assertDenied(finished);
    }

    @Test
    void testWhoami_AfterSuccess_ReturnsOwnEntry() {
        // Given
        registerAnonymous("alice", ALICE_UUID);
        AuthResponse finished = submit(initSession("alice"), AuthCredential.anonymous());

        // When
        WhoamiResponse whoami = expectOk(server.whoami(finished.sessionId()));

        // Then
        assertEquals(List.of(ALICE_UUID), whoami.youare().getValues("uuid"));
        assertEquals("alice", whoami.uat().name());
    }

    @Test
    void testWhoami_WithoutSuccess_NotAuthenticated() {
        // Given: a session still waiting for credentials
        registerAnonymous("alice", ALICE_UUID);
        AuthResponse started = initSession("alice");

        // When/Then
        assertErrorKind(OperationError.Kind.NOT_AUTHENTICATED, server.whoami(started.sessionId()));
        assertErrorKind(OperationError.Kind.NOT_AUTHENTICATED, server.whoami(null));
    }
}
