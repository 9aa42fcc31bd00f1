package com.ryuqq.directory.adapter.inmemory.auth;

import com.ryuqq.directory.adapter.inmemory.auth.InMemoryCredentialVerifier.Account;
import com.ryuqq.directory.core.auth.AuthAllowed;
import com.ryuqq.directory.core.auth.AuthCredential;
import com.ryuqq.directory.core.identity.Application;
import com.ryuqq.directory.core.identity.Group;
import com.ryuqq.directory.core.identity.UserAuthToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryCredentialVerifier}.
 *
 * @author Directory Team
 * @since 1.0.0
 */
class InMemoryCredentialVerifierTest {

    private InMemoryCredentialVerifier verifier;

    @BeforeEach
    void setUp() {
        verifier = new InMemoryCredentialVerifier();
        verifier.register(Account.anonymous("alice", "Alice", "u-alice"));
        verifier.register(Account.password("carol", "Carol", "u-carol", "s3cret")
            .withGroups(List.of(new Group("admins", "g-admins"))));
    }

    @Test
    void testRequiredMechanisms_UnknownOrLocked_Empty() {
        assertThat(verifier.requiredMechanisms("alice")).containsExactly(AuthAllowed.ANONYMOUS);
        assertThat(verifier.requiredMechanisms("mallory")).isEmpty();

        verifier.lock("alice");

        assertThat(verifier.requiredMechanisms("alice")).isEmpty();
    }

    @Test
    void testVerify_PasswordMatches() {
        assertThat(verifier.verify("carol", List.of(AuthCredential.password("s3cret")))).isTrue();
        assertThat(verifier.verify("carol", List.of(AuthCredential.password("wrong")))).isFalse();
    }

    @Test
    void testVerify_UnrequiredMechanismOrEmptyList_Rejected() {
        assertThat(verifier.verify("carol", List.of(AuthCredential.anonymous()))).isFalse();
        assertThat(verifier.verify("alice", List.of())).isFalse();
        assertThat(verifier.verify("nobody", List.of(AuthCredential.anonymous()))).isFalse();
    }

    @Test
    void testIssueToken_CarriesIdentityAndGroups() {
        UserAuthToken token = verifier.issueToken("carol", null).orElseThrow();

        assertThat(token.name()).isEqualTo("carol");
        assertThat(token.uuid()).isEqualTo("u-carol");
        assertThat(token.application()).isNull();
        assertThat(token.isMemberOf("admins")).isTrue();
    }

    @Test
    void testIssueToken_BindsRegisteredApplicationOnly() {
        Application portal = new Application("portal", "a-portal");
        verifier.registerApplication("portal", portal);

        assertThat(verifier.issueToken("alice", "portal").orElseThrow().application()).isEqualTo(portal);
        assertThat(verifier.issueToken("alice", "unknown")).isEmpty();
    }

    @Test
    void testAccount_PasswordMechanismWithoutPassword_Throws() {
        assertThatThrownBy(() -> Account.anonymous("bob", null, "u-bob")
                .withRequired(EnumSet.of(AuthAllowed.PASSWORD)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testAccount_ToStringHidesPassword() {
        assertThat(Account.password("carol", "Carol", "u-carol", "s3cret").toString()).doesNotContain("s3cret");
    }
}
