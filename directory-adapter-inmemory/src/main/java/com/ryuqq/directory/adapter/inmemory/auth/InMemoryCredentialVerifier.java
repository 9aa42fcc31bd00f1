package com.ryuqq.directory.adapter.inmemory.auth;

import com.ryuqq.directory.core.auth.AuthAllowed;
import com.ryuqq.directory.core.auth.AuthCredential;
import com.ryuqq.directory.core.identity.Application;
import com.ryuqq.directory.core.identity.Group;
import com.ryuqq.directory.core.identity.UserAuthToken;
import com.ryuqq.directory.core.spi.CredentialVerifier;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link CredentialVerifier} SPI.
 *
 * <p>Accounts are registered up front with the mechanisms they require. Passwords are
 * kept as given and compared in constant time; storing and hashing secrets is the
 * job of a real verifier.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryCredentialVerifier verifier = new InMemoryCredentialVerifier();
 * verifier.register(Account.anonymous("alice", "Alice", aliceUuid));
 * verifier.register(Account.password("carol", "Carol", carolUuid, "s3cret"));
 * </pre>
 *
 * @author Directory Team
 * @since 1.0.0
 */
public class InMemoryCredentialVerifier implements CredentialVerifier {

    /**
     * Principal name → account.
     */
    private final ConcurrentHashMap<String, Account> accounts;

    /**
     * Application id → application.
     */
    private final ConcurrentHashMap<String, Application> applications;

    public InMemoryCredentialVerifier() {
        this.accounts = new ConcurrentHashMap<>();
        this.applications = new ConcurrentHashMap<>();
    }

    /**
     * Registers or replaces an account.
     *
     * @param account the account
     * @throws IllegalArgumentException if account is null
     */
    public void register(Account account) {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        accounts.put(account.name(), account);
    }

    /**
     * Registers an application that sessions may be opened for.
     *
     * @param applicationId id sent in the Init step
     * @param application application placed in issued tokens
     */
    public void registerApplication(String applicationId, Application application) {
        if (applicationId == null || application == null) {
            throw new IllegalArgumentException("applicationId and application cannot be null");
        }
        applications.put(applicationId, application);
    }

    /**
     * Locks an account. Locked accounts require no mechanism and receive no token.
     *
     * @param name principal name
     */
    public void lock(String name) {
        accounts.computeIfPresent(name, (key, account) -> account.withLocked(true));
    }

    @Override
    public Set<AuthAllowed> requiredMechanisms(String principal) {
        Account account = accounts.get(principal);
        if (account == null || account.locked()) {
            return Set.of();
        }
        return account.required();
    }

    @Override
    public boolean verify(String principal, List<AuthCredential> credentials) {
        Account account = accounts.get(principal);
        if (account == null || account.locked() || credentials == null || credentials.isEmpty()) {
            return false;
        }
        for (AuthCredential credential : credentials) {
            if (!account.required().contains(credential.mechanism())) {
                return false;
            }
            if (credential instanceof AuthCredential.Password password && !account.passwordMatches(password.secret())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Optional<UserAuthToken> issueToken(String principal, String applicationId) {
        Account account = accounts.get(principal);
        if (account == null || account.locked()) {
            return Optional.empty();
        }

        Application application = null;
        if (applicationId != null) {
            application = applications.get(applicationId);
            if (application == null) {
                return Optional.empty();
            }
        }
        return Optional.of(new UserAuthToken(
                account.name(), account.displayName(), account.uuid(), application, account.groups(), List.of()));
    }

    /**
     * Clears all accounts and applications.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        accounts.clear();
        applications.clear();
    }

    /**
     * Registered account.
     *
     * @param name principal name
     * @param displayName display name
     * @param uuid principal UUID
     * @param required mechanisms the principal must satisfy
     * @param password password for the PASSWORD mechanism, null if not required
     * @param groups group memberships placed in issued tokens
     * @param locked whether the account is locked
     */
    public record Account(
            String name,
            String displayName,
            String uuid,
            Set<AuthAllowed> required,
            String password,
            List<Group> groups,
            boolean locked
    ) {

        public Account {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            if (uuid == null || uuid.isBlank()) {
                throw new IllegalArgumentException("uuid cannot be null or blank");
            }
            if (required == null || required.isEmpty()) {
                throw new IllegalArgumentException("required cannot be null or empty");
            }
            if (required.contains(AuthAllowed.PASSWORD) && password == null) {
                throw new IllegalArgumentException("password is required for the PASSWORD mechanism");
            }
            displayName = displayName == null ? name : displayName;
            required = Collections.unmodifiableSet(EnumSet.copyOf(required));
            groups = groups == null ? List.of() : List.copyOf(groups);
        }

        public static Account anonymous(String name, String displayName, String uuid) {
            return new Account(name, displayName, uuid, EnumSet.of(AuthAllowed.ANONYMOUS), null, List.of(), false);
        }

        public static Account password(String name, String displayName, String uuid, String password) {
            return new Account(name, displayName, uuid, EnumSet.of(AuthAllowed.PASSWORD), password, List.of(), false);
        }

        public Account withRequired(Set<AuthAllowed> mechanisms) {
            return new Account(name, displayName, uuid, mechanisms, password, groups, locked);
        }

        public Account withGroups(List<Group> memberships) {
            return new Account(name, displayName, uuid, required, password, memberships, locked);
        }

        public Account withLocked(boolean lockedFlag) {
            return new Account(name, displayName, uuid, required, password, groups, lockedFlag);
        }

        boolean passwordMatches(String candidate) {
            if (password == null || candidate == null) {
                return false;
            }
            return MessageDigest.isEqual(
                    password.getBytes(StandardCharsets.UTF_8),
                    candidate.getBytes(StandardCharsets.UTF_8));
        }

        @Override
        public String toString() {
            return "Account[name=" + name + ", uuid=" + uuid + ", required=" + required + ", locked=" + locked + "]";
        }
    }
}
