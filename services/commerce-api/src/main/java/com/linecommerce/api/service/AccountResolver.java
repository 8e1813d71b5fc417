package com.linecommerce.api.service;

import com.linecommerce.api.entity.User;
import com.linecommerce.api.exception.AuthErrorKind;
import com.linecommerce.api.exception.AuthException;
import com.linecommerce.api.repository.UserRepository;
import com.linecommerce.api.security.oauth.OAuthUserInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * AccountResolver - Maps identity claims onto account records.
 *
 * This is the only component that creates or mutates {@link User} rows on
 * behalf of the authentication flows. It works exclusively on active accounts:
 * a deactivated account is never returned, linked or reused.
 *
 * OAuth resolution order:
 * 1. Match by (provider, provider id): the identity is already linked, return it unchanged
 * 2. Match by email: link the identity to the existing account and backfill empty profile fields
 * 3. No match: create a new OAuth-only account
 *
 * Matching on the provider id first means a provider that later reports a
 * different email still lands on the same account, and an email is only used
 * for linking when no account holds the federated identity yet.
 *
 * Updates are explicit: the current row is fetched, a new value is derived
 * with {@code toBuilder()}, and the result is persisted with
 * {@code saveAndFlush}. Uniqueness is enforced by the database; a concurrent
 * writer that loses the race gets a
 * {@link org.springframework.dao.DataIntegrityViolationException} from this
 * class, which the orchestrator maps to an outward error.
 *
 * @see AuthService for the flows built on top of this resolver
 * @see UserRepository for the account store
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountResolver {

    private final UserRepository userRepository;

    /**
     * Normalise an email for storage and lookup.
     */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Active-account lookup by email. Used by password login and the
     * registration uniqueness check.
     *
     * @param email email as entered, normalised before lookup
     * @return the account, or empty if absent or deactivated
     */
    @Transactional(readOnly = true)
    public Optional<User> findActiveByEmail(String email) {
        if (email == null || email.isBlank()) {
            return Optional.empty();
        }
        return userRepository.findByEmailAndActiveTrue(normalizeEmail(email));
    }

    /**
     * Active-account lookup by id. Used to confirm the subject of a session token.
     */
    @Transactional(readOnly = true)
    public Optional<User> findActiveById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        return userRepository.findByIdAndActiveTrue(id);
    }

    /**
     * Create a password-based account.
     *
     * Any active account with the same email blocks creation, including an
     * OAuth-only account: registering must never attach a password to an
     * account someone else signed up for.
     *
     * @param email email as entered
     * @param passwordHash credential produced by the password hasher
     * @param displayName optional display name
     * @return the persisted account
     * @throws AuthException DUPLICATE_ACCOUNT when the email is already taken
     */
    @Transactional
    public User createPasswordAccount(String email, String passwordHash, String displayName) {
        String normalised = normalizeEmail(email);
        if (userRepository.findByEmailAndActiveTrue(normalised).isPresent()) {
            throw new AuthException(AuthErrorKind.DUPLICATE_ACCOUNT);
        }
        if (passwordHash == null || passwordHash.isEmpty()) {
            throw new IllegalArgumentException("A password account needs a credential");
        }

        User user = User.builder()
                .email(normalised)
                .passwordHash(passwordHash)
                .displayName(displayName)
                .active(true)
                .build();

        User saved = userRepository.saveAndFlush(user);
        log.info("Created password account {}", saved.getId());
        return saved;
    }

    /**
     * Find, link or create the account for a federated identity.
     *
     * @param identity the identity reported by the provider; must carry an id and an email
     * @return the resolved account
     */
    @Transactional
    public User resolveOAuthIdentity(OAuthUserInfo identity) {
        return resolveOAuthIdentity(
                identity.getEmail(),
                identity.getProvider().getId(),
                identity.getId(),
                identity.getName(),
                identity.getImageUrl());
    }

    /**
     * Find, link or create the account for a federated identity.
     *
     * @param email email reported by the provider
     * @param provider provider id, e.g. "google"
     * @param providerId subject identifier issued by the provider
     * @param displayName optional name from the provider profile
     * @param avatarUrl optional picture URL from the provider profile
     * @return the resolved account
     */
    @Transactional
    public User resolveOAuthIdentity(String email, String provider, String providerId,
                                     String displayName, String avatarUrl) {
        if (provider == null || provider.isBlank() || providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("Federated identity needs a provider and a provider id");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Federated identity needs an email");
        }

        Optional<User> linked = userRepository.findByOauthProviderAndOauthIdAndActiveTrue(provider, providerId);
        if (linked.isPresent()) {
            log.debug("Federated identity {} already linked to account {}", provider, linked.get().getId());
            return linked.get();
        }

        String normalised = normalizeEmail(email);
        Optional<User> byEmail = userRepository.findByEmailAndActiveTrue(normalised);
        if (byEmail.isPresent()) {
            User existing = byEmail.get();
            User updated = existing.toBuilder()
                    .oauthProvider(provider)
                    .oauthId(providerId)
                    .displayName(isEmpty(existing.getDisplayName()) && !isEmpty(displayName)
                            ? displayName : existing.getDisplayName())
                    .avatarUrl(isEmpty(existing.getAvatarUrl()) && !isEmpty(avatarUrl)
                            ? avatarUrl : existing.getAvatarUrl())
                    .build();

            User saved = userRepository.saveAndFlush(updated);
            log.info("Linked {} identity to existing account {}", provider, saved.getId());
            return saved;
        }

        User created = userRepository.saveAndFlush(User.builder()
                .email(normalised)
                .oauthProvider(provider)
                .oauthId(providerId)
                .displayName(displayName)
                .avatarUrl(avatarUrl)
                .active(true)
                .build());
        log.info("Created {} account {}", provider, created.getId());
        return created;
    }

    /**
     * Soft-delete an account. The row is kept with is_active = false.
     *
     * @return true if an active account was deactivated, false if none was found
     */
    @Transactional
    public boolean deactivate(UUID id) {
        Optional<User> current = findActiveById(id);
        if (current.isEmpty()) {
            return false;
        }
        userRepository.saveAndFlush(current.get().toBuilder().active(false).build());
        log.info("Deactivated account {}", id);
        return true;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
