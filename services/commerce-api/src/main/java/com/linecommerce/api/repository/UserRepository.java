package com.linecommerce.api.repository;

import com.linecommerce.api.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * UserRepository - Account store used by the authentication core.
 *
 * Spring Data JPA derives the queries from the method names. Every lookup
 * used for authentication is scoped to active accounts, so a deactivated
 * account is indistinguishable from one that never existed.
 *
 * Query Generation:
 * - findByEmailAndActiveTrue -> SELECT * FROM users WHERE email = ? AND is_active = true
 * - findByOauthProviderAndOauthIdAndActiveTrue -> ... WHERE oauth_provider = ? AND oauth_id = ? AND is_active = true
 * - findByIdAndActiveTrue -> ... WHERE id = ? AND is_active = true
 *
 * Writes go through {@code saveAndFlush} so that a UNIQUE constraint violation
 * (a concurrent registration or link for the same identity) surfaces as a
 * {@link org.springframework.dao.DataIntegrityViolationException} at the call
 * site rather than at commit time.
 *
 * @see User for entity definition
 * @see com.linecommerce.api.service.AccountResolver for the business logic using this repository
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Find an active account by its normalised email address.
     *
     * @param email normalised email (trimmed, lower-case)
     * @return the account, or empty if absent or deactivated
     */
    Optional<User> findByEmailAndActiveTrue(String email);

    /**
     * Find an active account by its federated identity.
     *
     * @param oauthProvider provider id, e.g. "google"
     * @param oauthId subject identifier issued by that provider
     * @return the account, or empty if absent or deactivated
     */
    Optional<User> findByOauthProviderAndOauthIdAndActiveTrue(String oauthProvider, String oauthId);

    /**
     * Find an active account by primary key. Used to confirm the subject of a
     * session token still exists.
     */
    Optional<User> findByIdAndActiveTrue(UUID id);
}
