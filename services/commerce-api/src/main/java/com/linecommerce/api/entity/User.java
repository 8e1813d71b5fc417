package com.linecommerce.api.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * User - JPA Entity representing a customer account of the LINE Commerce backend.
 *
 * This entity maps to the 'users' table and is the only record the
 * authentication core reads or writes. Items reference it as their owner.
 *
 * Table Schema:
 * - id: UUID primary key (generated at creation, immutable)
 * - email: Unique, normalised (trimmed, lower-case) login identifier
 * - password_hash: Argon2id PHC string, NULL for OAuth-only accounts
 * - oauth_provider / oauth_id: Federated identity, unique together
 * - display_name / avatar_url: Optional profile metadata
 * - is_active: false marks a soft-deleted account
 * - created_at / updated_at: Maintained by Hibernate
 *
 * Invariants:
 * - One account per email (database UNIQUE constraint)
 * - One account per (oauth_provider, oauth_id) pair (unique_oauth_account)
 * - At least one authentication method when created
 * - Inactive accounts are invisible to every authentication path
 *
 * Lifecycle:
 * - Created on registration or first OAuth login (via AccountResolver)
 * - Updated when an OAuth identity is linked or profile fields are backfilled
 * - Deactivated, never hard-deleted, by the authentication core
 *
 * Updates are made by deriving a new value with {@code toBuilder()} and
 * persisting it explicitly through {@link com.linecommerce.api.repository.UserRepository}.
 *
 * @see com.linecommerce.api.repository.UserRepository for database operations
 * @see com.linecommerce.api.service.AccountResolver for creation and linking logic
 */
@Entity
@Table(name = "users",
        uniqueConstraints = @UniqueConstraint(name = "unique_oauth_account", columnNames = {"oauth_provider", "oauth_id"}))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class User {

    /**
     * Unique identifier for the user. UUID rather than a sequence so that ids
     * carried in session tokens cannot be enumerated.
     */
    @Id
    @Column(name = "id", columnDefinition = "UUID")
    private UUID id;

    /**
     * Login identifier. Always stored normalised so the UNIQUE constraint is
     * effectively case-insensitive.
     */
    @Column(name = "email", unique = true, nullable = false, length = 255)
    private String email;

    /**
     * One-way password credential. Absent for accounts created through OAuth.
     * Never serialised into any response.
     */
    @ToString.Exclude
    @Column(name = "password_hash", length = 255)
    private String passwordHash;

    /**
     * Federated identity provider id: "google" or "apple".
     */
    @Column(name = "oauth_provider", length = 50)
    private String oauthProvider;

    /**
     * Subject identifier issued by the provider.
     */
    @Column(name = "oauth_id", length = 255)
    private String oauthId;

    @Column(name = "display_name", length = 255)
    private String displayName;

    @Column(name = "avatar_url", length = 500)
    private String avatarUrl;

    /**
     * Soft-delete flag. Repository lookups used for authentication only ever
     * return rows where this is true.
     */
    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    /**
     * Whether the account can sign in with a password.
     */
    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isEmpty();
    }

    /**
     * JPA lifecycle callback executed before INSERT.
     * Ensures a UUID is assigned when the builder did not set one.
     */
    @PrePersist
    public void prePersist() {
        if (id == null) {
            id = UUID.randomUUID();
        }
    }
}
