package com.linecommerce.api.repository;

import com.linecommerce.api.entity.Item;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

/**
 * ItemRepository - Data access for items.
 *
 * Paging and ordering are expressed through the {@link Pageable} argument;
 * {@code findAll(Pageable)} is inherited for the unfiltered listing.
 */
@Repository
public interface ItemRepository extends JpaRepository<Item, UUID> {

    /**
     * Items owned by a user, one page at a time.
     *
     * Query: SELECT * FROM items WHERE user_id = :userId ORDER BY ... LIMIT/OFFSET
     */
    Page<Item> findByUserId(UUID userId, Pageable pageable);
}
