package com.linecommerce.api.service;

import com.linecommerce.api.dto.ItemCreateRequest;
import com.linecommerce.api.dto.ItemPageResponse;
import com.linecommerce.api.dto.ItemResponse;
import com.linecommerce.api.dto.ItemUpdateRequest;
import com.linecommerce.api.entity.Item;
import com.linecommerce.api.exception.ItemNotFoundException;
import com.linecommerce.api.repository.ItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * ItemService - Ownership-scoped item management.
 *
 * Reads are public. Writes require the caller to own the item; an item that
 * exists but belongs to someone else is reported exactly like a missing one.
 *
 * Listing is paged newest first. Out-of-range paging parameters are clamped
 * rather than rejected: page below 1 becomes 1, a page size outside 1-100
 * becomes the default of 20.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ItemService {

    static final int DEFAULT_PAGE_SIZE = 20;

    static final int MAX_PAGE_SIZE = 100;

    private final ItemRepository itemRepository;

    @Transactional
    public ItemResponse createItem(ItemCreateRequest request, UUID ownerId) {
        Item item = itemRepository.saveAndFlush(Item.builder()
                .name(request.getName())
                .description(request.getDescription())
                .price(request.getPrice())
                .userId(ownerId)
                .build());
        log.info("Created item {} for user {}", item.getId(), ownerId);
        return ItemResponse.from(item);
    }

    @Transactional(readOnly = true)
    public ItemResponse getItem(UUID itemId) {
        return itemRepository.findById(itemId)
                .map(ItemResponse::from)
                .orElseThrow(() -> new ItemNotFoundException(itemId, "Item not found"));
    }

    /**
     * List items, optionally only those of one owner.
     *
     * @param page 1-based page number
     * @param perPage page size
     * @param ownerId owner filter, or null for all items
     */
    @Transactional(readOnly = true)
    public ItemPageResponse listItems(int page, int perPage, UUID ownerId) {
        int safePage = Math.max(page, 1);
        int safePerPage = perPage < 1 || perPage > MAX_PAGE_SIZE ? DEFAULT_PAGE_SIZE : perPage;

        PageRequest request = PageRequest.of(safePage - 1, safePerPage, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<Item> result = ownerId != null
                ? itemRepository.findByUserId(ownerId, request)
                : itemRepository.findAll(request);

        return ItemPageResponse.builder()
                .items(result.map(ItemResponse::from).getContent())
                .total(result.getTotalElements())
                .page(safePage)
                .perPage(safePerPage)
                .hasNext(result.hasNext())
                .hasPrev(safePage > 1)
                .build();
    }

    /**
     * Apply the non-null fields of the request to an item owned by the caller.
     */
    @Transactional
    public ItemResponse updateItem(UUID itemId, ItemUpdateRequest request, UUID callerId) {
        Item current = ownedItem(itemId, callerId, "update");

        Item updated = current.toBuilder()
                .name(request.getName() != null ? request.getName() : current.getName())
                .description(request.getDescription() != null ? request.getDescription() : current.getDescription())
                .price(request.getPrice() != null ? request.getPrice() : current.getPrice())
                .build();

        return ItemResponse.from(itemRepository.saveAndFlush(updated));
    }

    @Transactional
    public void deleteItem(UUID itemId, UUID callerId) {
        Item current = ownedItem(itemId, callerId, "delete");
        itemRepository.delete(current);
        log.info("Deleted item {} for user {}", itemId, callerId);
    }

    private Item ownedItem(UUID itemId, UUID callerId, String action) {
        return itemRepository.findById(itemId)
                .filter(item -> item.getUserId().equals(callerId))
                .orElseThrow(() -> new ItemNotFoundException(itemId,
                        "Item not found or you don't have permission to " + action + " it"));
    }
}
