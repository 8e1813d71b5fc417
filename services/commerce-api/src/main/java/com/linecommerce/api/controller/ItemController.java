package com.linecommerce.api.controller;

import com.linecommerce.api.dto.ItemCreateRequest;
import com.linecommerce.api.dto.ItemPageResponse;
import com.linecommerce.api.dto.ItemResponse;
import com.linecommerce.api.dto.ItemUpdateRequest;
import com.linecommerce.api.service.ItemService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.UUID;

/**
 * ItemController - CRUD endpoints for items.
 *
 * Reads are public; create, update and delete act on behalf of the
 * authenticated caller, who must own the item for update and delete.
 */
@RestController
@RequestMapping("/api/items")
@RequiredArgsConstructor
public class ItemController {

    private final ItemService itemService;

    @PostMapping
    public ResponseEntity<ItemResponse> create(@Valid @RequestBody ItemCreateRequest request, Principal principal) {
        ItemResponse item = itemService.createItem(request, callerId(principal));
        return ResponseEntity.status(HttpStatus.CREATED).body(item);
    }

    @GetMapping
    public ResponseEntity<ItemPageResponse> list(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "20") int perPage,
            @RequestParam(name = "user_id", required = false) UUID userId) {
        return ResponseEntity.ok(itemService.listItems(page, perPage, userId));
    }

    @GetMapping("/{itemId}")
    public ResponseEntity<ItemResponse> get(@PathVariable UUID itemId) {
        return ResponseEntity.ok(itemService.getItem(itemId));
    }

    @PutMapping("/{itemId}")
    public ResponseEntity<ItemResponse> update(@PathVariable UUID itemId,
                                               @Valid @RequestBody ItemUpdateRequest request,
                                               Principal principal) {
        return ResponseEntity.ok(itemService.updateItem(itemId, request, callerId(principal)));
    }

    @DeleteMapping("/{itemId}")
    public ResponseEntity<Void> delete(@PathVariable UUID itemId, Principal principal) {
        itemService.deleteItem(itemId, callerId(principal));
        return ResponseEntity.noContent().build();
    }

    private static UUID callerId(Principal principal) {
        return UUID.fromString(principal.getName());
    }
}
