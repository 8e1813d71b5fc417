package com.linecommerce.api.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Raised when an item does not exist, or exists but is not owned by the caller
 * of a write operation. Both cases produce the same 404.
 */
@Getter
public class ItemNotFoundException extends RuntimeException {

    private final UUID itemId;

    public ItemNotFoundException(UUID itemId, String message) {
        super(message);
        this.itemId = itemId;
    }
}
