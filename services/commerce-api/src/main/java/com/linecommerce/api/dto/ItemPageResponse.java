package com.linecommerce.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of items.
 *
 * <pre>
 * {
 *   "items": [ ... ],
 *   "total": 42,
 *   "page": 2,
 *   "perPage": 20,
 *   "hasNext": true,
 *   "hasPrev": true
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ItemPageResponse {

    private List<ItemResponse> items;

    private long total;

    private int page;

    private int perPage;

    private boolean hasNext;

    private boolean hasPrev;
}
