package com.linecommerce.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial update of an item. Fields left null keep their current value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemUpdateRequest {

    @Size(min = 1, max = 255)
    private String name;

    private String description;

    @DecimalMin("0")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal price;
}
