package com.linecommerce.api.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ItemCreateRequest {

    @NotBlank
    @Size(min = 1, max = 255)
    private String name;

    private String description;

    @DecimalMin("0")
    @Digits(integer = 8, fraction = 2)
    private BigDecimal price;
}
