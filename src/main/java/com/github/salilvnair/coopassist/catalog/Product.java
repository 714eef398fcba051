package com.github.salilvnair.coopassist.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * Immutable catalog row. Bound from {@code coopassist.data.products} through its all-args constructor.
 */
@Getter
@ToString
@EqualsAndHashCode
@Builder(toBuilder = true)
@AllArgsConstructor
public class Product {
    private final String key;
    private final String name;
    private final String specification;
    private final BigDecimal price;
    private final String unit;
    private final String category;
    @Builder.Default
    private final List<String> keywords = List.of();
    private final String description;
    private final boolean seasonal;
    private final boolean popular;
}
