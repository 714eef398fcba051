package com.github.salilvnair.coopassist.catalog;

import com.github.salilvnair.coopassist.engine.exception.CoopAssistErrorCode;
import com.github.salilvnair.coopassist.engine.exception.CoopAssistException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, insertion-ordered product table. Insertion order is the tie-break order for fuzzy matching.
 */
@Slf4j
public final class ProductCatalog {

    private final List<Product> products;
    private final Map<String, Product> byKey;

    public ProductCatalog(List<Product> source) {
        List<String> violations = new ArrayList<>();
        Map<String, Product> index = new LinkedHashMap<>();
        List<Product> copies = new ArrayList<>();
        int row = 0;
        for (Product product : source == null ? List.<Product>of() : source) {
            row++;
            if (product == null) {
                violations.add("row " + row + " is empty");
                continue;
            }
            if (isBlank(product.getName())) {
                violations.add("row " + row + " has no name");
                continue;
            }
            String key = isBlank(product.getKey()) ? product.getName().trim() : product.getKey().trim();
            if (index.containsKey(key)) {
                violations.add("row " + row + " duplicates key '" + key + "'");
                continue;
            }
            Product copy = copyOf(product, key);
            index.put(key, copy);
            copies.add(copy);
        }
        if (!violations.isEmpty()) {
            throw new CoopAssistException(
                    CoopAssistErrorCode.MALFORMED_CATALOG,
                    "Product catalog validation failed. Violations: " + String.join(" | ", violations));
        }
        this.products = Collections.unmodifiableList(copies);
        this.byKey = Collections.unmodifiableMap(index);
        log.info("Co-op Assist: product catalog loaded with {} products.", products.size());
    }

    public List<Product> products() {
        return products;
    }

    public Optional<Product> findByKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(key.trim()));
    }

    public List<Product> seasonal() {
        return products.stream().filter(Product::isSeasonal).toList();
    }

    public List<Product> popular() {
        return products.stream().filter(Product::isPopular).toList();
    }

    public List<Product> byCategory(String category) {
        if (category == null) {
            return List.of();
        }
        String wanted = category.trim().toLowerCase(Locale.ROOT);
        return products.stream()
                .filter(p -> p.getCategory() != null && p.getCategory().trim().toLowerCase(Locale.ROOT).equals(wanted))
                .toList();
    }

    public Map<String, List<Product>> groupedByCategory() {
        Map<String, List<Product>> grouped = new LinkedHashMap<>();
        for (Product product : products) {
            String category = isBlank(product.getCategory()) ? "其他" : product.getCategory().trim();
            grouped.computeIfAbsent(category, k -> new ArrayList<>()).add(product);
        }
        return grouped;
    }

    public boolean isEmpty() {
        return products.isEmpty();
    }

    public int size() {
        return products.size();
    }

    private static Product copyOf(Product product, String key) {
        List<String> keywords = product.getKeywords() == null
                ? List.of()
                : product.getKeywords().stream().filter(k -> !isBlank(k)).map(String::trim).toList();
        return product.toBuilder()
                .key(key)
                .name(product.getName().trim())
                .keywords(keywords)
                .build();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
