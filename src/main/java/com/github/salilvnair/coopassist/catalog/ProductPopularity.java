package com.github.salilvnair.coopassist.catalog;

import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Live view counters per catalog key. The catalog's {@code popular} flag only seeds the ranking; counters decide.
 */
@Component
public class ProductPopularity {

    private final ConcurrentHashMap<String, AtomicLong> views = new ConcurrentHashMap<>();

    public long recordView(String productKey) {
        if (productKey == null) {
            return 0L;
        }
        return views.computeIfAbsent(productKey, k -> new AtomicLong()).incrementAndGet();
    }

    public long viewsOf(String productKey) {
        AtomicLong counter = productKey == null ? null : views.get(productKey);
        return counter == null ? 0L : counter.get();
    }

    /** Most viewed first, flagged-popular before unflagged on equal views; stable otherwise. */
    public List<Product> rank(List<Product> products) {
        return products.stream()
                .sorted(Comparator.comparingLong((Product p) -> viewsOf(p.getKey())).reversed()
                        .thenComparing(Product::isPopular, Comparator.reverseOrder()))
                .toList();
    }

    /** Flagged or viewed products, ranked. */
    public List<Product> popular(ProductCatalog catalog) {
        return rank(catalog.products().stream()
                .filter(p -> p.isPopular() || viewsOf(p.getKey()) > 0)
                .toList());
    }

    public Map<String, Long> snapshot() {
        return views.entrySet().stream().collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().get()));
    }
}
