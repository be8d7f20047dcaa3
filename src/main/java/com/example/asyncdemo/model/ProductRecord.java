package com.example.asyncdemo.model;

import java.math.BigDecimal;

/**
 * Product as returned by the simulated storage lookup.
 */
public record ProductRecord(
    int id,
    String name,
    BigDecimal price
) {
    public static final BigDecimal LIST_PRICE = new BigDecimal("49.99");

    public static ProductRecord of(int id) {
        return new ProductRecord(id, "Product " + id, LIST_PRICE);
    }
}
