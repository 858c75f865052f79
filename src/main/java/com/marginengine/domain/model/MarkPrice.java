package com.marginengine.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Canonical oracle tick: the mark price of one pair at one instant.
 * Passed by value into margin calculations; never shared as mutable state.
 */
public record MarkPrice(String symbol, BigDecimal price, Instant timestamp) {

    public MarkPrice {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean isNewerThan(MarkPrice other) {
        return other == null || timestamp.isAfter(other.timestamp);
    }
}
