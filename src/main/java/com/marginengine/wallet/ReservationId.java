package com.marginengine.wallet;

import java.util.Objects;

/**
 * Opaque handle to a collateral hold in the external wallet.
 */
public record ReservationId(String value) {

    public ReservationId {
        Objects.requireNonNull(value, "value");
    }

    @Override
    public String toString() {
        return value;
    }
}
