package com.marginengine.domain.enums;

/**
 * Direction of a leveraged position. LONG profits when the mark price rises,
 * SHORT profits when it falls.
 */
public enum PositionSide {
    LONG,
    SHORT;

    /** +1 for LONG, -1 for SHORT. Multiplies the raw price move into PnL. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }
}
