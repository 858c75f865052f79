package com.marginengine.domain.enums;

/**
 * How a position's collateral pool is scoped.
 *
 * <p>ISOLATED positions risk only their own collateral. CROSS positions of the same
 * owner share one pool, so they are evaluated (and liquidated) together.
 */
public enum MarginMode {
    ISOLATED,
    CROSS
}
