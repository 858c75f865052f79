package com.marginengine.domain.enums;

import java.math.BigDecimal;

/**
 * Buckets the distance between the mark price and the liquidation price,
 * expressed as a percentage of the mark price.
 */
public enum RiskTier {
    CRITICAL,
    HIGH,
    MODERATE,
    SAFE;

    private static final BigDecimal CRITICAL_BELOW = new BigDecimal("15");
    private static final BigDecimal HIGH_BELOW = new BigDecimal("30");
    private static final BigDecimal MODERATE_BELOW = new BigDecimal("50");

    public static RiskTier fromDistancePercent(BigDecimal distancePercent) {
        if (distancePercent.compareTo(CRITICAL_BELOW) < 0) {
            return CRITICAL;
        }
        if (distancePercent.compareTo(HIGH_BELOW) < 0) {
            return HIGH;
        }
        if (distancePercent.compareTo(MODERATE_BELOW) < 0) {
            return MODERATE;
        }
        return SAFE;
    }
}
