package com.marginengine.event;

/**
 * Classifies the risk condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A healthy position came within the warning distance of its liquidation price. */
    LIQUIDATION_WARNING,

    /** A position was liquidated. Uncovered shortfalls are raised at CRITICAL. */
    POSITION_LIQUIDATED,

    /**
     * A close lost more than the position's collateral. CRITICAL when nothing covered the
     * gap, WARNING when the owner's cross pool absorbed it.
     */
    COLLATERAL_SHORTFALL,

    /** An owner's aggregate cross-margin ratio breached maintenance. */
    CROSS_MARGIN_LIQUIDATION,

    /** An open position could not be evaluated and was withdrawn from monitoring. */
    COMPUTATION_INVALID
}
