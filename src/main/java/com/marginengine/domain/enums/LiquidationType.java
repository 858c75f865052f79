package com.marginengine.domain.enums;

/**
 * Origin of a liquidation.
 */
public enum LiquidationType {

    /** Raised by the liquidation monitor after a maintenance-margin breach. */
    AUTO,

    /** Raised by an operator through the admin endpoint. */
    FORCED,

    /** Requested by the position owner. */
    MANUAL
}
