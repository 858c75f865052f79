package com.marginengine.event;

/**
 * Classifies the state change that produced a {@link PositionEvent}.
 */
public enum PositionEventType {

    /** A new position was opened. */
    OPENED,

    /** Collateral was added or withdrawn. */
    COLLATERAL_ADJUSTED,

    /** Stop-loss or take-profit levels changed. */
    TRIGGERS_UPDATED,

    /** Part of the position was closed; it remains open. */
    REDUCED,

    /** The position was fully closed, manually or by a trigger. */
    CLOSED,

    /** The position was liquidated. */
    LIQUIDATED
}
