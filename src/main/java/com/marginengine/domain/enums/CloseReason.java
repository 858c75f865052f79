package com.marginengine.domain.enums;

/**
 * Why a position (or part of it) was closed. STOP_LOSS and TAKE_PROFIT are only
 * issued by the liquidation monitor.
 */
public enum CloseReason {
    MANUAL,
    STOP_LOSS,
    TAKE_PROFIT
}
