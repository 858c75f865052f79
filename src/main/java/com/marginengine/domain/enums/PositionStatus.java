package com.marginengine.domain.enums;

/**
 * Lifecycle state of a margin position. CLOSED and LIQUIDATED are terminal.
 */
public enum PositionStatus {
    OPEN,
    CLOSED,
    LIQUIDATED;

    public boolean isTerminal() {
        return this != OPEN;
    }
}
