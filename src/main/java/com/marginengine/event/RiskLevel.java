package com.marginengine.event;

/**
 * Severity level for a {@link RiskEvent}.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
