package com.isolend.event;

/**
 * Severity level for a {@link RiskEvent}.
 */
public enum RiskLevel {

    /** Informational: parameter changes, successful governance steps. */
    INFO,

    /** Warning: a call was rejected or a position was liquidated. */
    WARNING,

    /** Critical: depositors absorbed a loss. */
    CRITICAL
}
