package com.isolend.event;

/**
 * Classifies a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A pool owner queued an LTV change behind the timelock. */
    LTV_UPDATE_REQUESTED,

    /** An LTV took effect, either immediately (first value) or after the timelock. */
    LTV_UPDATED,

    /** A pending LTV change was discarded. */
    LTV_UPDATE_REJECTED,

    /** Global LTV bounds changed. */
    LTV_BOUNDS_SET,

    /** An oracle binding took effect. */
    ORACLE_UPDATED,

    /** A pool owner queued an oracle change behind the timelock. */
    ORACLE_UPDATE_REQUESTED,

    /** A pending oracle change was discarded. */
    ORACLE_UPDATE_REJECTED,

    /** A batch left a position unhealthy and was reverted. */
    HEALTH_CHECK_FAILED,

    /** A position was partially or fully liquidated. */
    LIQUIDATION,

    /** A position's remaining debt was written off against depositors. */
    BAD_DEBT_LIQUIDATION
}
