package com.isolend.domain.enums;

/**
 * Direction to round a fixed-point division. Every call site picks the direction that favors
 * the protocol and existing share holders over the caller.
 */
public enum Rounding {

    /** Toward zero. */
    DOWN,

    /** Away from zero when there is a remainder. */
    UP
}
