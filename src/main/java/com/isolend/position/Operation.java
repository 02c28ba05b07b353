package com.isolend.position;

/** Closed set of actions the position manager can apply to a position. */
public enum Operation {
    NEW_POSITION,
    DEPOSIT,
    WITHDRAW,
    ADD_COLLATERAL_TYPE,
    REMOVE_COLLATERAL_TYPE,
    BORROW,
    REPAY,
    APPROVE,
    EXEC
}
