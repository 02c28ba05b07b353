package com.isolend.event;

public enum PoolEventType {
    POOL_INITIALIZED,
    DEPOSIT,
    WITHDRAW,
    BORROW,
    REPAY,
    INTEREST_ACCRUED,
    BAD_DEBT_REBALANCED,
    SHARES_TRANSFERRED,
    POOL_CAP_SET,
    BORROW_CAP_SET,
    PAUSE_TOGGLED,
    FEES_SET,
    RATE_MODEL_UPDATE_REQUESTED,
    RATE_MODEL_UPDATED,
    RATE_MODEL_UPDATE_REJECTED
}
