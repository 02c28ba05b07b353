package com.isolend.event;

public enum SuperPoolEventType {
    DEPLOYED,
    DEPOSIT,
    WITHDRAW,
    FEES_ACCRUED,
    POOL_ADDED,
    POOL_REMOVED,
    POOL_CAP_MODIFIED,
    QUEUE_REORDERED,
    REALLOCATED,
    ALLOCATOR_TOGGLED,
    SUPERPOOL_CAP_SET,
    PAUSE_TOGGLED,
    FEE_RECIPIENT_SET,
    FEE_UPDATE_REQUESTED,
    FEE_UPDATED,
    FEE_UPDATE_REJECTED
}
