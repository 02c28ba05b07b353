package com.isolend.event;

public enum PositionEventType {
    POSITION_DEPLOYED,
    DEPOSIT,
    WITHDRAW,
    ADD_COLLATERAL_TYPE,
    REMOVE_COLLATERAL_TYPE,
    BORROW,
    REPAY,
    APPROVE,
    EXEC,
    AUTH_TOGGLED,
    OWNERSHIP_TRANSFERRED,
    KNOWN_ASSET_TOGGLED,
    KNOWN_SPENDER_TOGGLED,
    KNOWN_FUNC_TOGGLED,
    LIQUIDATION_FEE_SET
}
