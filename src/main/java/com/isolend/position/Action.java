package com.isolend.position;

import java.math.BigInteger;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

/**
 * One command for the position manager: an {@link Operation} and the fields it reads.
 * Build instances with the static factories; fields an operation does not use stay null.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
public class Action {

    Operation op;

    /** NEW_POSITION: owner of the new position. */
    String owner;

    /** NEW_POSITION: 32-byte hex salt. */
    String salt;

    /** Token for DEPOSIT, WITHDRAW, ADD/REMOVE_COLLATERAL_TYPE and APPROVE. */
    String asset;

    /** Market for BORROW and REPAY. */
    String poolId;

    /** WITHDRAW recipient, APPROVE spender or EXEC target. */
    String counterparty;

    BigInteger amount;

    /** EXEC: ABI-encoded calldata, selector first. */
    String data;

    public static Action newPosition(String owner, String salt) {
        return builder().op(Operation.NEW_POSITION).owner(owner).salt(salt).build();
    }

    public static Action deposit(String asset, BigInteger amount) {
        return builder().op(Operation.DEPOSIT).asset(asset).amount(amount).build();
    }

    public static Action withdraw(String recipient, String asset, BigInteger amount) {
        return builder().op(Operation.WITHDRAW).counterparty(recipient).asset(asset).amount(amount).build();
    }

    public static Action addToken(String asset) {
        return builder().op(Operation.ADD_COLLATERAL_TYPE).asset(asset).build();
    }

    public static Action removeToken(String asset) {
        return builder().op(Operation.REMOVE_COLLATERAL_TYPE).asset(asset).build();
    }

    public static Action borrow(String poolId, BigInteger amount) {
        return builder().op(Operation.BORROW).poolId(poolId).amount(amount).build();
    }

    /** Pass {@link com.isolend.risk.DebtData#MAX} to repay the whole debt. */
    public static Action repay(String poolId, BigInteger amount) {
        return builder().op(Operation.REPAY).poolId(poolId).amount(amount).build();
    }

    public static Action approve(String spender, String asset, BigInteger amount) {
        return builder().op(Operation.APPROVE).counterparty(spender).asset(asset).amount(amount).build();
    }

    public static Action exec(String target, String data) {
        return builder().op(Operation.EXEC).counterparty(target).data(data).build();
    }
}
