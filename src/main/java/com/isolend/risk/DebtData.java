package com.isolend.risk;

import com.isolend.core.math.WadMath;
import java.math.BigInteger;

/**
 * Debt to repay in one pool during a liquidation. {@link #MAX} as the amount repays everything
 * the position owes the pool.
 */
public record DebtData(String poolId, BigInteger amount) {

    public static final BigInteger MAX = WadMath.MAX_UINT256;

    public boolean isMax() {
        return MAX.equals(amount);
    }
}
