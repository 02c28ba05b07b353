package com.isolend.irm;

import java.math.BigInteger;

/**
 * Interest-rate curve: a pure function of pool utilization.
 */
public interface RateModel {

    /**
     * @param totalBorrowed assets currently lent out
     * @param totalIdle assets sitting idle in the pool
     * @return annual borrow rate, WAD-scaled
     */
    BigInteger rate(BigInteger totalBorrowed, BigInteger totalIdle);
}
