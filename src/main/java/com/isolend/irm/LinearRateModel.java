package com.isolend.irm;

import com.isolend.core.math.WadMath;
import java.math.BigInteger;

/**
 * {@code rate = minRate + (maxRate - minRate) * utilization}, with
 * {@code utilization = borrowed / (borrowed + idle)}.
 */
public class LinearRateModel implements RateModel {

    private final BigInteger minRate;
    private final BigInteger rateDiff;

    public LinearRateModel(BigInteger minRate, BigInteger maxRate) {
        if (maxRate.compareTo(minRate) < 0) {
            throw new IllegalArgumentException("maxRate " + maxRate + " below minRate " + minRate);
        }
        this.minRate = WadMath.requireUnsigned(minRate);
        this.rateDiff = maxRate.subtract(minRate);
    }

    @Override
    public BigInteger rate(BigInteger totalBorrowed, BigInteger totalIdle) {
        BigInteger total = totalBorrowed.add(totalIdle);
        if (total.signum() == 0) {
            return minRate;
        }
        BigInteger utilization = WadMath.divWad(totalBorrowed, total);
        return minRate.add(WadMath.mulWad(rateDiff, utilization));
    }
}
