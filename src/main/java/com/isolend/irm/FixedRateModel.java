package com.isolend.irm;

import com.isolend.core.math.WadMath;
import java.math.BigInteger;

/** Constant annual rate regardless of utilization. */
public class FixedRateModel implements RateModel {

    private final BigInteger annualRate;

    public FixedRateModel(BigInteger annualRate) {
        this.annualRate = WadMath.requireUnsigned(annualRate);
    }

    @Override
    public BigInteger rate(BigInteger totalBorrowed, BigInteger totalIdle) {
        return annualRate;
    }
}
