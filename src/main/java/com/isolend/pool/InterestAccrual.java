package com.isolend.pool;

import com.isolend.core.math.SharesMath;
import com.isolend.core.math.WadMath;
import com.isolend.domain.enums.Rounding;
import com.isolend.irm.RateModel;
import java.math.BigInteger;

/**
 * Pure interest accrual over a {@link PoolData} snapshot. Used for the real accrual and for
 * read-only previews, which must never write state.
 */
public final class InterestAccrual {

    private InterestAccrual() {}

    /**
     * Applies {@code interest = totalBorrow * rate * elapsed / YEAR} to both ledgers and prices
     * the interest fee in deposit shares at the pre-interest share price. A zero or negative
     * {@code elapsed} leaves the pool untouched.
     */
    public static AccrualResult simulate(PoolData pool, RateModel rateModel, long now) {
        long elapsed = now - pool.getLastUpdated();
        if (elapsed <= 0) {
            return new AccrualResult(pool, BigInteger.ZERO, BigInteger.ZERO);
        }

        BigInteger interest = BigInteger.ZERO;
        if (pool.getTotalBorrowAssets().signum() > 0) {
            BigInteger rate = rateModel.rate(pool.getTotalBorrowAssets(), pool.getIdleLiquidity());
            interest = WadMath.mulDiv(
                    pool.getTotalBorrowAssets(),
                    rate.multiply(BigInteger.valueOf(elapsed)),
                    WadMath.WAD.multiply(WadMath.SECONDS_PER_YEAR),
                    Rounding.DOWN);
        }

        BigInteger feeShares = BigInteger.ZERO;
        if (interest.signum() > 0 && pool.getInterestFee().signum() > 0) {
            BigInteger feeAssets = WadMath.mulWad(interest, pool.getInterestFee());
            feeShares = SharesMath.toShares(
                    feeAssets, pool.getTotalDepositAssets(), pool.getTotalDepositShares(), Rounding.DOWN);
        }

        PoolData accrued = pool.toBuilder()
                .totalBorrowAssets(pool.getTotalBorrowAssets().add(interest))
                .totalDepositAssets(pool.getTotalDepositAssets().add(interest))
                .totalDepositShares(pool.getTotalDepositShares().add(feeShares))
                .lastUpdated(now)
                .build();
        return new AccrualResult(accrued, interest, feeShares);
    }
}
