package com.isolend.pool;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of one isolated market.
 *
 * <p>Holds two rebasing ledgers: deposits {@code (totalDepositShares, totalDepositAssets)} and
 * borrows {@code (totalBorrowShares, totalBorrowAssets)}. Interest grows both asset totals by the
 * same amount, so {@code totalBorrowAssets <= totalDepositAssets} always holds and the difference
 * is the idle liquidity the pool actually custodies.
 *
 * <p>Immutable; the ledger replaces the whole snapshot on every change so the journal can undo it.
 */
@Value
@Builder(toBuilder = true)
public class PoolData {

    String poolId;
    String owner;
    String asset;
    String rateModelKey;

    boolean paused;

    /** Max {@code totalDepositAssets}, checked on deposit only. */
    BigInteger depositCap;

    /** Max {@code totalBorrowAssets}, checked on borrow only. */
    BigInteger borrowCap;

    /** Share of accrued interest minted as deposit shares to the fee recipient (WAD). */
    BigInteger interestFee;

    /** Share of each borrow sent to the fee recipient up front (WAD). */
    BigInteger originationFee;

    /** Epoch second of the last accrual. */
    long lastUpdated;

    BigInteger totalDepositAssets;
    BigInteger totalDepositShares;
    BigInteger totalBorrowAssets;
    BigInteger totalBorrowShares;

    /** Assets not lent out. */
    public BigInteger getIdleLiquidity() {
        return totalDepositAssets.subtract(totalBorrowAssets);
    }
}
