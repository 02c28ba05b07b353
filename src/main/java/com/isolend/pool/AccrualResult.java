package com.isolend.pool;

import java.math.BigInteger;

/**
 * Outcome of applying (or simulating) interest accrual to a pool.
 *
 * @param pool pool snapshot after accrual
 * @param interest assets added to both the borrow and deposit ledgers
 * @param feeShares deposit shares minted to the fee recipient
 */
public record AccrualResult(PoolData pool, BigInteger interest, BigInteger feeShares) {}
