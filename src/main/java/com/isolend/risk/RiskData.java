package com.isolend.risk;

import java.math.BigInteger;

/**
 * Valuation of a position in the reference unit.
 *
 * @param totalAssetValue debt-weighted value of all collateral
 * @param totalDebtValue value of all outstanding debt
 * @param minReqAssetValue collateral value the position must hold to stay healthy
 */
public record RiskData(BigInteger totalAssetValue, BigInteger totalDebtValue, BigInteger minReqAssetValue) {

    public static final RiskData ZERO = new RiskData(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
}
