package com.isolend.risk;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of a successful liquidation check.
 *
 * @param debts repayments with {@link DebtData#MAX} resolved to the owed amount
 * @param repaidValue value of the repayments
 * @param seizedValue debt-weighted value of the seized collateral
 * @param badDebt whether the position's collateral is worth less than its debt
 * @param healthFactor health factor before the liquidation
 */
public record LiquidationAssessment(
        List<DebtData> debts, BigInteger repaidValue, BigInteger seizedValue, boolean badDebt, BigInteger healthFactor) {}
