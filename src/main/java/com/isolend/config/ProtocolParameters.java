package com.isolend.config;

import java.math.BigInteger;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/**
 * Deployment-time protocol configuration.
 *
 * <p>Fractions (fees, LTV bounds, close factor, discounts) are WAD-scaled: {@code 1e18 == 100%}.
 * Values that governance may change later (fee defaults, LTV bounds, minimums, liquidation fee)
 * are only the starting point; the owning service keeps the live value in journaled state.
 */
@Value
@Builder(toBuilder = true)
public class ProtocolParameters {

    // ==================== Roles ====================

    /** Protocol owner: allow-lists, fee settings, LTV bounds, bad-debt liquidation. */
    String protocolOwner;

    /** Receives interest fees, origination fees and liquidation fees. */
    String feeRecipient;

    /** Address the pool ledger holds tokens under. */
    String poolAddress;

    /** Address of the position manager; the only caller allowed to borrow and repay. */
    String positionManagerAddress;

    /** Deployer address used when deriving superpool addresses. */
    String superPoolFactoryAddress;

    // ==================== Pool ====================

    BigInteger defaultInterestFee;
    BigInteger defaultOriginationFee;

    /** Smallest single borrow. */
    BigInteger minBorrow;

    /** Debt left after a borrow or repay must be zero or at least this. */
    BigInteger minDebt;

    /** Deposit required to open a market; its shares are locked at the dead address. */
    BigInteger minInitialDeposit;

    // ==================== Risk ====================

    BigInteger minLtv;
    BigInteger maxLtv;

    /** Max fraction of one pool's debt a single liquidation may repay. */
    BigInteger closeFactor;

    /** Bonus a liquidator may seize on top of the repaid value. */
    BigInteger liquidationDiscount;

    /** Share of seized collateral routed to the fee recipient. */
    BigInteger liquidationFee;

    /** Minimum delay between requesting and accepting a governed change. */
    Duration timelockDuration;

    /** Window after the timelock in which a pending change may still be accepted. */
    Duration timelockDeadline;

    // ==================== Positions ====================

    int maxPositionAssets;
    int maxPositionDebtPools;

    // ==================== SuperPool ====================

    int maxSuperPoolQueueLength;
    BigInteger minSuperPoolBurnedShares;
    BigInteger maxSuperPoolFee;
}
