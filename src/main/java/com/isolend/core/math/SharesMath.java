package com.isolend.core.math;

import com.isolend.domain.enums.Rounding;
import java.math.BigInteger;

/**
 * Conversions between underlying amounts and rebasing shares.
 *
 * <p>A ledger is the pair {@code (totalShares, totalAssets)}; every holder's claim is
 * {@code shares * totalAssets / totalShares}. When the ledger is empty the conversion is 1:1.
 * A ledger with shares but no assets (wiped out by a bad-debt write-off) converts any amount to
 * zero shares, so nobody can buy into it at a price the existing holders would dilute.
 */
public final class SharesMath {

    private SharesMath() {}

    public static BigInteger toShares(
            BigInteger assets, BigInteger totalAssets, BigInteger totalShares, Rounding rounding) {
        if (totalShares.signum() == 0) {
            return assets;
        }
        if (totalAssets.signum() == 0) {
            return BigInteger.ZERO;
        }
        return WadMath.mulDiv(assets, totalShares, totalAssets, rounding);
    }

    public static BigInteger toAssets(
            BigInteger shares, BigInteger totalAssets, BigInteger totalShares, Rounding rounding) {
        if (totalShares.signum() == 0) {
            return shares;
        }
        return WadMath.mulDiv(shares, totalAssets, totalShares, rounding);
    }

    /**
     * Debt shares cleared by repaying {@code assets}, rounded down. Repaying exactly the holder's
     * debt ({@code heldShares} valued rounding up) clears {@code heldShares}, even where the
     * rounded-down conversion would come out above it.
     */
    public static BigInteger toRepaidShares(
            BigInteger assets, BigInteger heldShares, BigInteger totalAssets, BigInteger totalShares) {
        if (heldShares.signum() > 0 && assets.equals(toAssets(heldShares, totalAssets, totalShares, Rounding.UP))) {
            return heldShares;
        }
        return toShares(assets, totalAssets, totalShares, Rounding.DOWN);
    }

    /**
     * Share conversion with a virtual offset of one share and one asset. An empty vault then
     * prices the first deposit 1:1 and a donation cannot inflate the share price enough to
     * round a later depositor down to zero.
     */
    public static BigInteger toSharesWithOffset(
            BigInteger assets, BigInteger totalAssets, BigInteger totalShares, Rounding rounding) {
        return WadMath.mulDiv(assets, totalShares.add(BigInteger.ONE), totalAssets.add(BigInteger.ONE), rounding);
    }

    public static BigInteger toAssetsWithOffset(
            BigInteger shares, BigInteger totalAssets, BigInteger totalShares, Rounding rounding) {
        return WadMath.mulDiv(shares, totalAssets.add(BigInteger.ONE), totalShares.add(BigInteger.ONE), rounding);
    }
}
