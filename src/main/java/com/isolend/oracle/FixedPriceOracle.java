package com.isolend.oracle;

import com.isolend.core.math.WadMath;
import com.isolend.exception.ValuationException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Oracle with an operator-pushed price (WAD reference units per whole token of 18 decimals).
 *
 * <p>With a non-null {@code maxAge}, a price older than that age is refused with
 * {@link ValuationException.Reason#STALE_PRICE}, the way a heartbeat-checked feed behaves.
 */
public class FixedPriceOracle implements PriceOracle {

    private final Clock clock;
    private final Duration maxAge;
    private BigInteger price;
    private Instant updatedAt;

    public FixedPriceOracle(Clock clock, BigInteger price, Duration maxAge) {
        this.clock = clock;
        this.maxAge = maxAge;
        setPrice(price);
    }

    /** Price that never goes stale. */
    public static FixedPriceOracle of(Clock clock, BigInteger price) {
        return new FixedPriceOracle(clock, price, null);
    }

    public void setPrice(BigInteger price) {
        this.price = WadMath.requireUnsigned(price);
        this.updatedAt = clock.instant();
    }

    public BigInteger getPrice() {
        return price;
    }

    @Override
    public BigInteger valueInReferenceUnit(String asset, BigInteger amount) {
        if (maxAge != null && clock.instant().isAfter(updatedAt.plus(maxAge))) {
            throw new ValuationException(
                    ValuationException.Reason.STALE_PRICE,
                    "Price for " + asset + " last updated at " + updatedAt + " exceeds max age " + maxAge,
                    Map.of("asset", asset, "updatedAt", updatedAt.toString()));
        }
        return WadMath.mulWad(amount, price);
    }
}
