package com.isolend.oracle;

import java.math.BigInteger;

/**
 * Values an amount of an asset in the protocol's reference unit.
 *
 * <p>Implementations may fail (stale feed, sequencer down) with a
 * {@link com.isolend.exception.ValuationException}; callers propagate that failure and never
 * substitute a default price.
 */
public interface PriceOracle {

    BigInteger valueInReferenceUnit(String asset, BigInteger amount);
}
