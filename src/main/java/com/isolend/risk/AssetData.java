package com.isolend.risk;

import java.math.BigInteger;

/** Collateral to seize from a position during a liquidation. */
public record AssetData(String asset, BigInteger amount) {}
