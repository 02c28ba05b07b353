package com.isolend.superpool;

import java.math.BigInteger;

/** One leg of a reallocation: move {@code assets} out of or into {@code poolId}. */
public record ReallocateParams(String poolId, BigInteger assets) {}
