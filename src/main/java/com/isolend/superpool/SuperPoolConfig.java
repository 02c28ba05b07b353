package com.isolend.superpool;

import java.math.BigInteger;

/** Construction parameters of a superpool; addresses already normalized. */
record SuperPoolConfig(
        String address,
        String owner,
        String asset,
        String feeRecipient,
        BigInteger fee,
        BigInteger superPoolCap,
        String name,
        String symbol) {}
