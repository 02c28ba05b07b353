package com.isolend.api.dto.response;

import java.math.BigInteger;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/** Snapshot of a superpool for display. {@code sharePrice} is the value of 1e18 shares. */
@Value
@Builder
public class SuperPoolResponse {

    String address;
    String name;
    String symbol;
    String asset;
    String owner;
    String feeRecipient;
    BigInteger fee;
    BigInteger superPoolCap;
    BigInteger totalAssets;
    BigInteger totalSupply;
    BigInteger sharePrice;
    boolean paused;
    List<String> depositQueue;
    List<String> withdrawQueue;
}
