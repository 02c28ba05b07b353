package com.isolend.api.dto.response;

import java.math.BigInteger;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionHealthResponse {

    String position;
    boolean healthy;
    BigInteger healthFactor;
}
