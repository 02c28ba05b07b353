package com.isolend.event;

import java.math.BigInteger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the pool ledger for every committed deposit, withdrawal, borrow, repayment,
 * accrual and configuration change. {@code assets} and {@code shares} are zero where the event
 * type has no amount.
 */
@Getter
public class PoolEvent extends ApplicationEvent {

    private final PoolEventType eventType;
    private final String poolId;
    private final String account;
    private final BigInteger assets;
    private final BigInteger shares;

    public PoolEvent(
            Object source,
            PoolEventType eventType,
            String poolId,
            String account,
            BigInteger assets,
            BigInteger shares) {
        super(source);
        this.eventType = eventType;
        this.poolId = poolId;
        this.account = account;
        this.assets = assets != null ? assets : BigInteger.ZERO;
        this.shares = shares != null ? shares : BigInteger.ZERO;
    }
}
