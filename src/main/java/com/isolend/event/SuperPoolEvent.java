package com.isolend.event;

import java.math.BigInteger;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

@Getter
public class SuperPoolEvent extends ApplicationEvent {

    private final SuperPoolEventType eventType;
    private final String superPool;
    private final String account;
    private final BigInteger assets;
    private final BigInteger shares;

    public SuperPoolEvent(
            Object source,
            SuperPoolEventType eventType,
            String superPool,
            String account,
            BigInteger assets,
            BigInteger shares) {
        super(source);
        this.eventType = eventType;
        this.superPool = superPool;
        this.account = account;
        this.assets = assets != null ? assets : BigInteger.ZERO;
        this.shares = shares != null ? shares : BigInteger.ZERO;
    }
}
