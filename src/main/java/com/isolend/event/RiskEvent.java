package com.isolend.event;

import java.util.Map;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Risk-relevant change from the RiskEngine or PositionManager: LTV and oracle governance, a batch
 * rejected by the health check, a liquidation or a bad-debt write-off.
 *
 * <p>{@code details} is keyed per type, e.g. {@code poolId}, {@code asset} and {@code ltv} for
 * LTV updates, {@code position}, {@code liquidator} and {@code repaidValue} for liquidations.
 */
@Getter
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        this(source, eventType, level, message, Map.of());
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
