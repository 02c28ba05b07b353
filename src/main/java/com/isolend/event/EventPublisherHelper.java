package com.isolend.event;

import com.isolend.core.journal.StateJournal;
import java.math.BigInteger;
import java.util.Map;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods for all protocol events.
 *
 * <p>Events raised inside a protocol call are parked in the {@link StateJournal} and only reach
 * listeners when the outermost call commits; a reverted call publishes nothing. Outside a call
 * (startup wiring, tests) events go straight to the {@link ApplicationEventPublisher}.
 * {@link #publishRejection} bypasses the journal because it reports the revert itself.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;
    private final StateJournal stateJournal;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher, StateJournal stateJournal) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.stateJournal = stateJournal;
    }

    // ---- Pool ----

    public void publishPool(
            Object source, PoolEventType type, String poolId, String account, BigInteger assets, BigInteger shares) {
        publish(new PoolEvent(source, type, poolId, account, assets, shares));
    }

    public void publishPoolConfig(Object source, PoolEventType type, String poolId) {
        publish(new PoolEvent(source, type, poolId, null, null, null));
    }

    // ---- Position ----

    public void publishPosition(
            Object source, PositionEventType type, String position, String caller, Map<String, Object> details) {
        publish(new PositionEvent(source, type, position, caller, details));
    }

    // ---- Risk ----

    public void publishRisk(
            Object source, RiskEventType type, RiskLevel level, String message, Map<String, Object> details) {
        publish(new RiskEvent(source, type, level, message, details));
    }

    public void publishRejection(Object source, RiskEventType type, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, type, RiskLevel.WARNING, message, details));
    }

    // ---- SuperPool ----

    public void publishSuperPool(
            Object source,
            SuperPoolEventType type,
            String superPool,
            String account,
            BigInteger assets,
            BigInteger shares) {
        publish(new SuperPoolEvent(source, type, superPool, account, assets, shares));
    }

    private void publish(ApplicationEvent event) {
        if (!stateJournal.defer(event)) {
            applicationEventPublisher.publishEvent(event);
        }
    }
}
