package com.isolend.event;

import java.util.HashMap;
import java.util.Map;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the PositionManager once per applied action of a committed batch.
 */
@Getter
public class PositionEvent extends ApplicationEvent {

    private final PositionEventType eventType;
    private final String position;
    private final String caller;
    private final Map<String, Object> details;

    public PositionEvent(
            Object source, PositionEventType eventType, String position, String caller, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.position = position;
        this.caller = caller;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }
}
