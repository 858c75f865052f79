package com.marginengine.event;

import com.marginengine.domain.model.MarginPosition;
import org.springframework.context.ApplicationEvent;

/**
 * Published after a position mutation has been committed. The carried position is the
 * committed snapshot, so listeners never observe a state that was later rolled back.
 */
public class PositionEvent extends ApplicationEvent {

    private final MarginPosition position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, MarginPosition position, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.eventType = eventType;
    }

    public MarginPosition getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
