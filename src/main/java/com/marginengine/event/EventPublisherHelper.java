package com.marginengine.event;

import com.marginengine.domain.model.MarginPosition;
import com.marginengine.domain.model.MarkPrice;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods around Spring's {@link ApplicationEventPublisher} for all
 * margin engine events.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Price ----

    public void publishMarkPrice(Object source, MarkPrice markPrice) {
        applicationEventPublisher.publishEvent(new MarkPriceEvent(source, markPrice));
    }

    // ---- Position ----

    public void publishPositionEvent(Object source, MarginPosition position, PositionEventType eventType) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position, eventType));
    }

    // ---- Risk ----

    public void publishRiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message));
    }

    public void publishRiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, eventType, level, message, details));
    }
}
