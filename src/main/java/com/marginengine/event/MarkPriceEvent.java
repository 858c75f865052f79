package com.marginengine.event;

import com.marginengine.domain.model.MarkPrice;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the price feed adapter for every tick it accepts (newer than the last
 * accepted tick for the same symbol). Stale and duplicate ticks never produce an event.
 *
 * <p>The {@code receivedAt} field captures System.nanoTime() at acceptance so listeners
 * can measure tick-to-decision latency.
 */
public class MarkPriceEvent extends ApplicationEvent {

    private final MarkPrice markPrice;
    private final long receivedAt;

    public MarkPriceEvent(Object source, MarkPrice markPrice) {
        super(source);
        this.markPrice = markPrice;
        this.receivedAt = System.nanoTime();
    }

    public MarkPrice getMarkPrice() {
        return markPrice;
    }

    public long getReceivedAt() {
        return receivedAt;
    }
}
