package com.marginengine.observability;

import com.marginengine.event.MarkPriceEvent;
import com.marginengine.event.PositionEvent;
import com.marginengine.event.PositionEventType;
import com.marginengine.position.PositionTable;
import com.marginengine.pricefeed.PriceFeedAdapter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the margin engine.
 * <ul>
 *   <li><b>margin.liquidations</b> (counter): positions liquidated, from LIQUIDATED events</li>
 *   <li><b>margin.trigger.closes</b> (counter): stop-loss and take-profit closes</li>
 *   <li><b>margin.version.conflicts</b> (counter): commands rejected on a stale version</li>
 *   <li><b>margin.submissions.deferred</b> (counter): monitor submissions refused by a saturated
 *       worker pool and left for the next tick</li>
 *   <li><b>margin.ticks.stale</b> (function counter): duplicate or out-of-order ticks dropped</li>
 *   <li><b>margin.positions.open</b> (gauge): open positions in the ledger</li>
 *   <li><b>margin.tick.latency</b> (timer): tick acceptance to end of evaluation</li>
 * </ul>
 * Gauges and function counters are polled on scrape.
 */
@Service
public class MarginMetricsService {

    private final Counter liquidationCounter;
    private final Counter triggerCloseCounter;
    private final Counter versionConflictCounter;
    private final Counter deferredSubmissionCounter;
    private final Timer tickLatencyTimer;

    public MarginMetricsService(
            MeterRegistry meterRegistry, PositionTable positionTable, PriceFeedAdapter priceFeedAdapter) {
        this.liquidationCounter = Counter.builder("margin.liquidations")
                .description("Positions liquidated")
                .register(meterRegistry);

        this.triggerCloseCounter = Counter.builder("margin.trigger.closes")
                .description("Positions closed by stop-loss or take-profit")
                .register(meterRegistry);

        this.versionConflictCounter = Counter.builder("margin.version.conflicts")
                .description("Commands rejected because the expected version was stale")
                .register(meterRegistry);

        this.deferredSubmissionCounter = Counter.builder("margin.submissions.deferred")
                .description("Liquidation or trigger submissions refused by the saturated worker pool")
                .register(meterRegistry);

        this.tickLatencyTimer = Timer.builder("margin.tick.latency")
                .description("Latency from tick acceptance to end of position evaluation")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);

        FunctionCounter.builder("margin.ticks.stale", priceFeedAdapter, PriceFeedAdapter::getStaleTickCount)
                .description("Duplicate or out-of-order ticks dropped")
                .register(meterRegistry);

        Gauge.builder("margin.positions.open", positionTable, PositionTable::openCount)
                .description("Open positions")
                .register(meterRegistry);
    }

    /** Runs after the liquidation monitor (order 10) so latency covers the whole evaluation. */
    @EventListener
    @Order(20)
    public void onMarkPrice(MarkPriceEvent event) {
        tickLatencyTimer.record(System.nanoTime() - event.getReceivedAt(), TimeUnit.NANOSECONDS);
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        if (event.getEventType() == PositionEventType.LIQUIDATED) {
            liquidationCounter.increment();
        }
    }

    public void recordTriggerClose() {
        triggerCloseCounter.increment();
    }

    public void recordVersionConflict() {
        versionConflictCounter.increment();
    }

    public void recordDeferredSubmission() {
        deferredSubmissionCounter.increment();
    }
}
