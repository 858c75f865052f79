package com.marginengine.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionStatus;
import com.marginengine.domain.model.MarginPosition;
import com.marginengine.domain.model.MarkPrice;
import com.marginengine.event.EventPublisherHelper;
import com.marginengine.event.MarkPriceEvent;
import com.marginengine.event.PositionEvent;
import com.marginengine.event.PositionEventType;
import com.marginengine.observability.MarginMetricsService;
import com.marginengine.position.PositionTable;
import com.marginengine.pricefeed.PriceFeedAdapter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MarginMetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private PositionTable positionTable;
    private PriceFeedAdapter priceFeedAdapter;
    private MarginMetricsService marginMetricsService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        positionTable = new PositionTable();
        priceFeedAdapter = new PriceFeedAdapter(mock(EventPublisherHelper.class));
        marginMetricsService = new MarginMetricsService(meterRegistry, positionTable, priceFeedAdapter);
    }

    private MarginPosition position(String id, PositionStatus status) {
        return MarginPosition.builder()
                .id(id)
                .owner("alice")
                .pair("ETH/USDT")
                .marginMode(MarginMode.ISOLATED)
                .status(status)
                .openedAt(LocalDateTime.now())
                .build();
    }

    @Test
    void countsOnlyLiquidatedPositionEvents() {
        marginMetricsService.onPositionEvent(
                new PositionEvent(this, position("p-1", PositionStatus.LIQUIDATED), PositionEventType.LIQUIDATED));
        marginMetricsService.onPositionEvent(
                new PositionEvent(this, position("p-2", PositionStatus.CLOSED), PositionEventType.CLOSED));

        assertThat(meterRegistry.get("margin.liquidations").counter().count()).isEqualTo(1.0);
    }

    @Test
    void directCountersIncrement() {
        marginMetricsService.recordTriggerClose();
        marginMetricsService.recordVersionConflict();
        marginMetricsService.recordVersionConflict();

        assertThat(meterRegistry.get("margin.trigger.closes").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("margin.version.conflicts").counter().count()).isEqualTo(2.0);
    }

    @Test
    void gaugesTrackTableAndFeed() {
        positionTable.insert(position("p-1", PositionStatus.OPEN));
        positionTable.insert(position("p-2", PositionStatus.CLOSED));
        Instant t0 = Instant.parse("2026-01-05T10:00:00Z");
        priceFeedAdapter.onTick("ETH/USDT", new BigDecimal("2000"), t0);
        priceFeedAdapter.onTick("ETH/USDT", new BigDecimal("2000"), t0);

        assertThat(meterRegistry.get("margin.positions.open").gauge().value()).isEqualTo(1.0);
        assertThat(meterRegistry.get("margin.ticks.stale").functionCounter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsTickLatency() {
        marginMetricsService.onMarkPrice(new MarkPriceEvent(
                this, new MarkPrice("ETH/USDT", new BigDecimal("2000"), Instant.parse("2026-01-05T10:00:00Z"))));

        assertThat(meterRegistry.get("margin.tick.latency").timer().count()).isEqualTo(1);
    }
}
