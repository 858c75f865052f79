package com.marginengine.unit.liquidation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.marginengine.domain.enums.CloseReason;
import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import com.marginengine.domain.enums.PositionStatus;
import com.marginengine.domain.model.ClosureRecord;
import com.marginengine.domain.model.LiquidationRecord;
import com.marginengine.domain.model.MarginPosition;
import com.marginengine.event.EventPublisherHelper;
import com.marginengine.event.PositionEvent;
import com.marginengine.event.PositionEventType;
import com.marginengine.event.RiskEventType;
import com.marginengine.event.RiskLevel;
import com.marginengine.exception.VersionConflictException;
import com.marginengine.history.HistoryRecorder;
import com.marginengine.liquidation.LiquidationMonitor;
import com.marginengine.mapper.LeverageSettingMapper;
import com.marginengine.margin.MarginCalculator;
import com.marginengine.margin.MarginProperties;
import com.marginengine.observability.MarginMetricsService;
import com.marginengine.position.ExecutionCoordinator;
import com.marginengine.position.PositionLedger;
import com.marginengine.position.PositionTable;
import com.marginengine.position.command.LiquidatePositionCommand;
import com.marginengine.position.command.OpenPositionCommand;
import com.marginengine.pricefeed.PairRegistry;
import com.marginengine.pricefeed.PositionIndex;
import com.marginengine.pricefeed.PriceFeedAdapter;
import com.marginengine.repository.jpa.LeverageSettingJpaRepository;
import com.marginengine.settings.LeverageSettingService;
import com.marginengine.wallet.InMemoryCollateralWallet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tick-driven tests for LiquidationMonitor over a real ledger. Submissions run on the
 * calling thread so every assertion sees the committed outcome.
 */
@ExtendWith(MockitoExtension.class)
class LiquidationMonitorTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");

    @Mock
    private HistoryRecorder historyRecorder;

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private LeverageSettingJpaRepository leverageSettingJpaRepository;

    @Mock
    private LeverageSettingMapper leverageSettingMapper;

    private MarginProperties properties;
    private PositionTable positionTable;
    private PositionIndex positionIndex;
    private MarginCalculator marginCalculator;
    private PriceFeedAdapter priceFeedAdapter;
    private LeverageSettingService leverageSettingService;
    private SimpleMeterRegistry meterRegistry;
    private MarginMetricsService marginMetricsService;
    private ExecutionCoordinator executionCoordinator;
    private LiquidationMonitor liquidationMonitor;
    private int tickSeconds;

    @BeforeEach
    void setUp() {
        properties = MarginProperties.builder()
                .maintenanceRate(new BigDecimal("0.01"))
                .tradingFeeRate(new BigDecimal("0.0005"))
                .warningDistancePercent(new BigDecimal("15"))
                .pairs(Set.of("ETH/USDT", "BTC/USDT"))
                .platformMaxLeverage(100)
                .defaultMaxLeverage(20)
                .defaultPreferredLeverage(10)
                .defaultMarginMode(MarginMode.ISOLATED)
                .build();

        positionTable = new PositionTable();
        positionIndex = new PositionIndex();
        marginCalculator = new MarginCalculator(properties);
        priceFeedAdapter = new PriceFeedAdapter(eventPublisherHelper);
        leverageSettingService =
                new LeverageSettingService(leverageSettingJpaRepository, leverageSettingMapper, properties);
        meterRegistry = new SimpleMeterRegistry();
        marginMetricsService = new MarginMetricsService(meterRegistry, positionTable, priceFeedAdapter);

        InMemoryCollateralWallet wallet = new InMemoryCollateralWallet();
        wallet.credit("alice", new BigDecimal("10000"));
        PositionLedger positionLedger = new PositionLedger(
                positionTable,
                positionIndex,
                marginCalculator,
                properties,
                wallet,
                leverageSettingService,
                priceFeedAdapter,
                new PairRegistry(properties),
                historyRecorder,
                eventPublisherHelper);
        executionCoordinator =
                new ExecutionCoordinator(positionLedger, positionTable, leverageSettingService, marginMetricsService);
        liquidationMonitor = monitorWith(executionCoordinator);

        priceFeedAdapter.onTick("ETH/USDT", new BigDecimal("2000"), T0);
        priceFeedAdapter.onTick("BTC/USDT", new BigDecimal("50000"), T0);
    }

    private LiquidationMonitor monitorWith(ExecutionCoordinator coordinator) {
        return monitorWith(coordinator, Runnable::run);
    }

    private LiquidationMonitor monitorWith(ExecutionCoordinator coordinator, Executor executor) {
        return new LiquidationMonitor(
                positionIndex,
                positionTable,
                marginCalculator,
                properties,
                priceFeedAdapter,
                coordinator,
                leverageSettingService,
                eventPublisherHelper,
                marginMetricsService,
                executor);
    }

    /** Feeds a tick through the adapter, then runs the sweep the event would trigger. */
    private void tick(String pair, String price) {
        priceFeedAdapter.onTick(pair, new BigDecimal(price), T0.plusSeconds(++tickSeconds));
        liquidationMonitor.evaluate(priceFeedAdapter.latest(pair).orElseThrow());
    }

    private MarginPosition open(
            String pair, String size, int leverage, String collateral, MarginMode mode, String stopLoss, String takeProfit) {
        return executionCoordinator.execute(new OpenPositionCommand(
                "alice",
                pair,
                PositionSide.LONG,
                leverage,
                new BigDecimal(size),
                new BigDecimal(collateral),
                mode,
                stopLoss != null ? new BigDecimal(stopLoss) : null,
                takeProfit != null ? new BigDecimal(takeProfit) : null));
    }

    private MarginPosition stored(MarginPosition position) {
        return positionTable.get(position.getId()).orElseThrow();
    }

    // ==============================
    // ISOLATED
    // ==============================

    @Nested
    @DisplayName("Isolated positions")
    class Isolated {

        @Test
        @DisplayName("Tick at 1792 liquidates the 10x long with loss 208")
        void liquidatesOnBreach() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, null);

            tick("ETH/USDT", "1792");

            assertThat(stored(position).getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
            ArgumentCaptor<LiquidationRecord> captor = ArgumentCaptor.forClass(LiquidationRecord.class);
            verify(historyRecorder).recordLiquidation(captor.capture());
            assertThat(captor.getValue().getLossAmount()).isEqualByComparingTo("208");
            assertThat(captor.getValue().getRemainingCollateral()).isEqualByComparingTo("2");
            assertThat(captor.getValue().getLiquidationType()).isEqualTo(LiquidationType.AUTO);
        }

        @Test
        @DisplayName("Healthy tick leaves the position untouched")
        void healthyTick() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, null);

            tick("ETH/USDT", "1950");

            assertThat(stored(position).getStatus()).isEqualTo(PositionStatus.OPEN);
            assertThat(stored(position).getVersion()).isZero();
            verify(historyRecorder, never()).recordLiquidation(any());
        }

        @Test
        @DisplayName("Repeated breach ticks liquidate once")
        void repeatedTicks() {
            open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, null);

            tick("ETH/USDT", "1792");
            tick("ETH/USDT", "1780");

            verify(historyRecorder, times(1)).recordLiquidation(any());
        }
    }

    // ==============================
    // TRIGGERS
    // ==============================

    @Nested
    @DisplayName("Stop-loss and take-profit")
    class Triggers {

        @Test
        @DisplayName("Liquidation wins when a tick crosses both stop-loss and liquidation price")
        void liquidationBeforeStopLoss() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, "1900", null);

            tick("ETH/USDT", "1792");

            assertThat(stored(position).getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
            verify(historyRecorder, never()).recordClosure(any());
        }

        @Test
        @DisplayName("Stop-loss above the liquidation price closes the position")
        void stopLossCloses() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, "1850", null);

            tick("ETH/USDT", "1840");

            assertThat(stored(position).getStatus()).isEqualTo(PositionStatus.CLOSED);
            ArgumentCaptor<ClosureRecord> captor = ArgumentCaptor.forClass(ClosureRecord.class);
            verify(historyRecorder).recordClosure(captor.capture());
            assertThat(captor.getValue().getReason()).isEqualTo(CloseReason.STOP_LOSS);
            assertThat(captor.getValue().getClosePrice()).isEqualByComparingTo("1840");
            assertThat(meterRegistry.get("margin.trigger.closes").counter().count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Take-profit closes at the tick price")
        void takeProfitCloses() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, "2100");

            tick("ETH/USDT", "2150");

            assertThat(stored(position).getStatus()).isEqualTo(PositionStatus.CLOSED);
            ArgumentCaptor<ClosureRecord> captor = ArgumentCaptor.forClass(ClosureRecord.class);
            verify(historyRecorder).recordClosure(captor.capture());
            assertThat(captor.getValue().getReason()).isEqualTo(CloseReason.TAKE_PROFIT);
        }
    }

    // ==============================
    // CROSS
    // ==============================

    @Nested
    @DisplayName("Cross margin")
    class Cross {

        @Test
        @DisplayName("Shared pool liquidates both positions on an ETH drop neither would breach alone")
        void sharedRiskLiquidatesGroup() {
            MarginPosition eth = open("ETH/USDT", "1", 10, "200", MarginMode.CROSS, null, null);
            MarginPosition btc = open("BTC/USDT", "0.1", 20, "250", MarginMode.CROSS, null, null);
            assertThat(stored(eth).getLiquidationPrice()).isEqualByComparingTo("1620");
            assertThat(stored(btc).getLiquidationPrice()).isEqualByComparingTo("46200");

            tick("BTC/USDT", "47600");
            assertThat(stored(eth).getStatus()).isEqualTo(PositionStatus.OPEN);
            assertThat(stored(btc).getStatus()).isEqualTo(PositionStatus.OPEN);

            // ETH alone at 1850: equity 50 on notional 1850, ratio 0.027
            assertThat(marginCalculator
                            .evaluate(stored(eth), new BigDecimal("1850"))
                            .breaches(marginCalculator.maintenanceRate()))
                    .isFalse();

            tick("ETH/USDT", "1850");

            assertThat(stored(eth).getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
            assertThat(stored(btc).getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
            verify(historyRecorder).recordLiquidations(any());
            verify(eventPublisherHelper)
                    .publishRiskEvent(
                            any(),
                            eq(RiskEventType.CROSS_MARGIN_LIQUIDATION),
                            eq(RiskLevel.CRITICAL),
                            anyString(),
                            anyMap());
        }
    }

    // ==============================
    // FAILURE HANDLING
    // ==============================

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        @DisplayName("Version conflict on submission is treated as already resolved")
        void conflictIsNotAnError() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, null);
            ExecutionCoordinator conflicting = mock(ExecutionCoordinator.class);
            when(conflicting.execute(any(LiquidatePositionCommand.class)))
                    .thenThrow(new VersionConflictException(position.getId(), 0, 1, "LIQUIDATED"));
            liquidationMonitor = monitorWith(conflicting);

            tick("ETH/USDT", "1792");
            tick("ETH/USDT", "1791");

            // the in-flight marker is cleared after each attempt
            verify(conflicting, times(2)).execute(any(LiquidatePositionCommand.class));
        }

        @Test
        @DisplayName("Submission refused by a saturated pool is dropped and retried on the next tick")
        void saturatedPoolDefersToNextTick() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, null);
            AtomicBoolean saturated = new AtomicBoolean(true);
            liquidationMonitor = monitorWith(executionCoordinator, task -> {
                if (saturated.getAndSet(false)) {
                    throw new RejectedExecutionException("queue full");
                }
                task.run();
            });

            tick("ETH/USDT", "1792");

            assertThat(stored(position).getStatus()).isEqualTo(PositionStatus.OPEN);
            assertThat(meterRegistry.counter("margin.submissions.deferred").count()).isEqualTo(1.0);

            tick("ETH/USDT", "1791");

            assertThat(stored(position).getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
            verify(historyRecorder, times(1)).recordLiquidation(any());
        }

        @Test
        @DisplayName("Position that cannot be evaluated is quarantined once and skipped afterwards")
        void quarantinesInvalidSnapshot() {
            MarginPosition healthy = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, null);
            MarginPosition broken = MarginPosition.builder()
                    .id("broken-1")
                    .owner("alice")
                    .pair("ETH/USDT")
                    .side(PositionSide.LONG)
                    .leverage(10)
                    .entryPrice(new BigDecimal("2000"))
                    .size(BigDecimal.ONE)
                    .collateral(BigDecimal.ZERO)
                    .marginMode(MarginMode.ISOLATED)
                    .realizedPnl(BigDecimal.ZERO)
                    .feesAccrued(BigDecimal.ZERO)
                    .status(PositionStatus.OPEN)
                    .version(0)
                    .openedAt(LocalDateTime.now())
                    .build();
            positionTable.insert(broken);
            positionIndex.add("ETH/USDT", "alice", "broken-1", false);

            tick("ETH/USDT", "1792");
            tick("ETH/USDT", "1790");

            assertThat(liquidationMonitor.isQuarantined("broken-1")).isTrue();
            assertThat(stored(broken).getStatus()).isEqualTo(PositionStatus.OPEN);
            assertThat(stored(healthy).getStatus()).isEqualTo(PositionStatus.LIQUIDATED);
            verify(eventPublisherHelper, times(1))
                    .publishRiskEvent(
                            any(), eq(RiskEventType.COMPUTATION_INVALID), eq(RiskLevel.CRITICAL), anyString(), anyMap());
        }
    }

    // ==============================
    // WARNINGS
    // ==============================

    @Nested
    @DisplayName("Liquidation warnings")
    class Warnings {

        @Test
        @DisplayName("Warns once while inside the distance band and re-arms after leaving it")
        void warnsOncePerApproach() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, null);

            tick("ETH/USDT", "1990");
            tick("ETH/USDT", "1980");
            tick("ETH/USDT", "2200");
            tick("ETH/USDT", "1990");

            verify(eventPublisherHelper, times(2))
                    .publishRiskEvent(
                            any(), eq(RiskEventType.LIQUIDATION_WARNING), eq(RiskLevel.WARNING), anyString(), anyMap());
            assertThat(stored(position).getStatus()).isEqualTo(PositionStatus.OPEN);
        }

        @Test
        @DisplayName("Terminal position events clear the warning state")
        void terminalEventClearsState() {
            MarginPosition position = open("ETH/USDT", "1", 10, "210", MarginMode.ISOLATED, null, null);
            tick("ETH/USDT", "1990");

            MarginPosition closed = position.toBuilder().status(PositionStatus.CLOSED).build();
            liquidationMonitor.onPositionEvent(new PositionEvent(this, closed, PositionEventType.CLOSED));
            tick("ETH/USDT", "1980");

            verify(eventPublisherHelper, times(2))
                    .publishRiskEvent(
                            any(), eq(RiskEventType.LIQUIDATION_WARNING), eq(RiskLevel.WARNING), anyString(), anyMap());
        }
    }
}
