package com.marginengine.integration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;

import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import com.marginengine.domain.enums.PositionStatus;
import com.marginengine.domain.model.MarginPosition;
import com.marginengine.entity.LiquidationRecordEntity;
import com.marginengine.event.EventPublisherHelper;
import com.marginengine.event.MarkPriceEvent;
import com.marginengine.event.PositionEvent;
import com.marginengine.history.HistoryRecorder;
import com.marginengine.liquidation.LiquidationMonitor;
import com.marginengine.mapper.HistoryRecordMapper;
import com.marginengine.mapper.LeverageSettingMapper;
import com.marginengine.margin.MarginCalculator;
import com.marginengine.margin.MarginProperties;
import com.marginengine.observability.MarginMetricsService;
import com.marginengine.position.ExecutionCoordinator;
import com.marginengine.position.PositionLedger;
import com.marginengine.position.PositionTable;
import com.marginengine.position.command.OpenPositionCommand;
import com.marginengine.pricefeed.PairRegistry;
import com.marginengine.pricefeed.PositionIndex;
import com.marginengine.pricefeed.PriceFeedAdapter;
import com.marginengine.repository.jpa.ClosureRecordJpaRepository;
import com.marginengine.repository.jpa.LeverageSettingJpaRepository;
import com.marginengine.repository.jpa.LiquidationRecordJpaRepository;
import com.marginengine.settings.LeverageSettingService;
import com.marginengine.wallet.InMemoryCollateralWallet;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

/**
 * End-to-end tick flow: oracle tick -> price feed -> monitor -> coordinator -> ledger ->
 * wallet and history, with only the JPA repositories mocked. Events are routed
 * synchronously to the monitor and the metrics service the way Spring's multicaster
 * would deliver them.
 */
@ExtendWith(MockitoExtension.class)
class LiquidationFlowIntegrationTest {

    private static final Instant T0 = Instant.parse("2026-01-05T10:00:00Z");

    @Mock
    private LiquidationRecordJpaRepository liquidationRecordJpaRepository;

    @Mock
    private ClosureRecordJpaRepository closureRecordJpaRepository;

    @Mock
    private LeverageSettingJpaRepository leverageSettingJpaRepository;

    private InMemoryCollateralWallet wallet;
    private PositionTable positionTable;
    private PriceFeedAdapter priceFeedAdapter;
    private ExecutionCoordinator executionCoordinator;
    private SimpleMeterRegistry meterRegistry;
    private int tickSeconds;

    @BeforeEach
    void setUp() {
        MarginProperties properties = MarginProperties.builder()
                .maintenanceRate(new BigDecimal("0.01"))
                .tradingFeeRate(new BigDecimal("0.0005"))
                .warningDistancePercent(new BigDecimal("15"))
                .pairs(Set.of("ETH/USDT", "BTC/USDT"))
                .platformMaxLeverage(100)
                .defaultMaxLeverage(20)
                .defaultPreferredLeverage(10)
                .defaultMarginMode(MarginMode.ISOLATED)
                .build();

        lenient()
                .when(liquidationRecordJpaRepository.saveAndFlush(any(LiquidationRecordEntity.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        lenient()
                .when(liquidationRecordJpaRepository.saveAllAndFlush(anyList()))
                .thenAnswer(invocation -> invocation.getArgument(0));

        AtomicReference<LiquidationMonitor> monitorRef = new AtomicReference<>();
        AtomicReference<MarginMetricsService> metricsRef = new AtomicReference<>();
        ApplicationEventPublisher publisher = event -> {
            if (event instanceof MarkPriceEvent markPriceEvent) {
                monitorRef.get().onMarkPrice(markPriceEvent);
                metricsRef.get().onMarkPrice(markPriceEvent);
            } else if (event instanceof PositionEvent positionEvent) {
                monitorRef.get().onPositionEvent(positionEvent);
                metricsRef.get().onPositionEvent(positionEvent);
            }
        };
        EventPublisherHelper eventPublisherHelper = new EventPublisherHelper(publisher);

        positionTable = new PositionTable();
        PositionIndex positionIndex = new PositionIndex();
        MarginCalculator marginCalculator = new MarginCalculator(properties);
        priceFeedAdapter = new PriceFeedAdapter(eventPublisherHelper);
        LeverageSettingService leverageSettingService = new LeverageSettingService(
                leverageSettingJpaRepository, Mappers.getMapper(LeverageSettingMapper.class), properties);
        HistoryRecorder historyRecorder = new HistoryRecorder(
                liquidationRecordJpaRepository,
                closureRecordJpaRepository,
                Mappers.getMapper(HistoryRecordMapper.class));
        meterRegistry = new SimpleMeterRegistry();
        MarginMetricsService marginMetricsService =
                new MarginMetricsService(meterRegistry, positionTable, priceFeedAdapter);
        metricsRef.set(marginMetricsService);

        wallet = new InMemoryCollateralWallet();
        wallet.credit("alice", new BigDecimal("10000"));
        wallet.credit("bob", new BigDecimal("10000"));

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
        monitorRef.set(new LiquidationMonitor(
                positionIndex,
                positionTable,
                marginCalculator,
                properties,
                priceFeedAdapter,
                executionCoordinator,
                leverageSettingService,
                eventPublisherHelper,
                marginMetricsService,
                Runnable::run));

        tick("ETH/USDT", "2000");
        tick("BTC/USDT", "50000");
    }

    private void tick(String pair, String price) {
        priceFeedAdapter.onTick(pair, new BigDecimal(price), T0.plusSeconds(++tickSeconds));
    }

    private MarginPosition open(String owner, String pair, String size, int leverage, String collateral, MarginMode mode) {
        return executionCoordinator.execute(new OpenPositionCommand(
                owner,
                pair,
                PositionSide.LONG,
                leverage,
                new BigDecimal(size),
                new BigDecimal(collateral),
                mode,
                null,
                null));
    }

    private PositionStatus status(MarginPosition position) {
        return positionTable.get(position.getId()).orElseThrow().getStatus();
    }

    @Test
    @DisplayName("Isolated and cross positions are liquidated by the ticks that breach them")
    void ticksDriveLiquidations() {
        MarginPosition isolated = open("alice", "ETH/USDT", "1", 10, "210", MarginMode.ISOLATED);
        MarginPosition crossEth = open("bob", "ETH/USDT", "1", 10, "200", MarginMode.CROSS);
        MarginPosition crossBtc = open("bob", "BTC/USDT", "0.1", 20, "250", MarginMode.CROSS);

        tick("ETH/USDT", "1792");

        assertThat(status(isolated)).isEqualTo(PositionStatus.LIQUIDATED);
        assertThat(wallet.getAvailable("alice")).isEqualByComparingTo("9791");
        // bob's pool still holds: equity 242 on notional 6792
        assertThat(status(crossEth)).isEqualTo(PositionStatus.OPEN);
        assertThat(status(crossBtc)).isEqualTo(PositionStatus.OPEN);

        tick("BTC/USDT", "47600");

        assertThat(status(crossEth)).isEqualTo(PositionStatus.LIQUIDATED);
        assertThat(status(crossBtc)).isEqualTo(PositionStatus.LIQUIDATED);
        // reserved 453.5, pool remainder 2 paid back
        assertThat(wallet.getAvailable("bob")).isEqualByComparingTo("9548.5");

        ArgumentCaptor<LiquidationRecordEntity> single = ArgumentCaptor.forClass(LiquidationRecordEntity.class);
        verify(liquidationRecordJpaRepository).saveAndFlush(single.capture());
        assertThat(single.getValue().getLiquidationType()).isEqualTo(LiquidationType.AUTO);
        assertThat(single.getValue().getRemainingCollateral()).isEqualByComparingTo("2");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<LiquidationRecordEntity>> group = ArgumentCaptor.forClass(List.class);
        verify(liquidationRecordJpaRepository).saveAllAndFlush(group.capture());
        assertThat(group.getValue())
                .extracting(LiquidationRecordEntity::getPositionId)
                .containsExactlyInAnyOrder(crossEth.getId(), crossBtc.getId());

        assertThat(meterRegistry.get("margin.liquidations").counter().count()).isEqualTo(3.0);
        assertThat(meterRegistry.get("margin.positions.open").gauge().value()).isZero();
    }

    @Test
    @DisplayName("Stale tick for a pair never triggers an evaluation")
    void staleTickIgnored() {
        MarginPosition isolated = open("alice", "ETH/USDT", "1", 10, "210", MarginMode.ISOLATED);

        priceFeedAdapter.onTick("ETH/USDT", new BigDecimal("1500"), T0);

        assertThat(status(isolated)).isEqualTo(PositionStatus.OPEN);
        assertThat(meterRegistry.get("margin.ticks.stale").functionCounter().count()).isEqualTo(1.0);
    }
}
