package com.marginengine.liquidation;

import com.marginengine.domain.enums.CloseReason;
import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.domain.enums.PositionSide;
import com.marginengine.domain.model.MarginPosition;
import com.marginengine.domain.model.MarkPrice;
import com.marginengine.event.EventPublisherHelper;
import com.marginengine.event.MarkPriceEvent;
import com.marginengine.event.PositionEvent;
import com.marginengine.event.RiskEventType;
import com.marginengine.event.RiskLevel;
import com.marginengine.exception.VersionConflictException;
import com.marginengine.margin.MarginCalculation;
import com.marginengine.margin.MarginCalculator;
import com.marginengine.margin.MarginProperties;
import com.marginengine.observability.MarginMetricsService;
import com.marginengine.position.ExecutionCoordinator;
import com.marginengine.position.PositionTable;
import com.marginengine.position.command.ClosePositionCommand;
import com.marginengine.position.command.LiquidateCrossGroupCommand;
import com.marginengine.position.command.LiquidatePositionCommand;
import com.marginengine.pricefeed.PositionIndex;
import com.marginengine.pricefeed.PriceFeedAdapter;
import com.marginengine.settings.LeverageSettingService;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Evaluates open positions on every accepted mark price and submits liquidations and
 * stop-loss/take-profit closes.
 *
 * <p>Per tick for pair P, in this order:
 * <ol>
 *   <li>Each open ISOLATED position on P is evaluated alone; a margin ratio at or below
 *       the maintenance rate submits a liquidation with the last observed version.</li>
 *   <li>Each owner with CROSS positions touching P is evaluated as one pool, using the
 *       latest mark of every pair the owner holds. A breach liquidates the whole cross
 *       group at once.</li>
 *   <li>Stop-loss and take-profit levels of the remaining positions on P are checked.
 *       Positions submitted for liquidation on this tick are skipped, so a position past
 *       both thresholds is liquidated rather than closed.</li>
 * </ol>
 *
 * <p>Submissions run on the bounded {@code liquidationExecutor}; the tick thread never
 * waits on a position lock. A submission the saturated pool refuses is dropped and counted;
 * the position is still in breach on the next tick and is submitted again then. A
 * {@link VersionConflictException} on a submission means the position was already resolved
 * by someone else and is not retried.
 *
 * <p>A position whose snapshot cannot be evaluated is logged as an internal defect,
 * reported as a CRITICAL {@code COMPUTATION_INVALID} risk event and quarantined: it is
 * skipped on every later tick instead of aborting the sweep.
 *
 * <p>Liquidation warnings fire once per position when a healthy position comes within
 * {@code warningDistancePercent} of its liquidation price, and re-arm after it moves out.
 */
@Service
public class LiquidationMonitor {

    private static final Logger log = LoggerFactory.getLogger(LiquidationMonitor.class);

    private final PositionIndex positionIndex;
    private final PositionTable positionTable;
    private final MarginCalculator marginCalculator;
    private final MarginProperties marginProperties;
    private final PriceFeedAdapter priceFeedAdapter;
    private final ExecutionCoordinator executionCoordinator;
    private final LeverageSettingService leverageSettingService;
    private final EventPublisherHelper eventPublisherHelper;
    private final MarginMetricsService marginMetricsService;
    private final Executor liquidationExecutor;

    private final Set<String> quarantined = ConcurrentHashMap.newKeySet();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<String> warned = ConcurrentHashMap.newKeySet();

    public LiquidationMonitor(
            PositionIndex positionIndex,
            PositionTable positionTable,
            MarginCalculator marginCalculator,
            MarginProperties marginProperties,
            PriceFeedAdapter priceFeedAdapter,
            ExecutionCoordinator executionCoordinator,
            LeverageSettingService leverageSettingService,
            EventPublisherHelper eventPublisherHelper,
            MarginMetricsService marginMetricsService,
            @Qualifier("liquidationExecutor") Executor liquidationExecutor) {
        this.positionIndex = positionIndex;
        this.positionTable = positionTable;
        this.marginCalculator = marginCalculator;
        this.marginProperties = marginProperties;
        this.priceFeedAdapter = priceFeedAdapter;
        this.executionCoordinator = executionCoordinator;
        this.leverageSettingService = leverageSettingService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.marginMetricsService = marginMetricsService;
        this.liquidationExecutor = liquidationExecutor;
    }

    @EventListener
    @Order(10)
    public void onMarkPrice(MarkPriceEvent event) {
        evaluate(event.getMarkPrice());
    }

    /** Clears per-position bookkeeping once a position is terminal. */
    @EventListener
    public void onPositionEvent(PositionEvent event) {
        if (!event.getPosition().isOpen()) {
            String positionId = event.getPosition().getId();
            warned.remove(positionId);
            quarantined.remove(positionId);
        }
    }

    /**
     * Runs one evaluation sweep for the pair of {@code markPrice}. Public so tests and
     * replay tooling can drive the monitor without the event bus.
     */
    public void evaluate(MarkPrice markPrice) {
        String pair = markPrice.symbol();
        BigDecimal mark = markPrice.price();

        List<MarginPosition> positions = new ArrayList<>();
        for (String positionId : positionIndex.positionsForPair(pair)) {
            if (!quarantined.contains(positionId)) {
                positionTable.get(positionId).filter(MarginPosition::isOpen).ifPresent(positions::add);
            }
        }
        if (positions.isEmpty()) {
            return;
        }

        Set<String> liquidating = new HashSet<>();
        Set<String> crossOwners = new LinkedHashSet<>();

        // 1. Isolated positions on this pair
        for (MarginPosition position : positions) {
            if (position.isCross()) {
                crossOwners.add(position.getOwner());
                continue;
            }
            MarginCalculation calculation = marginCalculator.evaluate(position, mark);
            if (!calculation.isValid()) {
                quarantine(position, calculation.getInvalidReason());
                liquidating.add(position.getId());
                continue;
            }
            if (calculation.breaches(marginCalculator.maintenanceRate())) {
                liquidating.add(position.getId());
                submitLiquidation(position, mark, calculation);
            } else {
                checkWarning(position, mark, calculation.getLiquidationPrice());
            }
        }

        // 2. Cross groups touching this pair
        for (String owner : crossOwners) {
            evaluateCrossGroup(owner, pair, mark, liquidating);
        }

        // 3. Stop-loss / take-profit, after liquidation
        for (MarginPosition position : positions) {
            if (liquidating.contains(position.getId()) || quarantined.contains(position.getId())) {
                continue;
            }
            CloseReason reason = triggerHit(position, mark);
            if (reason != null) {
                submitTriggerClose(position, mark, reason);
            }
        }
    }

    public boolean isQuarantined(String positionId) {
        return quarantined.contains(positionId);
    }

    public Set<String> getQuarantinedPositions() {
        return Set.copyOf(quarantined);
    }

    // ==============================
    // CROSS
    // ==============================

    private void evaluateCrossGroup(String owner, String tickPair, BigDecimal tickMark, Set<String> liquidating) {
        List<MarginPosition> group = new ArrayList<>();
        for (String positionId : positionIndex.crossPositionsForOwner(owner)) {
            if (!quarantined.contains(positionId)) {
                positionTable.get(positionId).filter(MarginPosition::isOpen).ifPresent(group::add);
            }
        }
        if (group.isEmpty()) {
            return;
        }

        Map<String, BigDecimal> marks = new HashMap<>(priceFeedAdapter.latestPrices(
                group.stream().map(MarginPosition::getPair).distinct().toList()));
        marks.put(tickPair, tickMark);

        List<MarginPosition> valid = new ArrayList<>();
        for (MarginPosition member : group) {
            MarginCalculation memberCalculation =
                    marginCalculator.evaluate(member, marks.getOrDefault(member.getPair(), member.getEntryPrice()));
            if (memberCalculation.isValid()) {
                valid.add(member);
            } else {
                quarantine(member, memberCalculation.getInvalidReason());
                liquidating.add(member.getId());
            }
        }
        if (valid.isEmpty()) {
            return;
        }

        MarginCalculation pool = marginCalculator.evaluateCross(valid, marks);
        if (!pool.isValid()) {
            log.error("Cross pool of {} cannot be evaluated: {}", owner, pool.getInvalidReason());
            return;
        }

        if (pool.breaches(marginCalculator.maintenanceRate())) {
            valid.forEach(member -> liquidating.add(member.getId()));
            submitCrossLiquidation(owner, valid, marks, pool);
            return;
        }

        for (MarginPosition member : valid) {
            if (member.getPair().equals(tickPair)) {
                checkWarning(member, tickMark, member.getLiquidationPrice());
            }
        }
    }

    // ==============================
    // SUBMISSIONS
    // ==============================

    private void submitLiquidation(MarginPosition position, BigDecimal mark, MarginCalculation calculation) {
        if (!inFlight.add(position.getId())) {
            return;
        }
        log.warn(
                "Maintenance breached: position={}, pair={}, mark={}, marginRatio={}, liqPrice={}",
                position.getId(),
                position.getPair(),
                mark,
                calculation.getMarginRatio(),
                calculation.getLiquidationPrice());
        LiquidatePositionCommand command =
                new LiquidatePositionCommand(position.getId(), position.getVersion(), mark, LiquidationType.AUTO);
        submit(position.getId(), "liquidation", () -> executionCoordinator.execute(command));
    }

    private void submitCrossLiquidation(
            String owner, List<MarginPosition> group, Map<String, BigDecimal> marks, MarginCalculation pool) {
        String key = "cross:" + owner;
        if (!inFlight.add(key)) {
            return;
        }
        log.warn(
                "Cross maintenance breached: owner={}, positions={}, marginRatio={}, equity={}",
                owner,
                group.size(),
                pool.getMarginRatio(),
                pool.getEquity());
        Map<String, Long> versions = new LinkedHashMap<>();
        group.forEach(member -> versions.put(member.getId(), member.getVersion()));
        LiquidateCrossGroupCommand command =
                new LiquidateCrossGroupCommand(owner, versions, marks, LiquidationType.AUTO);
        submit(key, "cross liquidation", () -> executionCoordinator.execute(command));
    }

    private void submitTriggerClose(MarginPosition position, BigDecimal mark, CloseReason reason) {
        if (!inFlight.add(position.getId())) {
            return;
        }
        log.info("{} hit: position={}, pair={}, mark={}", reason, position.getId(), position.getPair(), mark);
        ClosePositionCommand command =
                new ClosePositionCommand(position.getId(), position.getVersion(), mark, reason, null);
        submit(position.getId(), reason.name(), () -> {
            executionCoordinator.execute(command);
            marginMetricsService.recordTriggerClose();
        });
    }

    private void submit(String key, String action, Runnable task) {
        try {
            liquidationExecutor.execute(() -> {
                try {
                    task.run();
                } catch (VersionConflictException e) {
                    log.debug("{} for {} already resolved: {}", action, key, e.getMessage());
                } catch (RuntimeException e) {
                    log.error("{} for {} failed", action, key, e);
                } finally {
                    inFlight.remove(key);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            marginMetricsService.recordDeferredSubmission();
            log.warn("Worker pool saturated, {} for {} deferred to the next tick", action, key);
        }
    }

    // ==============================
    // TRIGGERS / WARNINGS / QUARANTINE
    // ==============================

    private CloseReason triggerHit(MarginPosition position, BigDecimal mark) {
        boolean isLong = position.getSide() == PositionSide.LONG;
        BigDecimal stopLoss = position.getStopLoss();
        if (stopLoss != null && (isLong ? mark.compareTo(stopLoss) <= 0 : mark.compareTo(stopLoss) >= 0)) {
            return CloseReason.STOP_LOSS;
        }
        BigDecimal takeProfit = position.getTakeProfit();
        if (takeProfit != null && (isLong ? mark.compareTo(takeProfit) >= 0 : mark.compareTo(takeProfit) <= 0)) {
            return CloseReason.TAKE_PROFIT;
        }
        return null;
    }

    private void checkWarning(MarginPosition position, BigDecimal mark, BigDecimal liquidationPrice) {
        BigDecimal distance = marginCalculator.distanceToLiquidationPercent(mark, liquidationPrice);
        if (distance.compareTo(marginProperties.getWarningDistancePercent()) >= 0) {
            warned.remove(position.getId());
            return;
        }
        if (warned.contains(position.getId())
                || !leverageSettingService.getSetting(position.getOwner()).isLiquidationWarningEnabled()) {
            return;
        }
        if (warned.add(position.getId())) {
            log.warn(
                    "Liquidation warning: position={}, mark={}, liqPrice={}, distance={}%",
                    position.getId(),
                    mark,
                    liquidationPrice,
                    distance);
            Map<String, Object> details = new HashMap<>();
            details.put("positionId", position.getId());
            details.put("owner", position.getOwner());
            details.put("markPrice", mark);
            details.put("liquidationPrice", liquidationPrice);
            details.put("distancePercent", distance);
            eventPublisherHelper.publishRiskEvent(
                    this,
                    RiskEventType.LIQUIDATION_WARNING,
                    RiskLevel.WARNING,
                    String.format(
                            "Position %s is %s%% from its liquidation price %s",
                            position.getId(), distance, liquidationPrice),
                    details);
        }
    }

    private void quarantine(MarginPosition position, String reason) {
        if (!quarantined.add(position.getId())) {
            return;
        }
        log.error(
                "Internal defect: position {} cannot be evaluated ({}); withdrawn from monitoring",
                position.getId(),
                reason);
        Map<String, Object> details = new HashMap<>();
        details.put("positionId", position.getId());
        details.put("owner", position.getOwner());
        details.put("reason", reason);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.COMPUTATION_INVALID,
                RiskLevel.CRITICAL,
                String.format("Position %s cannot be evaluated: %s", position.getId(), reason),
                details);
    }
}
