package com.marginengine.position;

import com.marginengine.domain.enums.CloseReason;
import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import com.marginengine.domain.enums.PositionStatus;
import com.marginengine.domain.model.ClosureRecord;
import com.marginengine.domain.model.LeverageSetting;
import com.marginengine.domain.model.LiquidationRecord;
import com.marginengine.domain.model.MarginPosition;
import com.marginengine.domain.model.MarkPrice;
import com.marginengine.event.EventPublisherHelper;
import com.marginengine.event.PositionEventType;
import com.marginengine.event.RiskEventType;
import com.marginengine.event.RiskLevel;
import com.marginengine.exception.ComputationInvalidException;
import com.marginengine.exception.InsufficientCollateralException;
import com.marginengine.exception.InsufficientFundsException;
import com.marginengine.exception.InvalidLeverageException;
import com.marginengine.exception.PairUnavailableException;
import com.marginengine.exception.ResourceNotFoundException;
import com.marginengine.exception.ValidationException;
import com.marginengine.exception.VersionConflictException;
import com.marginengine.history.HistoryRecorder;
import com.marginengine.margin.MarginCalculation;
import com.marginengine.margin.MarginCalculator;
import com.marginengine.margin.MarginProperties;
import com.marginengine.position.command.OpenPositionCommand;
import com.marginengine.pricefeed.PairRegistry;
import com.marginengine.pricefeed.PositionIndex;
import com.marginengine.pricefeed.PriceFeedAdapter;
import com.marginengine.settings.LeverageSettingService;
import com.marginengine.wallet.CollateralWallet;
import com.marginengine.wallet.ReservationId;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Single source of truth for margin positions. Owns every state transition.
 *
 * <p>Each mutation follows the same sequence: read the current snapshot and check the
 * caller's expected version, build the complete next snapshot (liquidation price
 * included), make exactly one wallet call, write history where the transition requires
 * it, then commit with a version compare-and-swap on the {@link PositionTable}. If a later
 * step fails the wallet call is compensated, so other readers never observe a wallet
 * movement without the matching position state or the reverse.
 *
 * <p>Callers go through the {@link ExecutionCoordinator}, which holds the position's lock
 * (or the owner's cross-group lock) for the whole sequence.
 */
@Service
public class PositionLedger {

    private static final Logger log = LoggerFactory.getLogger(PositionLedger.class);

    private static final int AMOUNT_SCALE = MarginCalculator.PRICE_SCALE;

    private final PositionTable positionTable;
    private final PositionIndex positionIndex;
    private final MarginCalculator marginCalculator;
    private final MarginProperties marginProperties;
    private final CollateralWallet collateralWallet;
    private final LeverageSettingService leverageSettingService;
    private final PriceFeedAdapter priceFeedAdapter;
    private final PairRegistry pairRegistry;
    private final HistoryRecorder historyRecorder;
    private final EventPublisherHelper eventPublisherHelper;

    public PositionLedger(
            PositionTable positionTable,
            PositionIndex positionIndex,
            MarginCalculator marginCalculator,
            MarginProperties marginProperties,
            CollateralWallet collateralWallet,
            LeverageSettingService leverageSettingService,
            PriceFeedAdapter priceFeedAdapter,
            PairRegistry pairRegistry,
            HistoryRecorder historyRecorder,
            EventPublisherHelper eventPublisherHelper) {
        this.positionTable = positionTable;
        this.positionIndex = positionIndex;
        this.marginCalculator = marginCalculator;
        this.marginProperties = marginProperties;
        this.collateralWallet = collateralWallet;
        this.leverageSettingService = leverageSettingService;
        this.priceFeedAdapter = priceFeedAdapter;
        this.pairRegistry = pairRegistry;
        this.historyRecorder = historyRecorder;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    // ==============================
    // OPEN
    // ==============================

    /**
     * Opens a position at the pair's latest mark price.
     *
     * <p>Reserves {@code collateral + openFee} from the wallet in one call. All validation
     * happens before the reservation.
     *
     * @throws PairUnavailableException if the pair is not tradable or has no mark yet
     * @throws InvalidLeverageException if leverage is outside [1, owner max leverage]
     * @throws InsufficientCollateralException if collateral is below initial margin or the
     *     wallet cannot cover the reservation
     */
    public MarginPosition open(OpenPositionCommand command) {
        String pair = PriceFeedAdapter.normalizeSymbol(command.pair());
        if (!pairRegistry.isTradable(pair)) {
            throw new PairUnavailableException(pair, "not tradable");
        }
        MarkPrice mark = priceFeedAdapter
                .latest(pair)
                .orElseThrow(() -> new PairUnavailableException(pair, "no mark price available"));

        LeverageSetting setting = leverageSettingService.getSetting(command.owner());
        if (command.leverage() < 1 || command.leverage() > setting.getMaxLeverage()) {
            throw new InvalidLeverageException(command.leverage(), setting.getMaxLeverage());
        }
        MarginMode mode = command.marginMode() != null ? command.marginMode() : setting.getDefaultMarginMode();

        BigDecimal entryPrice = mark.price();
        BigDecimal notional = command.size().multiply(entryPrice);
        BigDecimal initialMargin =
                notional.divide(BigDecimal.valueOf(command.leverage()), AMOUNT_SCALE, RoundingMode.HALF_UP);
        if (command.collateral().compareTo(initialMargin) < 0) {
            throw new InsufficientCollateralException(
                    String.format(
                            "Collateral %s is below the initial margin %s for %dx leverage",
                            command.collateral(), initialMargin, command.leverage()),
                    initialMargin,
                    command.collateral());
        }
        validateTriggers(command.side(), entryPrice, command.stopLoss(), command.takeProfit());

        BigDecimal openFee = fee(notional);
        LocalDateTime now = LocalDateTime.now();
        MarginPosition position = MarginPosition.builder()
                .id(UUID.randomUUID().toString())
                .owner(command.owner())
                .pair(pair)
                .side(command.side())
                .leverage(command.leverage())
                .entryPrice(entryPrice)
                .size(command.size())
                .collateral(command.collateral())
                .marginMode(mode)
                .unrealizedPnl(BigDecimal.ZERO)
                .realizedPnl(openFee.negate())
                .feesAccrued(openFee)
                .stopLoss(command.stopLoss())
                .takeProfit(command.takeProfit())
                .status(PositionStatus.OPEN)
                .version(0)
                .openedAt(now)
                .lastUpdatedAt(now)
                .build();
        position.setLiquidationPrice(liquidationPriceFor(position));

        BigDecimal reserveAmount = command.collateral().add(openFee);
        ReservationId reservationId;
        try {
            reservationId = collateralWallet.reserve(command.owner(), reserveAmount);
        } catch (InsufficientFundsException e) {
            throw new InsufficientCollateralException(
                    "Wallet cannot cover collateral plus opening fee", reserveAmount, command.collateral());
        }
        position.setReservationId(reservationId.value());

        try {
            positionTable.insert(position);
        } catch (RuntimeException e) {
            collateralWallet.release(reservationId, reserveAmount);
            throw e;
        }
        positionIndex.add(pair, position.getOwner(), position.getId(), position.isCross());
        if (position.isCross()) {
            refreshCrossGroup(position.getOwner());
        }

        log.info(
                "Position opened: id={}, owner={}, {} {} {}x size={} entry={} collateral={} liqPrice={} mode={}",
                position.getId(),
                position.getOwner(),
                position.getSide(),
                pair,
                position.getLeverage(),
                position.getSize(),
                entryPrice,
                position.getCollateral(),
                position.getLiquidationPrice(),
                mode);
        MarginPosition committed = snapshot(position.getId());
        eventPublisherHelper.publishPositionEvent(this, committed, PositionEventType.OPENED);
        return committed;
    }

    // ==============================
    // ADJUST COLLATERAL
    // ==============================

    /**
     * Adds or withdraws collateral and recomputes the liquidation price.
     *
     * <p>A withdrawal must leave collateral positive, within the owner's max leverage at
     * entry notional, and above maintenance at the current mark.
     *
     * @throws VersionConflictException if the position is not OPEN at {@code expectedVersion}
     */
    public MarginPosition adjustCollateral(String positionId, long expectedVersion, BigDecimal delta) {
        if (delta == null || delta.signum() == 0) {
            throw new ValidationException("Collateral delta must be non-zero");
        }
        MarginPosition current = requireOpenAt(positionId, expectedVersion);
        BigDecimal newCollateral = current.getCollateral().add(delta);
        if (newCollateral.signum() <= 0) {
            throw new InsufficientCollateralException(
                    "Withdrawal would leave no collateral", delta.negate(), current.getCollateral());
        }

        MarginPosition next = current.toBuilder()
                .collateral(newCollateral)
                .version(current.getVersion() + 1)
                .lastUpdatedAt(LocalDateTime.now())
                .build();
        next.setLiquidationPrice(liquidationPriceFor(next));

        if (delta.signum() < 0) {
            checkWithdrawal(current, next);
        }

        ReservationId reservationId = new ReservationId(current.getReservationId());
        Runnable compensation;
        if (delta.signum() > 0) {
            try {
                collateralWallet.reserve(current.getOwner(), delta);
            } catch (InsufficientFundsException e) {
                throw new InsufficientCollateralException("Wallet cannot cover the top-up", delta, BigDecimal.ZERO);
            }
            compensation = () -> collateralWallet.release(reservationId, delta);
        } else {
            collateralWallet.release(reservationId, delta.negate());
            compensation = () -> collateralWallet.reserve(current.getOwner(), delta.negate());
        }

        commit(current, next, compensation);
        if (next.isCross()) {
            refreshCrossGroup(next.getOwner());
        }

        log.info(
                "Collateral adjusted: id={}, delta={}, collateral={}, liqPrice={}, version={}",
                positionId,
                delta,
                newCollateral,
                next.getLiquidationPrice(),
                next.getVersion());
        MarginPosition committed = snapshot(positionId);
        eventPublisherHelper.publishPositionEvent(this, committed, PositionEventType.COLLATERAL_ADJUSTED);
        return committed;
    }

    // ==============================
    // CLOSE
    // ==============================

    /**
     * Closes {@code quantity} of the position at {@code closePrice}, or all of it when
     * quantity is null or equal to the size.
     *
     * <p>The closed fraction realizes its PnL net of the closing fee and releases its share
     * of collateral in one wallet call. A full close appends a closure record.
     *
     * <p>A loss larger than the released collateral is never forgiven. A partial close
     * takes it from the collateral that stays posted. A full close of a CROSS position
     * debits it from the open siblings, and is refused when they cannot cover it. Any other
     * full close records the gap and raises a CRITICAL shortfall event.
     *
     * @param closePrice null to close at the latest mark
     * @throws VersionConflictException if the position is not OPEN at {@code expectedVersion},
     *     including a retry of a close that already succeeded
     */
    public MarginPosition close(
            String positionId, long expectedVersion, BigDecimal closePrice, CloseReason reason, BigDecimal quantity) {
        MarginPosition current = requireOpenAt(positionId, expectedVersion);
        BigDecimal price = closePrice != null ? closePrice : latestMark(current.getPair());
        if (price.signum() <= 0) {
            throw new ValidationException("Close price must be positive");
        }
        BigDecimal closeQuantity = quantity != null ? quantity : current.getSize();
        if (closeQuantity.signum() <= 0 || closeQuantity.compareTo(current.getSize()) > 0) {
            throw new ValidationException(
                    "Close quantity must be in (0, size]",
                    Map.of("quantity", closeQuantity, "size", current.getSize()));
        }
        boolean fullClose = closeQuantity.compareTo(current.getSize()) == 0;

        BigDecimal grossPnl = price.subtract(current.getEntryPrice())
                .multiply(closeQuantity)
                .multiply(BigDecimal.valueOf(current.getSide().sign()));
        BigDecimal closeFee = fee(closeQuantity.multiply(price));
        BigDecimal releasedCollateral = fullClose
                ? current.getCollateral()
                : current.getCollateral()
                        .multiply(closeQuantity)
                        .divide(current.getSize(), AMOUNT_SCALE, RoundingMode.HALF_UP);
        BigDecimal netPnl = grossPnl.subtract(closeFee);
        BigDecimal settlement = releasedCollateral.add(netPnl);
        BigDecimal shortfall = settlement.signum() < 0 ? settlement.negate() : BigDecimal.ZERO;
        BigDecimal payout = settlement.max(BigDecimal.ZERO);

        List<MarginPosition> siblings = fullClose && shortfall.signum() > 0 && current.isCross()
                ? crossSiblings(current)
                : List.of();
        if (!siblings.isEmpty() && shortfall.compareTo(totalCollateral(siblings)) >= 0) {
            throw new InsufficientCollateralException(
                    String.format(
                            "Closing loss exceeds the cross margin pool by %s; the group is due for liquidation",
                            shortfall.subtract(totalCollateral(siblings))),
                    shortfall,
                    totalCollateral(siblings));
        }

        LocalDateTime now = LocalDateTime.now();
        MarginPosition.MarginPositionBuilder builder = current.toBuilder()
                .realizedPnl(current.getRealizedPnl().add(netPnl))
                .feesAccrued(current.getFeesAccrued().add(closeFee))
                .version(current.getVersion() + 1)
                .lastUpdatedAt(now);
        MarginPosition next;
        if (fullClose) {
            next = builder.status(PositionStatus.CLOSED)
                    .unrealizedPnl(BigDecimal.ZERO)
                    .closedAt(now)
                    .build();
        } else {
            // A loss beyond the closed share's collateral comes out of what stays posted
            BigDecimal remainingCollateral =
                    current.getCollateral().subtract(releasedCollateral).subtract(shortfall);
            if (remainingCollateral.signum() <= 0) {
                throw new ValidationException("Partial close would leave no collateral on the position");
            }
            next = builder.size(current.getSize().subtract(closeQuantity))
                    .collateral(remainingCollateral)
                    .build();
            next.setLiquidationPrice(liquidationPriceFor(next));
        }

        ReservationId reservationId = new ReservationId(current.getReservationId());
        collateralWallet.release(reservationId, payout);
        Runnable compensation = () -> collateralWallet.reserve(current.getOwner(), payout);

        if (fullClose) {
            try {
                historyRecorder.recordClosure(closureRecord(next, price, reason));
            } catch (RuntimeException e) {
                log.error("Closure record write failed for {}, reverting wallet release", positionId, e);
                compensation.run();
                throw e;
            }
        }

        commit(current, next, compensation);
        if (fullClose) {
            positionIndex.remove(current.getPair(), current.getOwner(), positionId);
            if (shortfall.signum() > 0) {
                settleCloseShortfall(next, siblings, shortfall);
            }
        }
        if (current.isCross()) {
            refreshCrossGroup(current.getOwner());
        }

        log.info(
                "Position {}: id={}, reason={}, qty={}, price={}, pnl={}, fee={}, released={}",
                fullClose ? "closed" : "reduced",
                positionId,
                reason,
                closeQuantity,
                price,
                grossPnl,
                closeFee,
                payout);
        MarginPosition committed = snapshot(positionId);
        eventPublisherHelper.publishPositionEvent(
                this, committed, fullClose ? PositionEventType.CLOSED : PositionEventType.REDUCED);
        return committed;
    }

    // ==============================
    // TRIGGERS
    // ==============================

    /**
     * Replaces stop-loss and take-profit. Null clears a level. No wallet movement.
     */
    public MarginPosition updateTriggers(
            String positionId, long expectedVersion, BigDecimal stopLoss, BigDecimal takeProfit) {
        MarginPosition current = requireOpenAt(positionId, expectedVersion);
        validateTriggers(current.getSide(), current.getEntryPrice(), stopLoss, takeProfit);

        MarginPosition next = current.toBuilder()
                .stopLoss(stopLoss)
                .takeProfit(takeProfit)
                .version(current.getVersion() + 1)
                .lastUpdatedAt(LocalDateTime.now())
                .build();
        commit(current, next, () -> {});

        log.info("Triggers updated: id={}, stopLoss={}, takeProfit={}", positionId, stopLoss, takeProfit);
        MarginPosition committed = snapshot(positionId);
        eventPublisherHelper.publishPositionEvent(this, committed, PositionEventType.TRIGGERS_UPDATED);
        return committed;
    }

    // ==============================
    // LIQUIDATE
    // ==============================

    /**
     * Forces the position into LIQUIDATED at {@code markPrice}.
     *
     * <p>Remaining collateral is {@code collateral + unrealizedPnl}. A negative remainder
     * (gap through the liquidation price) is recorded verbatim and the wallet receives a
     * zero release; this never throws. For a CROSS position the gap is debited from the
     * open siblings; when it reaches their combined collateral the whole group is
     * liquidated instead. The liquidation record is flushed to H2 before the terminal state
     * is committed.
     *
     * @param markPrice null to use the latest mark
     * @throws VersionConflictException if the position is not OPEN at {@code expectedVersion}
     */
    public MarginPosition liquidate(
            String positionId, long expectedVersion, BigDecimal markPrice, LiquidationType liquidationType) {
        MarginPosition current = requireOpenAt(positionId, expectedVersion);
        BigDecimal mark = markPrice != null ? markPrice : latestMark(current.getPair());

        Liquidation liquidation = liquidationOf(current, mark, liquidationType);
        BigDecimal remaining = liquidation.liquidationRecord().getRemainingCollateral();
        List<MarginPosition> siblings =
                remaining.signum() < 0 && current.isCross() ? crossSiblings(current) : List.of();
        if (!siblings.isEmpty() && remaining.negate().compareTo(totalCollateral(siblings)) >= 0) {
            log.warn(
                    "Shortfall {} of {} exhausts the cross pool of {}, liquidating the group",
                    remaining.negate(),
                    positionId,
                    current.getOwner());
            Map<String, Long> expectedVersions = new LinkedHashMap<>();
            expectedVersions.put(current.getId(), current.getVersion());
            siblings.forEach(sibling -> expectedVersions.put(sibling.getId(), sibling.getVersion()));
            liquidateCrossGroup(current.getOwner(), expectedVersions, Map.of(current.getPair(), mark), liquidationType);
            return snapshot(positionId);
        }
        BigDecimal payout = remaining.max(BigDecimal.ZERO);

        collateralWallet.release(new ReservationId(current.getReservationId()), payout);
        Runnable compensation = () -> collateralWallet.reserve(current.getOwner(), payout);
        try {
            historyRecorder.recordLiquidation(liquidation.liquidationRecord());
        } catch (RuntimeException e) {
            log.error("Liquidation record write failed for {}, reverting wallet release", positionId, e);
            compensation.run();
            throw e;
        }

        commit(current, liquidation.next(), compensation);
        positionIndex.remove(current.getPair(), current.getOwner(), positionId);
        if (!siblings.isEmpty()) {
            absorbIntoCrossPool(liquidation.next(), siblings, remaining.negate());
        }
        if (current.isCross()) {
            refreshCrossGroup(current.getOwner());
        }

        MarginPosition committed = snapshot(positionId);
        publishLiquidation(committed, liquidation.liquidationRecord(), remaining.signum() < 0 && siblings.isEmpty());
        return committed;
    }

    /**
     * Liquidates an owner's cross positions as one pool.
     *
     * <p>Members no longer OPEN at their expected version are skipped: something else
     * already resolved them. The pool's combined remainder is released in a single wallet
     * call and all records are written in one transaction before any member is committed.
     *
     * @return the liquidated snapshots; empty if every member was already resolved
     */
    public List<MarginPosition> liquidateCrossGroup(
            String owner,
            Map<String, Long> expectedVersions,
            Map<String, BigDecimal> markPrices,
            LiquidationType liquidationType) {
        List<MarginPosition> members = new ArrayList<>();
        for (Map.Entry<String, Long> entry : expectedVersions.entrySet()) {
            Optional<MarginPosition> member = positionTable.get(entry.getKey());
            if (member.isPresent()
                    && member.get().isOpen()
                    && member.get().isCross()
                    && member.get().getOwner().equals(owner)
                    && member.get().getVersion() == entry.getValue()) {
                members.add(member.get());
            } else {
                log.debug("Skipping cross member {}: no longer open at version {}", entry.getKey(), entry.getValue());
            }
        }
        if (members.isEmpty()) {
            return List.of();
        }

        List<Liquidation> liquidations = new ArrayList<>();
        BigDecimal poolRemaining = BigDecimal.ZERO;
        for (MarginPosition member : members) {
            BigDecimal mark = markPrices.containsKey(member.getPair())
                    ? markPrices.get(member.getPair())
                    : priceFeedAdapter.latest(member.getPair()).map(MarkPrice::price).orElse(member.getEntryPrice());
            Liquidation liquidation = liquidationOf(member, mark, liquidationType);
            liquidations.add(liquidation);
            poolRemaining = poolRemaining.add(liquidation.liquidationRecord().getRemainingCollateral());
        }
        BigDecimal payout = poolRemaining.max(BigDecimal.ZERO);

        collateralWallet.release(new ReservationId(members.get(0).getReservationId()), payout);
        Runnable compensation = () -> collateralWallet.reserve(owner, payout);
        try {
            historyRecorder.recordLiquidations(
                    liquidations.stream().map(Liquidation::liquidationRecord).toList());
        } catch (RuntimeException e) {
            log.error("Cross liquidation records failed for {}, reverting wallet release", owner, e);
            compensation.run();
            throw e;
        }

        List<MarginPosition> liquidated = new ArrayList<>();
        for (int i = 0; i < members.size(); i++) {
            MarginPosition member = members.get(i);
            Liquidation liquidation = liquidations.get(i);
            if (!positionTable.compareAndSet(member.getId(), member.getVersion(), liquidation.next())) {
                // Only reachable when a writer bypassed the owner's group lock
                log.error("Cross member {} changed during group liquidation", member.getId());
                continue;
            }
            positionIndex.remove(member.getPair(), owner, member.getId());
            MarginPosition committed = snapshot(member.getId());
            liquidated.add(committed);
            publishLiquidation(committed, liquidation.liquidationRecord(), poolRemaining.signum() < 0);
        }
        refreshCrossGroup(owner);

        Map<String, Object> details = new HashMap<>();
        details.put("owner", owner);
        details.put("positions", liquidated.size());
        details.put("poolRemaining", poolRemaining);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.CROSS_MARGIN_LIQUIDATION,
                RiskLevel.CRITICAL,
                String.format("Cross margin pool of %s liquidated: %d positions", owner, liquidated.size()),
                details);
        log.warn("Cross group liquidated: owner={}, positions={}, poolRemaining={}", owner, liquidated.size(), poolRemaining);
        return liquidated;
    }

    // ==============================
    // QUERIES
    // ==============================

    /** Snapshot with unrealized PnL valued at the latest mark. */
    public MarginPosition getPosition(String positionId) {
        return withUnrealizedPnl(positionTable
                .get(positionId)
                .orElseThrow(() -> ResourceNotFoundException.position(positionId)));
    }

    /** All positions of an owner, open and terminal, newest first. */
    public List<MarginPosition> getPositions(String owner) {
        return positionTable.findByOwner(owner).stream()
                .map(this::withUnrealizedPnl)
                .toList();
    }

    public List<MarginPosition> getOpenPositions(String owner) {
        return positionTable.findOpenByOwner(owner).stream()
                .map(this::withUnrealizedPnl)
                .toList();
    }

    /** Open cross positions of the owner, as stored. */
    public List<MarginPosition> openCrossGroup(String owner) {
        List<MarginPosition> group = new ArrayList<>();
        for (String id : positionIndex.crossPositionsForOwner(owner)) {
            positionTable.get(id).filter(MarginPosition::isOpen).ifPresent(group::add);
        }
        return group;
    }

    // ==============================
    // INTERNALS
    // ==============================

    private MarginPosition requireOpenAt(String positionId, long expectedVersion) {
        MarginPosition current = positionTable
                .get(positionId)
                .orElseThrow(() -> ResourceNotFoundException.position(positionId));
        if (!current.isOpen() || current.getVersion() != expectedVersion) {
            throw new VersionConflictException(
                    positionId, expectedVersion, current.getVersion(), current.getStatus().name());
        }
        return current;
    }

    private void commit(MarginPosition current, MarginPosition next, Runnable compensation) {
        if (positionTable.compareAndSet(current.getId(), current.getVersion(), next)) {
            return;
        }
        try {
            compensation.run();
        } catch (RuntimeException e) {
            log.error("Wallet compensation failed for position {}", current.getId(), e);
        }
        MarginPosition actual = positionTable.get(current.getId()).orElse(current);
        throw new VersionConflictException(
                current.getId(), current.getVersion(), actual.getVersion(), actual.getStatus().name());
    }

    /**
     * Liquidation price of {@code position} as it would stand with its own fields; cross
     * positions are evaluated against the stored group with this snapshot swapped in.
     */
    private BigDecimal liquidationPriceFor(MarginPosition position) {
        List<MarginPosition> group = List.of();
        if (position.isCross()) {
            group = new ArrayList<>();
            for (MarginPosition sibling : openCrossGroup(position.getOwner())) {
                if (!sibling.getId().equals(position.getId())) {
                    group.add(sibling);
                }
            }
            group.add(position);
        }
        MarginCalculation calculation = marginCalculator.liquidationPrice(position, group);
        if (!calculation.isValid()) {
            throw new ComputationInvalidException(position.getId(), calculation.getInvalidReason());
        }
        return calculation.getLiquidationPrice();
    }

    /** Re-derives every open cross sibling's liquidation price after the pool changed. */
    private void refreshCrossGroup(String owner) {
        List<MarginPosition> group = openCrossGroup(owner);
        for (MarginPosition member : group) {
            MarginCalculation calculation = marginCalculator.liquidationPrice(member, group);
            if (calculation.isValid()) {
                positionTable.refreshLiquidationPrice(
                        member.getId(), member.getVersion(), calculation.getLiquidationPrice());
            } else {
                log.error("Cannot refresh liquidation price of {}: {}", member.getId(), calculation.getInvalidReason());
            }
        }
    }

    /** Open cross positions of the owner other than {@code position}. */
    private List<MarginPosition> crossSiblings(MarginPosition position) {
        List<MarginPosition> siblings = new ArrayList<>();
        for (MarginPosition member : openCrossGroup(position.getOwner())) {
            if (!member.getId().equals(position.getId())) {
                siblings.add(member);
            }
        }
        return siblings;
    }

    private static BigDecimal totalCollateral(List<MarginPosition> positions) {
        return positions.stream().map(MarginPosition::getCollateral).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Debits {@code shortfall} from the siblings' collateral pro rata to what each has
     * posted. Every sibling gets a new version and a recomputed liquidation price. The
     * caller holds the owner's cross lock and has checked that the siblings can cover it.
     */
    private void absorbIntoCrossPool(MarginPosition source, List<MarginPosition> siblings, BigDecimal shortfall) {
        BigDecimal pool = totalCollateral(siblings);
        BigDecimal allocated = BigDecimal.ZERO;
        LocalDateTime now = LocalDateTime.now();
        List<MarginPosition> debited = new ArrayList<>();
        for (int i = 0; i < siblings.size(); i++) {
            MarginPosition sibling = siblings.get(i);
            BigDecimal share = i == siblings.size() - 1
                    ? shortfall.subtract(allocated)
                    : shortfall.multiply(sibling.getCollateral()).divide(pool, AMOUNT_SCALE, RoundingMode.HALF_UP);
            allocated = allocated.add(share);
            debited.add(sibling.toBuilder()
                    .collateral(sibling.getCollateral().subtract(share))
                    .version(sibling.getVersion() + 1)
                    .lastUpdatedAt(now)
                    .build());
        }

        Map<String, Object> details = new HashMap<>();
        for (int i = 0; i < debited.size(); i++) {
            MarginPosition sibling = siblings.get(i);
            MarginPosition next = debited.get(i);
            MarginCalculation calculation = marginCalculator.liquidationPrice(next, debited);
            if (calculation.isValid()) {
                next.setLiquidationPrice(calculation.getLiquidationPrice());
            } else {
                log.error("Cannot recompute liquidation price of {}: {}", next.getId(), calculation.getInvalidReason());
            }
            if (!positionTable.compareAndSet(sibling.getId(), sibling.getVersion(), next)) {
                // Only reachable when a writer bypassed the owner's group lock
                log.error("Cross sibling {} changed while absorbing a shortfall", sibling.getId());
                continue;
            }
            details.put(sibling.getId(), sibling.getCollateral().subtract(next.getCollateral()));
            eventPublisherHelper.publishPositionEvent(this, snapshot(sibling.getId()), PositionEventType.COLLATERAL_ADJUSTED);
        }

        log.warn(
                "Shortfall {} of {} absorbed by the cross pool of {}: {}",
                shortfall,
                source.getId(),
                source.getOwner(),
                details);
        Map<String, Object> eventDetails = new HashMap<>();
        eventDetails.put("positionId", source.getId());
        eventDetails.put("owner", source.getOwner());
        eventDetails.put("shortfall", shortfall);
        eventDetails.put("debitedSiblings", details);
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.COLLATERAL_SHORTFALL,
                RiskLevel.WARNING,
                String.format("Shortfall %s of %s absorbed by the cross pool", shortfall, source.getId()),
                eventDetails);
    }

    /** Covers a full close's gap from the cross pool, or reports it as uncovered. */
    private void settleCloseShortfall(MarginPosition closed, List<MarginPosition> siblings, BigDecimal shortfall) {
        if (!siblings.isEmpty()) {
            absorbIntoCrossPool(closed, siblings, shortfall);
            return;
        }
        log.error("Position {} closed with uncovered shortfall {}", closed.getId(), shortfall);
        Map<String, Object> details = new HashMap<>();
        details.put("positionId", closed.getId());
        details.put("owner", closed.getOwner());
        details.put("pair", closed.getPair());
        details.put("shortfall", shortfall);
        details.put("realizedPnl", closed.getRealizedPnl());
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.COLLATERAL_SHORTFALL,
                RiskLevel.CRITICAL,
                String.format("Position %s closed with shortfall %s", closed.getId(), shortfall),
                details);
    }

    private void checkWithdrawal(MarginPosition current, MarginPosition next) {
        LeverageSetting setting = leverageSettingService.getSetting(current.getOwner());
        BigDecimal minimumCollateral = next.notionalAt(next.getEntryPrice())
                .divide(BigDecimal.valueOf(setting.getMaxLeverage()), AMOUNT_SCALE, RoundingMode.HALF_UP);
        if (next.getCollateral().compareTo(minimumCollateral) < 0) {
            throw new InsufficientCollateralException(
                    String.format("Withdrawal would exceed max leverage %dx", setting.getMaxLeverage()),
                    minimumCollateral,
                    next.getCollateral());
        }

        BigDecimal mark = priceFeedAdapter.latest(current.getPair()).map(MarkPrice::price).orElse(current.getEntryPrice());
        MarginCalculation calculation;
        if (next.isCross()) {
            List<MarginPosition> group = new ArrayList<>();
            for (MarginPosition sibling : openCrossGroup(next.getOwner())) {
                group.add(sibling.getId().equals(next.getId()) ? next : sibling);
            }
            Map<String, BigDecimal> marks = new HashMap<>(priceFeedAdapter.latestPrices(
                    group.stream().map(MarginPosition::getPair).toList()));
            marks.put(next.getPair(), mark);
            calculation = marginCalculator.evaluateCross(group, marks);
        } else {
            calculation = marginCalculator.evaluate(next, mark);
        }
        if (calculation.breaches(marginCalculator.maintenanceRate())) {
            throw new InsufficientCollateralException(
                    "Withdrawal would put the position below maintenance margin",
                    current.getCollateral().subtract(next.getCollateral()),
                    current.getCollateral());
        }
    }

    private void validateTriggers(PositionSide side, BigDecimal entryPrice, BigDecimal stopLoss, BigDecimal takeProfit) {
        boolean isLong = side == PositionSide.LONG;
        if (stopLoss != null && (isLong ? stopLoss.compareTo(entryPrice) >= 0 : stopLoss.compareTo(entryPrice) <= 0)) {
            throw new ValidationException(
                    String.format("Stop-loss %s must be %s entry price %s", stopLoss, isLong ? "below" : "above", entryPrice),
                    Map.of("field", "stopLoss"));
        }
        if (takeProfit != null
                && (isLong ? takeProfit.compareTo(entryPrice) <= 0 : takeProfit.compareTo(entryPrice) >= 0)) {
            throw new ValidationException(
                    String.format(
                            "Take-profit %s must be %s entry price %s", takeProfit, isLong ? "above" : "below", entryPrice),
                    Map.of("field", "takeProfit"));
        }
    }

    private Liquidation liquidationOf(MarginPosition current, BigDecimal mark, LiquidationType liquidationType) {
        BigDecimal grossPnl = marginCalculator.unrealizedPnl(current, mark);
        BigDecimal remaining = current.getCollateral().add(grossPnl);
        BigDecimal loss = current.getCollateral().subtract(remaining);
        LocalDateTime now = LocalDateTime.now();

        LiquidationRecord liquidationRecord = LiquidationRecord.builder()
                .positionId(current.getId())
                .owner(current.getOwner())
                .pair(current.getPair())
                .side(current.getSide())
                .marginMode(current.getMarginMode())
                .leverage(current.getLeverage())
                .entryPrice(current.getEntryPrice())
                .liquidationPrice(current.getLiquidationPrice())
                .markPrice(mark)
                .size(current.getSize())
                .collateral(current.getCollateral())
                .lossAmount(loss)
                .remainingCollateral(remaining)
                .liquidationType(liquidationType)
                .liquidatedAt(now)
                .build();

        MarginPosition next = current.toBuilder()
                .status(PositionStatus.LIQUIDATED)
                .realizedPnl(current.getRealizedPnl().add(grossPnl))
                .unrealizedPnl(BigDecimal.ZERO)
                .version(current.getVersion() + 1)
                .lastUpdatedAt(now)
                .closedAt(now)
                .build();
        return new Liquidation(next, liquidationRecord);
    }

    /**
     * @param uncovered true when nothing absorbed a negative remainder, so the gap is a
     *     loss to the platform
     */
    private void publishLiquidation(MarginPosition liquidated, LiquidationRecord liquidationRecord, boolean uncovered) {
        log.warn(
                "Position liquidated: id={}, owner={}, type={}, mark={}, loss={}, remaining={}",
                liquidated.getId(),
                liquidated.getOwner(),
                liquidationRecord.getLiquidationType(),
                liquidationRecord.getMarkPrice(),
                liquidationRecord.getLossAmount(),
                liquidationRecord.getRemainingCollateral());
        eventPublisherHelper.publishPositionEvent(this, liquidated, PositionEventType.LIQUIDATED);

        Map<String, Object> details = new HashMap<>();
        details.put("positionId", liquidated.getId());
        details.put("owner", liquidated.getOwner());
        details.put("pair", liquidated.getPair());
        details.put("lossAmount", liquidationRecord.getLossAmount());
        details.put("remainingCollateral", liquidationRecord.getRemainingCollateral());
        details.put("liquidationType", liquidationRecord.getLiquidationType().name());
        eventPublisherHelper.publishRiskEvent(
                this,
                RiskEventType.POSITION_LIQUIDATED,
                uncovered ? RiskLevel.CRITICAL : RiskLevel.WARNING,
                uncovered
                        ? String.format(
                                "Position %s liquidated with shortfall %s",
                                liquidated.getId(), liquidationRecord.getRemainingCollateral().negate())
                        : String.format("Position %s liquidated", liquidated.getId()),
                details);
    }

    private ClosureRecord closureRecord(MarginPosition closed, BigDecimal closePrice, CloseReason reason) {
        return ClosureRecord.builder()
                .positionId(closed.getId())
                .owner(closed.getOwner())
                .pair(closed.getPair())
                .side(closed.getSide())
                .leverage(closed.getLeverage())
                .entryPrice(closed.getEntryPrice())
                .closePrice(closePrice)
                .size(closed.getSize())
                .realizedPnl(closed.getRealizedPnl())
                .feesAccrued(closed.getFeesAccrued())
                .reason(reason)
                .closedAt(closed.getClosedAt())
                .build();
    }

    private MarginPosition withUnrealizedPnl(MarginPosition position) {
        if (position.isOpen()) {
            priceFeedAdapter
                    .latest(position.getPair())
                    .ifPresent(mark -> position.setUnrealizedPnl(marginCalculator.unrealizedPnl(position, mark.price())));
        }
        return position;
    }

    private MarginPosition snapshot(String positionId) {
        return withUnrealizedPnl(positionTable
                .get(positionId)
                .orElseThrow(() -> ResourceNotFoundException.position(positionId)));
    }

    private BigDecimal latestMark(String pair) {
        return priceFeedAdapter
                .latest(pair)
                .map(MarkPrice::price)
                .orElseThrow(() -> new PairUnavailableException(pair, "no mark price available"));
    }

    private BigDecimal fee(BigDecimal notional) {
        return notional.multiply(marginProperties.getTradingFeeRate()).setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    private record Liquidation(MarginPosition next, LiquidationRecord liquidationRecord) {}
}
