package com.marginengine.position;

import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.model.MarginPosition;
import com.marginengine.exception.ResourceNotFoundException;
import com.marginengine.exception.VersionConflictException;
import com.marginengine.observability.MarginMetricsService;
import com.marginengine.position.command.AdjustCollateralCommand;
import com.marginengine.position.command.ClosePositionCommand;
import com.marginengine.position.command.LiquidateCrossGroupCommand;
import com.marginengine.position.command.LiquidatePositionCommand;
import com.marginengine.position.command.OpenPositionCommand;
import com.marginengine.position.command.PositionCommand;
import com.marginengine.position.command.UpdateTriggersCommand;
import com.marginengine.settings.LeverageSettingService;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Serializes state-changing commands per position.
 *
 * <p>ISOLATED positions are locked by position id. CROSS positions share one lock per
 * owner, because a mutation of one member changes the liquidation price of every other
 * member. Commands on unrelated keys never wait on each other.
 *
 * <p>The lock only makes the ledger's read-modify-write sequence uninterruptible; the
 * expected-version check inside the ledger still decides which of two racing commands
 * wins. The loser gets a {@link VersionConflictException}.
 */
@Component
public class ExecutionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ExecutionCoordinator.class);

    private final PositionLedger positionLedger;
    private final PositionTable positionTable;
    private final LeverageSettingService leverageSettingService;
    private final MarginMetricsService marginMetricsService;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ExecutionCoordinator(
            PositionLedger positionLedger,
            PositionTable positionTable,
            LeverageSettingService leverageSettingService,
            MarginMetricsService marginMetricsService) {
        this.positionLedger = positionLedger;
        this.positionTable = positionTable;
        this.leverageSettingService = leverageSettingService;
        this.marginMetricsService = marginMetricsService;
    }

    /**
     * Runs one command under the lock of the position (or cross group) it targets.
     *
     * @return the committed snapshot
     */
    public MarginPosition execute(PositionCommand command) {
        if (command instanceof OpenPositionCommand open) {
            return open(open);
        }
        if (command instanceof AdjustCollateralCommand adjust) {
            return onPosition(adjust.positionId(), () -> positionLedger.adjustCollateral(
                    adjust.positionId(), adjust.expectedVersion(), adjust.delta()));
        }
        if (command instanceof ClosePositionCommand close) {
            return onPosition(close.positionId(), () -> positionLedger.close(
                    close.positionId(), close.expectedVersion(), close.closePrice(), close.reason(), close.quantity()));
        }
        if (command instanceof UpdateTriggersCommand triggers) {
            return onPosition(triggers.positionId(), () -> positionLedger.updateTriggers(
                    triggers.positionId(), triggers.expectedVersion(), triggers.stopLoss(), triggers.takeProfit()));
        }
        if (command instanceof LiquidatePositionCommand liquidate) {
            return onPosition(liquidate.positionId(), () -> positionLedger.liquidate(
                    liquidate.positionId(),
                    liquidate.expectedVersion(),
                    liquidate.markPrice(),
                    liquidate.liquidationType()));
        }
        throw new IllegalArgumentException("Unsupported command: " + command.getClass().getSimpleName());
    }

    /** Liquidates an owner's cross group under the owner's cross lock. */
    public List<MarginPosition> execute(LiquidateCrossGroupCommand command) {
        return withLock(crossKey(command.owner()), () -> positionLedger.liquidateCrossGroup(
                command.owner(), command.expectedVersions(), command.markPrices(), command.liquidationType()));
    }

    /** Number of lock entries currently held in memory. */
    int lockCount() {
        return locks.size();
    }

    private MarginPosition open(OpenPositionCommand command) {
        MarginMode mode = command.marginMode() != null
                ? command.marginMode()
                : leverageSettingService.getSetting(command.owner()).getDefaultMarginMode();
        OpenPositionCommand resolved = command.withMarginMode(mode);
        if (mode == MarginMode.CROSS) {
            return withLock(crossKey(command.owner()), () -> positionLedger.open(resolved));
        }
        // A new isolated position has no key anyone else can contend on yet
        return positionLedger.open(resolved);
    }

    private MarginPosition onPosition(String positionId, Supplier<MarginPosition> mutation) {
        MarginPosition target = positionTable
                .get(positionId)
                .orElseThrow(() -> ResourceNotFoundException.position(positionId));
        String key = target.isCross() ? crossKey(target.getOwner()) : positionId;

        MarginPosition result = withLock(key, mutation);
        if (!target.isCross() && !result.isOpen()) {
            // Terminal rows reject every further write by version, the lock is no longer needed
            locks.remove(key);
        }
        return result;
    }

    private <T> T withLock(String key, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } catch (VersionConflictException e) {
            marginMetricsService.recordVersionConflict();
            log.warn("Version conflict on {}: {}", key, e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private static String crossKey(String owner) {
        return "cross:" + owner;
    }
}
