package com.marginengine.position;

import com.marginengine.domain.model.MarginPosition;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Arena of position snapshots keyed by position id.
 *
 * <p>Rows are replaced whole, never edited in place. Every write is a version
 * compare-and-swap executed inside {@code ConcurrentHashMap.compute}, so a reader sees
 * either the previous or the next snapshot and a stale writer always loses.
 * Returned snapshots are copies.
 */
@Component
public class PositionTable {

    private final Map<String, MarginPosition> rows = new ConcurrentHashMap<>();

    public Optional<MarginPosition> get(String positionId) {
        MarginPosition row = rows.get(positionId);
        return row != null ? Optional.of(row.copy()) : Optional.empty();
    }

    /**
     * Inserts a new row.
     *
     * @throws IllegalStateException if the id is already taken
     */
    public void insert(MarginPosition position) {
        MarginPosition previous = rows.putIfAbsent(position.getId(), position.copy());
        if (previous != null) {
            throw new IllegalStateException("Position id already exists: " + position.getId());
        }
    }

    /**
     * Replaces the row only if it is still OPEN at {@code expectedVersion}.
     *
     * @return false if the row is missing, terminal or at a different version
     */
    public boolean compareAndSet(String positionId, long expectedVersion, MarginPosition next) {
        boolean[] swapped = new boolean[1];
        rows.computeIfPresent(positionId, (id, current) -> {
            if (current.isOpen() && current.getVersion() == expectedVersion) {
                swapped[0] = true;
                return next.copy();
            }
            return current;
        });
        return swapped[0];
    }

    /**
     * Rewrites the derived liquidation price of an open row without a version bump.
     * Used when a cross sibling changed the shared pool.
     */
    public boolean refreshLiquidationPrice(String positionId, long expectedVersion, BigDecimal liquidationPrice) {
        boolean[] refreshed = new boolean[1];
        rows.computeIfPresent(positionId, (id, current) -> {
            if (current.isOpen() && current.getVersion() == expectedVersion) {
                refreshed[0] = true;
                return current.toBuilder().liquidationPrice(liquidationPrice).build();
            }
            return current;
        });
        return refreshed[0];
    }

    /** All positions of an owner, newest first. */
    public List<MarginPosition> findByOwner(String owner) {
        return rows.values().stream()
                .filter(p -> p.getOwner().equals(owner))
                .sorted(Comparator.comparing(MarginPosition::getOpenedAt).reversed())
                .map(MarginPosition::copy)
                .toList();
    }

    public List<MarginPosition> findOpenByOwner(String owner) {
        return rows.values().stream()
                .filter(p -> p.isOpen() && p.getOwner().equals(owner))
                .map(MarginPosition::copy)
                .toList();
    }

    public long openCount() {
        return rows.values().stream().filter(MarginPosition::isOpen).count();
    }
}
