package com.marginengine.pricefeed;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Routing index from trading pair to open position ids, plus owner to open CROSS
 * position ids.
 *
 * <p>Read on every tick, written only when a position opens or terminates.
 * ConcurrentHashMap with CopyOnWriteArrayList values gives lock-free iteration on the
 * tick path; a write for one pair never stalls evaluation of another.
 */
@Component
public class PositionIndex {

    private static final Logger log = LoggerFactory.getLogger(PositionIndex.class);

    private final Map<String, CopyOnWriteArrayList<String>> byPair = new ConcurrentHashMap<>();
    private final Map<String, CopyOnWriteArrayList<String>> crossByOwner = new ConcurrentHashMap<>();

    public void add(String pair, String owner, String positionId, boolean cross) {
        addTo(byPair, pair, positionId);
        if (cross) {
            addTo(crossByOwner, owner, positionId);
        }
        log.debug("Indexed position {} on {} (cross={})", positionId, pair, cross);
    }

    public void remove(String pair, String owner, String positionId) {
        removeFrom(byPair, pair, positionId);
        removeFrom(crossByOwner, owner, positionId);
        log.debug("Unindexed position {} on {}", positionId, pair);
    }

    /** Open position ids quoted in {@code pair}. Never null. */
    public List<String> positionsForPair(String pair) {
        List<String> ids = byPair.get(pair);
        return ids != null ? ids : List.of();
    }

    /** Open CROSS position ids of {@code owner}. Never null. */
    public List<String> crossPositionsForOwner(String owner) {
        List<String> ids = crossByOwner.get(owner);
        return ids != null ? ids : List.of();
    }

    public Set<String> indexedPairs() {
        return byPair.keySet();
    }

    public int size() {
        return byPair.values().stream().mapToInt(List::size).sum();
    }

    private void addTo(Map<String, CopyOnWriteArrayList<String>> index, String key, String positionId) {
        index.compute(key, (k, ids) -> {
            CopyOnWriteArrayList<String> target = ids != null ? ids : new CopyOnWriteArrayList<>();
            target.addIfAbsent(positionId);
            return target;
        });
    }

    private void removeFrom(Map<String, CopyOnWriteArrayList<String>> index, String key, String positionId) {
        // Atomic with addTo so an add never lands in a list that was just dropped
        index.computeIfPresent(key, (k, ids) -> {
            ids.remove(positionId);
            return ids.isEmpty() ? null : ids;
        });
    }
}
