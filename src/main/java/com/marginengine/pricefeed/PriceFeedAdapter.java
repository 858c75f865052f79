package com.marginengine.pricefeed;

import com.marginengine.domain.model.MarkPrice;
import com.marginengine.event.EventPublisherHelper;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes oracle ticks into canonical {@link MarkPrice} values and owns the latest
 * accepted mark per symbol.
 *
 * <p>The oracle is at-least-once and may reorder: a tick is accepted only when its
 * timestamp is strictly newer than the last accepted tick for the same symbol.
 * Duplicates and late ticks are counted and dropped without publishing.
 *
 * <p>Acceptance is a single {@code ConcurrentHashMap.compute} per symbol, so concurrent
 * feeders for different symbols never contend and two feeders racing on one symbol
 * cannot both win with out-of-order timestamps.
 */
@Component
public class PriceFeedAdapter {

    private static final Logger log = LoggerFactory.getLogger(PriceFeedAdapter.class);

    private final EventPublisherHelper eventPublisherHelper;

    private final Map<String, MarkPrice> latest = new ConcurrentHashMap<>();
    private final AtomicLong staleTicks = new AtomicLong();

    public PriceFeedAdapter(EventPublisherHelper eventPublisherHelper) {
        this.eventPublisherHelper = eventPublisherHelper;
    }

    /**
     * Ingests one oracle tick.
     *
     * @return true if the tick was accepted and published, false if dropped
     */
    public boolean onTick(String rawSymbol, BigDecimal price, Instant timestamp) {
        if (rawSymbol == null || price == null || timestamp == null || price.signum() <= 0) {
            log.warn("Dropping malformed tick: symbol={}, price={}, timestamp={}", rawSymbol, price, timestamp);
            return false;
        }

        MarkPrice candidate = new MarkPrice(normalizeSymbol(rawSymbol), price, timestamp);
        boolean[] accepted = new boolean[1];
        latest.compute(candidate.symbol(), (symbol, current) -> {
            if (candidate.isNewerThan(current)) {
                accepted[0] = true;
                return candidate;
            }
            return current;
        });

        if (!accepted[0]) {
            staleTicks.incrementAndGet();
            log.debug("Dropping stale tick for {} at {}", candidate.symbol(), timestamp);
            return false;
        }

        eventPublisherHelper.publishMarkPrice(this, candidate);
        return true;
    }

    public Optional<MarkPrice> latest(String pair) {
        return Optional.ofNullable(latest.get(normalizeSymbol(pair)));
    }

    /** Latest mark price for each of the given pairs that has one. */
    public Map<String, BigDecimal> latestPrices(Collection<String> pairs) {
        Map<String, BigDecimal> prices = new HashMap<>();
        for (String pair : pairs) {
            MarkPrice markPrice = latest.get(normalizeSymbol(pair));
            if (markPrice != null) {
                prices.put(markPrice.symbol(), markPrice.price());
            }
        }
        return prices;
    }

    public long getStaleTickCount() {
        return staleTicks.get();
    }

    /** "eth-usdt", "ETH_USDT" and "ETH/USDT" all map to "ETH/USDT". */
    public static String normalizeSymbol(String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT).replace('-', '/').replace('_', '/');
    }
}
