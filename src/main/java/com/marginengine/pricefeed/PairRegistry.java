package com.marginengine.pricefeed;

import com.marginengine.margin.MarginProperties;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Tradable pairs, as configured by {@code marginengine.pairs}.
 */
@Component
public class PairRegistry {

    private final Set<String> pairs;

    public PairRegistry(MarginProperties marginProperties) {
        this.pairs = marginProperties.getPairs();
    }

    public boolean isTradable(String pair) {
        return pair != null && pairs.contains(PriceFeedAdapter.normalizeSymbol(pair));
    }

    public Set<String> getPairs() {
        return pairs;
    }
}
