package com.marginengine.margin;

import com.marginengine.domain.enums.MarginMode;
import java.math.BigDecimal;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * Engine-wide margin parameters loaded from {@code marginengine.*} properties.
 *
 * <p>Rates are fractions, not percentages: a maintenance rate of 0.005 means
 * 0.5% of notional must remain as equity for a position to stay open.
 */
@Value
@Builder
public class MarginProperties {

    /** Minimum equity as a fraction of notional. Margin ratio at or below this liquidates. */
    BigDecimal maintenanceRate;

    /** Fee charged on notional at open and at every close. */
    BigDecimal tradingFeeRate;

    /** Distance-to-liquidation (percent of mark) inside which warnings are raised. */
    BigDecimal warningDistancePercent;

    /** Tradable pair symbols, e.g. "ETH/USDT". */
    Set<String> pairs;

    /** Hard ceiling on any owner's max leverage. */
    int platformMaxLeverage;

    int defaultMaxLeverage;
    int defaultPreferredLeverage;
    MarginMode defaultMarginMode;
}
