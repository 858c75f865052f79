package com.marginengine.margin;

import java.math.BigDecimal;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a margin computation. Either valid with all applicable figures filled in,
 * or computation-invalid with a reason and no figures.
 *
 * <p>Figures that do not apply to the computation performed are null: a pure
 * liquidation-price computation carries no mark-dependent values, and an aggregate
 * cross-margin evaluation carries no single liquidation price.
 */
@Value
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MarginCalculation {

    boolean valid;
    String invalidReason;

    BigDecimal unrealizedPnl;

    /** Collateral + unrealized PnL. */
    BigDecimal equity;

    /** Size x mark price. */
    BigDecimal notional;

    /** Equity / notional. */
    BigDecimal marginRatio;

    BigDecimal liquidationPrice;

    public static MarginCalculation invalid(String reason) {
        return MarginCalculation.builder().valid(false).invalidReason(reason).build();
    }

    /** True when the margin ratio has fallen to or below the maintenance rate. */
    public boolean breaches(BigDecimal maintenanceRate) {
        return valid && marginRatio != null && marginRatio.compareTo(maintenanceRate) <= 0;
    }
}
