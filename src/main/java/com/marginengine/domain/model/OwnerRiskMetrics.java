package com.marginengine.domain.model;

import com.marginengine.domain.enums.RiskTier;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Aggregated risk dashboard data for one owner.
 */
@Value
@Builder
public class OwnerRiskMetrics {

    String owner;
    int openPositions;
    BigDecimal totalCollateral;
    BigDecimal totalUnrealizedPnl;
    BigDecimal totalNotional;

    /** Worst tier across the owner's open positions, SAFE when there are none. */
    RiskTier overallTier;

    List<PositionRisk> positions;
}
