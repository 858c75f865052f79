package com.marginengine.domain.model;

import com.marginengine.domain.enums.RiskTier;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time risk view of one open position against the latest mark price.
 */
@Value
@Builder
public class PositionRisk {

    String positionId;
    String pair;
    BigDecimal markPrice;
    BigDecimal liquidationPrice;
    BigDecimal unrealizedPnl;
    BigDecimal marginRatio;

    /** |mark - liquidation| / mark x 100. */
    BigDecimal distanceToLiquidationPercent;

    RiskTier riskTier;
}
