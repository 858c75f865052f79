package com.marginengine.domain.model;

import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable audit entry written exactly once per liquidation.
 *
 * <p>{@code remainingCollateral} is negative when the mark gapped through the
 * liquidation price and the loss exceeded the posted collateral (shortfall).
 */
@Value
@Builder
public class LiquidationRecord {

    Long id;
    String positionId;
    String owner;
    String pair;
    PositionSide side;
    MarginMode marginMode;
    int leverage;
    BigDecimal entryPrice;
    BigDecimal liquidationPrice;
    BigDecimal markPrice;
    BigDecimal size;
    BigDecimal collateral;
    BigDecimal lossAmount;
    BigDecimal remainingCollateral;
    LiquidationType liquidationType;
    LocalDateTime liquidatedAt;

    public boolean isShortfall() {
        return remainingCollateral.signum() < 0;
    }
}
