package com.marginengine.position.command;

import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.exception.ValidationException;
import java.math.BigDecimal;

/**
 * Forces a single position into LIQUIDATED.
 *
 * @param markPrice mark at trigger time; null to use the latest accepted mark
 */
public record LiquidatePositionCommand(
        String positionId, long expectedVersion, BigDecimal markPrice, LiquidationType liquidationType)
        implements PositionCommand {

    public LiquidatePositionCommand {
        Commands.requireText(positionId, "positionId");
        Commands.requireVersion(expectedVersion);
        Commands.requirePositiveIfPresent(markPrice, "markPrice");
        if (liquidationType == null) {
            throw new ValidationException("liquidationType is required");
        }
    }
}
