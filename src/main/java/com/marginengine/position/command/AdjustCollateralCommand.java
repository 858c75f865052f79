package com.marginengine.position.command;

import com.marginengine.exception.ValidationException;
import java.math.BigDecimal;

/**
 * Adds (positive delta) or withdraws (negative delta) collateral.
 */
public record AdjustCollateralCommand(String positionId, long expectedVersion, BigDecimal delta)
        implements PositionCommand {

    public AdjustCollateralCommand {
        Commands.requireText(positionId, "positionId");
        Commands.requireVersion(expectedVersion);
        if (delta == null || delta.signum() == 0) {
            throw new ValidationException("delta must be non-zero");
        }
    }
}
