package com.marginengine.position.command;

import java.math.BigDecimal;

/**
 * Replaces the stop-loss and take-profit levels. A null level clears it.
 */
public record UpdateTriggersCommand(String positionId, long expectedVersion, BigDecimal stopLoss, BigDecimal takeProfit)
        implements PositionCommand {

    public UpdateTriggersCommand {
        Commands.requireText(positionId, "positionId");
        Commands.requireVersion(expectedVersion);
        Commands.requirePositiveIfPresent(stopLoss, "stopLoss");
        Commands.requirePositiveIfPresent(takeProfit, "takeProfit");
    }
}
