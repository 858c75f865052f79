package com.marginengine.position.command;

import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import com.marginengine.exception.ValidationException;
import java.math.BigDecimal;

/**
 * Opens a new position at the pair's latest mark price.
 *
 * @param marginMode null to use the owner's default margin mode
 * @param stopLoss optional
 * @param takeProfit optional
 */
public record OpenPositionCommand(
        String owner,
        String pair,
        PositionSide side,
        int leverage,
        BigDecimal size,
        BigDecimal collateral,
        MarginMode marginMode,
        BigDecimal stopLoss,
        BigDecimal takeProfit)
        implements PositionCommand {

    public OpenPositionCommand {
        Commands.requireText(owner, "owner");
        Commands.requireText(pair, "pair");
        if (side == null) {
            throw new ValidationException("side is required");
        }
        Commands.requirePositive(size, "size");
        Commands.requirePositive(collateral, "collateral");
        Commands.requirePositiveIfPresent(stopLoss, "stopLoss");
        Commands.requirePositiveIfPresent(takeProfit, "takeProfit");
    }

    public OpenPositionCommand withMarginMode(MarginMode resolvedMode) {
        return new OpenPositionCommand(
                owner, pair, side, leverage, size, collateral, resolvedMode, stopLoss, takeProfit);
    }
}
