package com.marginengine.position.command;

import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Map;

/**
 * Liquidates an owner's cross-margin positions together, as one pool.
 *
 * <p>Issued only by the liquidation monitor, so it is not part of the
 * {@link PositionCommand} hierarchy accepted from external callers.
 *
 * @param expectedVersions position id to the version observed when the breach was detected
 * @param markPrices pair to mark price used for the evaluation
 */
public record LiquidateCrossGroupCommand(
        String owner,
        Map<String, Long> expectedVersions,
        Map<String, BigDecimal> markPrices,
        LiquidationType liquidationType) {

    public LiquidateCrossGroupCommand {
        Commands.requireText(owner, "owner");
        if (expectedVersions == null || expectedVersions.isEmpty()) {
            throw new ValidationException("expectedVersions must not be empty");
        }
        if (liquidationType == null) {
            throw new ValidationException("liquidationType is required");
        }
        expectedVersions = Map.copyOf(expectedVersions);
        markPrices = markPrices != null ? Map.copyOf(markPrices) : Map.of();
    }
}
