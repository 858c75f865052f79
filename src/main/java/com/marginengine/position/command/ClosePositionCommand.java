package com.marginengine.position.command;

import com.marginengine.domain.enums.CloseReason;
import com.marginengine.exception.ValidationException;
import java.math.BigDecimal;

/**
 * Closes a position fully, or partially when {@code quantity} is less than its size.
 *
 * @param closePrice null to close at the latest mark price
 * @param quantity null to close the whole position
 */
public record ClosePositionCommand(
        String positionId, long expectedVersion, BigDecimal closePrice, CloseReason reason, BigDecimal quantity)
        implements PositionCommand {

    public ClosePositionCommand {
        Commands.requireText(positionId, "positionId");
        Commands.requireVersion(expectedVersion);
        if (reason == null) {
            throw new ValidationException("reason is required");
        }
        Commands.requirePositiveIfPresent(closePrice, "closePrice");
        Commands.requirePositiveIfPresent(quantity, "quantity");
    }
}
