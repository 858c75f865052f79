package com.marginengine.exception;

import java.util.Map;

/**
 * An open position's snapshot cannot be evaluated (zero size or non-positive collateral).
 * Indicates an upstream invariant violation rather than bad caller input.
 */
public class ComputationInvalidException extends BaseException {

    public ComputationInvalidException(String positionId, String reason) {
        super(
                ErrorCode.COMPUTATION_INVALID,
                String.format("Position %s cannot be evaluated: %s", positionId, reason),
                Map.of("positionId", positionId, "reason", reason));
    }
}
