package com.marginengine.exception;

import java.util.Map;

public class InvalidLeverageException extends BaseException {

    public InvalidLeverageException(int requested, int maxLeverage) {
        super(
                ErrorCode.INVALID_LEVERAGE,
                String.format("Leverage %dx is outside the allowed range [1, %d]", requested, maxLeverage),
                Map.of("requested", requested, "maxLeverage", maxLeverage));
    }
}
