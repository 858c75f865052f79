package com.marginengine.exception;

import java.math.BigDecimal;
import java.util.Map;

public class InsufficientCollateralException extends BaseException {

    public InsufficientCollateralException(String message) {
        super(ErrorCode.INSUFFICIENT_COLLATERAL, message);
    }

    public InsufficientCollateralException(String message, BigDecimal required, BigDecimal provided) {
        super(ErrorCode.INSUFFICIENT_COLLATERAL, message, Map.of("required", required, "provided", provided));
    }
}
