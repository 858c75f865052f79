package com.marginengine.exception;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Raised by the collateral wallet when the owner's free balance cannot cover a reservation.
 * The ledger translates it into {@link InsufficientCollateralException} for callers.
 */
public class InsufficientFundsException extends BaseException {

    public InsufficientFundsException(String owner, BigDecimal requested, BigDecimal available) {
        super(
                ErrorCode.INSUFFICIENT_COLLATERAL,
                String.format("Owner %s has %s available, %s requested", owner, available, requested),
                Map.of("owner", owner, "requested", requested, "available", available));
    }
}
