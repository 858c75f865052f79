package com.marginengine.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Error codes with their HTTP status. {@code retryable} marks failures a client may resend
 * after re-reading state (a fresh version, the next accepted tick).
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400, false),
    BAD_REQUEST("BAD_REQUEST", 400, false),
    NOT_FOUND("NOT_FOUND", 404, false),
    VERSION_CONFLICT("VERSION_CONFLICT", 409, true),
    INVALID_LEVERAGE("INVALID_LEVERAGE", 422, false),
    INSUFFICIENT_COLLATERAL("INSUFFICIENT_COLLATERAL", 422, false),
    PAIR_UNAVAILABLE("PAIR_UNAVAILABLE", 422, true),
    COMPUTATION_INVALID("COMPUTATION_INVALID", 500, false),
    INTERNAL_ERROR("INTERNAL_ERROR", 500, false);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;
}
