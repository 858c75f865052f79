package com.marginengine.exception;

import java.util.Map;

/**
 * A request variant was malformed (missing field, non-positive amount, trigger on the wrong side).
 */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
