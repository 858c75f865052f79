package com.marginengine.position.command;

import com.marginengine.exception.ValidationException;
import java.math.BigDecimal;
import java.util.Map;

/** Shared constructor checks for the command records. */
final class Commands {

    private Commands() {}

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required", Map.of("field", field));
        }
    }

    static void requirePositive(BigDecimal value, String field) {
        if (value == null || value.signum() <= 0) {
            throw new ValidationException(field + " must be positive", Map.of("field", field));
        }
    }

    static void requirePositiveIfPresent(BigDecimal value, String field) {
        if (value != null && value.signum() <= 0) {
            throw new ValidationException(field + " must be positive when set", Map.of("field", field));
        }
    }

    static void requireVersion(long expectedVersion) {
        if (expectedVersion < 0) {
            throw new ValidationException("expectedVersion must not be negative");
        }
    }
}
