package com.marginengine.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.marginengine.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Error envelope. A version conflict also carries the position's current version so the
 * client can re-read and resend without a separate lookup.
 */
@Getter
public class ApiErrorResponse {

    private final boolean success = false;
    private final ErrorDetail error;

    private ApiErrorResponse(ErrorDetail error) {
        this.error = error;
    }

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        ErrorDetail errorDetail = ErrorDetail.builder()
                .code(errorCode.getCode())
                .message(message)
                .retryable(errorCode.isRetryable())
                .currentVersion(errorCode == ErrorCode.VERSION_CONFLICT ? actualVersion(details) : null)
                .details(details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(errorDetail);
    }

    private static Long actualVersion(Map<String, Object> details) {
        if (details != null && details.get("actualVersion") instanceof Number version) {
            return version.longValue();
        }
        return null;
    }

    @Getter
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {
        private final String code;
        private final String message;
        private final boolean retryable;
        private final Long currentVersion;
        private final Map<String, Object> details;
        private final Instant timestamp;
        private final String path;
    }
}
