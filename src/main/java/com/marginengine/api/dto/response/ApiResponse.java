package com.marginengine.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.marginengine.domain.model.MarginPosition;
import java.time.Instant;
import lombok.Getter;

/**
 * Success envelope. When the payload is a single position its version is lifted to the
 * top level; that is the {@code expectedVersion} of the next mutation.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private final boolean success;
    private final T data;
    private final Long version;
    private final Instant timestamp;

    private ApiResponse(T data, Long version) {
        this.success = true;
        this.data = data;
        this.version = version;
        this.timestamp = Instant.now();
    }

    public static <T> ApiResponse<T> of(T data) {
        Long version = data instanceof MarginPosition position ? position.getVersion() : null;
        return new ApiResponse<>(data, version);
    }
}
