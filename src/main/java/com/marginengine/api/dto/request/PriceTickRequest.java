package com.marginengine.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One oracle tick. A missing timestamp is stamped with the receive time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceTickRequest {

    @NotBlank
    private String symbol;

    @NotNull
    @Positive
    private BigDecimal price;

    private Instant timestamp;
}
