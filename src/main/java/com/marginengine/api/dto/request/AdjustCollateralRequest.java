package com.marginengine.api.dto.request;

import com.marginengine.position.command.AdjustCollateralCommand;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for adding (positive delta) or withdrawing (negative delta) collateral.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustCollateralRequest {

    @NotNull
    @PositiveOrZero
    private Long expectedVersion;

    @NotNull
    private BigDecimal delta;

    public AdjustCollateralCommand toCommand(String positionId) {
        return new AdjustCollateralCommand(positionId, expectedVersion, delta);
    }
}
