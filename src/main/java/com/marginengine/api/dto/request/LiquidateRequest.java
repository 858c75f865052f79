package com.marginengine.api.dto.request;

import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.exception.ValidationException;
import com.marginengine.position.command.LiquidatePositionCommand;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for an operator-forced or owner-requested liquidation. Always settles at the
 * latest accepted mark. AUTO is reserved for the liquidation monitor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiquidateRequest {

    @NotNull
    @PositiveOrZero
    private Long expectedVersion;

    @NotNull
    private LiquidationType liquidationType;

    public LiquidatePositionCommand toCommand(String positionId) {
        if (liquidationType == LiquidationType.AUTO) {
            throw new ValidationException("AUTO liquidations are issued by the engine only");
        }
        return new LiquidatePositionCommand(positionId, expectedVersion, null, liquidationType);
    }
}
