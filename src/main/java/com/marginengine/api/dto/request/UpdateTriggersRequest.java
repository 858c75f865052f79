package com.marginengine.api.dto.request;

import com.marginengine.position.command.UpdateTriggersCommand;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO replacing stop-loss and take-profit. A null level clears it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateTriggersRequest {

    @NotNull
    @PositiveOrZero
    private Long expectedVersion;

    @Positive
    private BigDecimal stopLoss;

    @Positive
    private BigDecimal takeProfit;

    public UpdateTriggersCommand toCommand(String positionId) {
        return new UpdateTriggersCommand(positionId, expectedVersion, stopLoss, takeProfit);
    }
}
