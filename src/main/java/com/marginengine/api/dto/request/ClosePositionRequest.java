package com.marginengine.api.dto.request;

import com.marginengine.domain.enums.CloseReason;
import com.marginengine.position.command.ClosePositionCommand;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a manual close. Omit {@code quantity} to close the whole position.
 * Owner closes always settle at the latest accepted mark; a price in the body is ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosePositionRequest {

    @NotNull
    @PositiveOrZero
    private Long expectedVersion;

    @Positive
    private BigDecimal quantity;

    public ClosePositionCommand toCommand(String positionId) {
        return new ClosePositionCommand(positionId, expectedVersion, null, CloseReason.MANUAL, quantity);
    }
}
