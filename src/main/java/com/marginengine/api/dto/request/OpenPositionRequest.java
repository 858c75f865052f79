package com.marginengine.api.dto.request;

import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import com.marginengine.position.command.OpenPositionCommand;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for opening a margin position. Entry price is the pair's latest mark.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenPositionRequest {

    @NotBlank
    private String owner;

    /** "ETH/USDT", "eth-usdt" and "ETH_USDT" are all accepted. */
    @NotBlank
    private String pair;

    @NotNull
    private PositionSide side;

    /** Range is checked against the owner's leverage settings, not here. */
    @NotNull
    private Integer leverage;

    @NotNull
    @Positive
    private BigDecimal size;

    @NotNull
    @Positive
    private BigDecimal collateral;

    /** Null for the owner's default margin mode. */
    private MarginMode marginMode;

    private BigDecimal stopLoss;
    private BigDecimal takeProfit;

    public OpenPositionCommand toCommand() {
        return new OpenPositionCommand(
                owner, pair, side, leverage, size, collateral, marginMode, stopLoss, takeProfit);
    }
}
