package com.marginengine.unit.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.marginengine.domain.enums.CloseReason;
import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import com.marginengine.exception.ValidationException;
import com.marginengine.position.command.AdjustCollateralCommand;
import com.marginengine.position.command.ClosePositionCommand;
import com.marginengine.position.command.LiquidateCrossGroupCommand;
import com.marginengine.position.command.LiquidatePositionCommand;
import com.marginengine.position.command.OpenPositionCommand;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PositionCommandTest {

    @Test
    void openRejectsMissingOwnerAndNonPositiveAmounts() {
        assertThatThrownBy(() -> new OpenPositionCommand(
                        " ", "ETH/USDT", PositionSide.LONG, 10, BigDecimal.ONE, BigDecimal.TEN, null, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("owner");
        assertThatThrownBy(() -> new OpenPositionCommand(
                        "alice", "ETH/USDT", PositionSide.LONG, 10, BigDecimal.ZERO, BigDecimal.TEN, null, null, null))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("size");
        assertThatThrownBy(() -> new OpenPositionCommand(
                        "alice", "ETH/USDT", null, 10, BigDecimal.ONE, BigDecimal.TEN, null, null, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void withMarginModeKeepsEveryOtherField() {
        OpenPositionCommand command = new OpenPositionCommand(
                "alice",
                "ETH/USDT",
                PositionSide.SHORT,
                5,
                BigDecimal.ONE,
                new BigDecimal("400"),
                null,
                new BigDecimal("2100"),
                null);

        OpenPositionCommand resolved = command.withMarginMode(MarginMode.CROSS);

        assertThat(resolved.marginMode()).isEqualTo(MarginMode.CROSS);
        assertThat(resolved.stopLoss()).isEqualByComparingTo("2100");
        assertThat(resolved.leverage()).isEqualTo(5);
    }

    @Test
    void adjustRejectsZeroDelta() {
        assertThatThrownBy(() -> new AdjustCollateralCommand("p-1", 0, BigDecimal.ZERO))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void negativeVersionIsRejected() {
        assertThatThrownBy(() -> new ClosePositionCommand("p-1", -1, null, CloseReason.MANUAL, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> new LiquidatePositionCommand("p-1", -1, null, LiquidationType.FORCED))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void crossGroupCommandCopiesItsMaps() {
        Map<String, Long> versions = new HashMap<>(Map.of("p-1", 2L));
        LiquidateCrossGroupCommand command =
                new LiquidateCrossGroupCommand("alice", versions, null, LiquidationType.AUTO);
        versions.put("p-2", 0L);

        assertThat(command.expectedVersions()).containsOnlyKeys("p-1");
        assertThat(command.markPrices()).isEmpty();
    }

    @Test
    void crossGroupCommandNeedsMembers() {
        assertThatThrownBy(() -> new LiquidateCrossGroupCommand("alice", Map.of(), Map.of(), LiquidationType.AUTO))
                .isInstanceOf(ValidationException.class);
    }
}
