package com.marginengine.domain.model;

import com.marginengine.domain.enums.CloseReason;
import com.marginengine.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable audit entry for a position that was fully closed (manually or by a trigger).
 */
@Value
@Builder
public class ClosureRecord {

    Long id;
    String positionId;
    String owner;
    String pair;
    PositionSide side;
    int leverage;
    BigDecimal entryPrice;
    BigDecimal closePrice;
    BigDecimal size;
    BigDecimal realizedPnl;
    BigDecimal feesAccrued;
    CloseReason reason;
    LocalDateTime closedAt;
}
