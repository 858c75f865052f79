package com.marginengine.domain.model;

import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import com.marginengine.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A leveraged exposure to one trading pair.
 *
 * <p>Instances handed out by the {@link com.marginengine.position.PositionLedger} are
 * detached snapshots: the ledger stores its own copy and replaces it wholesale on every
 * mutation, so a reader never sees a half-applied change. Mutating a snapshot has no
 * effect on the stored position.
 *
 * <p>{@code liquidationPrice} is derived from collateral, size, leverage and (for CROSS)
 * the owner's sibling positions; the ledger recomputes it in the same write that changes
 * any of those inputs.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MarginPosition {

    private String id;
    private String owner;

    /** Canonical pair symbol, e.g. "ETH/USDT". */
    private String pair;

    private PositionSide side;
    private int leverage;
    private BigDecimal entryPrice;

    /** Quantity in base currency. */
    private BigDecimal size;

    /** Margin posted, in quote currency. */
    private BigDecimal collateral;

    private MarginMode marginMode;
    private BigDecimal liquidationPrice;

    /** Derived from the latest accepted mark price when the snapshot is read. */
    private BigDecimal unrealizedPnl;

    /** Net of fees, accumulated over partial and full closes. */
    private BigDecimal realizedPnl;

    private BigDecimal feesAccrued;

    private BigDecimal stopLoss;
    private BigDecimal takeProfit;

    private PositionStatus status;

    /** Incremented on every successful mutation; used for optimistic concurrency. */
    private long version;

    /** Wallet reservation backing this position's collateral. */
    private String reservationId;

    private LocalDateTime openedAt;
    private LocalDateTime lastUpdatedAt;
    private LocalDateTime closedAt;

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }

    public boolean isCross() {
        return marginMode == MarginMode.CROSS;
    }

    /** Size x price. */
    public BigDecimal notionalAt(BigDecimal price) {
        return size.multiply(price);
    }

    /** Returns a detached deep-enough copy (all fields are immutable values). */
    public MarginPosition copy() {
        return toBuilder().build();
    }
}
