package com.marginengine.entity;

import com.marginengine.domain.enums.LiquidationType;
import com.marginengine.domain.enums.MarginMode;
import com.marginengine.domain.enums.PositionSide;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the liquidation_history table. Append-only; the unique constraint on
 * position_id backs the one-record-per-liquidation rule at the storage level.
 */
@Entity
@Table(
        name = "liquidation_history",
        uniqueConstraints = @UniqueConstraint(name = "uk_liquidation_position", columnNames = "position_id"),
        indexes = {
            @Index(name = "idx_liquidation_owner", columnList = "owner"),
            @Index(name = "idx_liquidation_liquidated_at", columnList = "liquidated_at")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LiquidationRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "position_id", length = 36, nullable = false)
    private String positionId;

    @Column(length = 64, nullable = false)
    private String owner;

    @Column(length = 20)
    private String pair;

    @Enumerated(EnumType.STRING)
    @Column(length = 5)
    private PositionSide side;

    @Enumerated(EnumType.STRING)
    @Column(name = "margin_mode", length = 10)
    private MarginMode marginMode;

    private int leverage;

    @Column(name = "entry_price", precision = 24, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "liquidation_price", precision = 24, scale = 8)
    private BigDecimal liquidationPrice;

    @Column(name = "mark_price", precision = 24, scale = 8)
    private BigDecimal markPrice;

    @Column(precision = 24, scale = 8)
    private BigDecimal size;

    @Column(precision = 24, scale = 8)
    private BigDecimal collateral;

    @Column(name = "loss_amount", precision = 24, scale = 8)
    private BigDecimal lossAmount;

    /** Negative on a shortfall liquidation. */
    @Column(name = "remaining_collateral", precision = 24, scale = 8)
    private BigDecimal remainingCollateral;

    @Enumerated(EnumType.STRING)
    @Column(name = "liquidation_type", length = 10)
    private LiquidationType liquidationType;

    @Column(name = "liquidated_at")
    private LocalDateTime liquidatedAt;
}
