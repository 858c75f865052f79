package com.marginengine.entity;

import com.marginengine.domain.enums.CloseReason;
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
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the position_closures table. One row per fully closed position.
 */
@Entity
@Table(name = "position_closures", indexes = @Index(name = "idx_closure_owner", columnList = "owner"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ClosureRecordEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "position_id", length = 36, nullable = false, unique = true)
    private String positionId;

    @Column(length = 64, nullable = false)
    private String owner;

    @Column(length = 20)
    private String pair;

    @Enumerated(EnumType.STRING)
    @Column(length = 5)
    private PositionSide side;

    private int leverage;

    @Column(name = "entry_price", precision = 24, scale = 8)
    private BigDecimal entryPrice;

    @Column(name = "close_price", precision = 24, scale = 8)
    private BigDecimal closePrice;

    @Column(precision = 24, scale = 8)
    private BigDecimal size;

    @Column(name = "realized_pnl", precision = 24, scale = 8)
    private BigDecimal realizedPnl;

    @Column(name = "fees_accrued", precision = 24, scale = 8)
    private BigDecimal feesAccrued;

    @Enumerated(EnumType.STRING)
    @Column(length = 12)
    private CloseReason reason;

    @Column(name = "closed_at")
    private LocalDateTime closedAt;
}
