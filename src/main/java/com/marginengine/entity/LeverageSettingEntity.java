package com.marginengine.entity;

import com.marginengine.domain.enums.MarginMode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity for the leverage_settings table. One row per owner; owners without a row
 * fall back to the configured defaults.
 */
@Entity
@Table(name = "leverage_settings")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LeverageSettingEntity {

    @Id
    @Column(length = 64)
    private String owner;

    @Column(name = "max_leverage")
    private int maxLeverage;

    @Column(name = "preferred_leverage")
    private int preferredLeverage;

    @Enumerated(EnumType.STRING)
    @Column(name = "default_margin_mode", length = 10)
    private MarginMode defaultMarginMode;

    @Column(name = "auto_deleverage_enabled")
    private boolean autoDeleverageEnabled;

    @Column(name = "liquidation_warning_enabled")
    private boolean liquidationWarningEnabled;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
