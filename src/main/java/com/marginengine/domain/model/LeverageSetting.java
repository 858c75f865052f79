package com.marginengine.domain.model;

import com.marginengine.domain.enums.MarginMode;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Account-level guardrails for one owner. Read on every open and adjust request.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LeverageSetting {

    private String owner;
    private int maxLeverage;
    private int preferredLeverage;
    private MarginMode defaultMarginMode;

    /** Stored and returned for clients only. Cross groups are always liquidated all at once. */
    private boolean autoDeleverageEnabled;

    private boolean liquidationWarningEnabled;
    private LocalDateTime updatedAt;
}
