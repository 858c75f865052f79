package com.marginengine.api.dto.request;

import com.marginengine.domain.enums.MarginMode;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Partial update of an owner's leverage settings. Null fields keep their current value.
 */
@Data
public class LeverageSettingRequest {

    @Min(1)
    private Integer maxLeverage;

    @Min(1)
    private Integer preferredLeverage;

    private MarginMode defaultMarginMode;
    private Boolean autoDeleverageEnabled;
    private Boolean liquidationWarningEnabled;
}
