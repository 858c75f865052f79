package com.marginengine.api.dto.response;

import com.marginengine.domain.model.LiquidationRecord;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Liquidation history page with its total count.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LiquidationHistoryResponse {

    private List<LiquidationRecord> records;
    private long total;

    public static LiquidationHistoryResponse of(List<LiquidationRecord> records) {
        return new LiquidationHistoryResponse(records, records.size());
    }
}
