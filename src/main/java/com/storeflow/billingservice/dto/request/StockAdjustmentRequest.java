package com.storeflow.billingservice.dto.request;

import com.storeflow.common.model.StockAdjustmentMode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StockAdjustmentRequest {
    @NotNull
    private StockAdjustmentMode mode;
    @Min(0)
    private int value;
}
