package com.storeflow.billingservice.dto.request;

import com.storeflow.common.model.InvoiceStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class UpdateInvoiceStatusRequest {
    @NotNull(message = "Status is required.")
    private InvoiceStatus status;
}
