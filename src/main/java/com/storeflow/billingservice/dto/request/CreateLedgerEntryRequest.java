package com.storeflow.billingservice.dto.request;

import com.storeflow.common.model.LedgerEntityType;
import com.storeflow.common.model.LedgerEntryType;
import com.storeflow.common.model.LedgerPaymentStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDate;
import java.util.List;

@Data
public class CreateLedgerEntryRequest {

    // Defaults to today.
    private LocalDate date;

    @NotNull(message = "Entry type is required.")
    private LedgerEntryType type;

    @NotNull
    private LedgerEntityType entityType;

    private String entityId;
    private String entityName;

    @Valid
    @NotEmpty(message = "At least one item is required.")
    private List<BillItemDto> items;

    private String paymentMethod;

    @NotNull
    private LedgerPaymentStatus paymentStatus;

    private String notes;
}
