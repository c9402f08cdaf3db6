package com.storeflow.billingservice.dto.request;

import com.storeflow.common.model.InvoiceLine;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Body for creating a bill and for editing one. On edit, {@code expectedPreviousItems} carries
 * the items the client loaded; the edit is refused if the stored bill has moved on since.
 */
@Data
public class CommitBillRequest {

    @NotBlank(message = "No customer selected")
    private String customerId;

    @Valid
    @NotEmpty(message = "Cart is empty")
    private List<BillItemDto> items;

    @Valid
    private List<BillItemDto> expectedPreviousItems;

    public List<InvoiceLine> toLines() {
        return toLines(items);
    }

    public List<InvoiceLine> toExpectedPreviousLines() {
        return expectedPreviousItems == null ? null : toLines(expectedPreviousItems);
    }

    private static List<InvoiceLine> toLines(List<BillItemDto> dtos) {
        return dtos.stream().map(BillItemDto::toLine).collect(Collectors.toList());
    }
}
