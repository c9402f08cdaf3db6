package com.storeflow.billingservice.controller;

import com.storeflow.billingservice.dto.request.CommitBillRequest;
import com.storeflow.billingservice.dto.request.UpdateInvoiceStatusRequest;
import com.storeflow.billingservice.dto.response.InvoiceBalanceResponse;
import com.storeflow.billingservice.security.SecurityUtils;
import com.storeflow.billingservice.service.BillTransactionCoordinator;
import com.storeflow.billingservice.service.InvoiceService;
import com.storeflow.common.model.Invoice;
import jakarta.validation.Valid;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/billing/invoices")
@RequiredArgsConstructor
@Tag(name = "Billing", description = "Create, edit, delete and inspect bills")
public class BillingController {

    private final BillTransactionCoordinator billTransactionCoordinator;
    private final InvoiceService invoiceService;

    @Operation(
            summary = "Create a bill",
            description = "Prices the items, computes GST for the customer's state and takes the items out of stock in one atomic commit.",
            responses = {
                    @ApiResponse(responseCode = "201", description = "Bill created"),
                    @ApiResponse(responseCode = "400", description = "No customer, empty cart or malformed item"),
                    @ApiResponse(responseCode = "404", description = "Unknown customer or product"),
                    @ApiResponse(responseCode = "409", description = "Not enough stock; every short product is listed")
            }
    )
    @PostMapping
    public ResponseEntity<Invoice> createBill(@Valid @RequestBody CommitBillRequest request) {
        Invoice invoice = billTransactionCoordinator.createBill(request.getCustomerId(), request.toLines(), SecurityUtils.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(invoice);
    }

    @Operation(
            summary = "Edit a bill",
            description = "Re-diffs the bill's items against what was billed before and moves only the difference in and out of stock.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Bill updated"),
                    @ApiResponse(responseCode = "409", description = "Not enough stock, bill cancelled, or bill changed since it was loaded")
            }
    )
    @PutMapping("/{invoiceId}")
    public ResponseEntity<Invoice> updateBill(@PathVariable String invoiceId, @Valid @RequestBody CommitBillRequest request) {
        Invoice invoice = billTransactionCoordinator.updateBill(invoiceId, request.getCustomerId(),
                request.toExpectedPreviousLines(), request.toLines(), SecurityUtils.getUserId());
        return ResponseEntity.ok(invoice);
    }

    @GetMapping
    public ResponseEntity<List<Invoice>> listInvoices() {
        return ResponseEntity.ok(invoiceService.listInvoices());
    }

    @GetMapping("/{invoiceId}")
    public ResponseEntity<Invoice> getInvoice(@PathVariable String invoiceId) {
        return ResponseEntity.ok(invoiceService.getInvoice(invoiceId));
    }

    @Operation(summary = "Balance recomputed from the bill's payments")
    @GetMapping("/{invoiceId}/balance")
    public ResponseEntity<InvoiceBalanceResponse> getBalance(@PathVariable String invoiceId) {
        return ResponseEntity.ok(invoiceService.getBalance(invoiceId));
    }

    @PatchMapping("/{invoiceId}/status")
    public ResponseEntity<Invoice> updateStatus(@PathVariable String invoiceId, @Valid @RequestBody UpdateInvoiceStatusRequest request) {
        return ResponseEntity.ok(invoiceService.updateStatus(invoiceId, request.getStatus()));
    }

    @DeleteMapping("/{invoiceId}")
    public ResponseEntity<Void> deleteBill(@PathVariable String invoiceId) {
        billTransactionCoordinator.deleteBill(invoiceId);
        return ResponseEntity.noContent().build();
    }
}
