package com.storeflow.billingservice.controller;

import com.storeflow.billingservice.dto.request.CreatePaymentRequest;
import com.storeflow.billingservice.security.SecurityUtils;
import com.storeflow.billingservice.service.PaymentService;
import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.model.PaymentStatus;
import com.storeflow.common.model.PaymentType;
import com.storeflow.common.repository.PaymentFilter;
import jakarta.validation.Valid;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/billing/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Record and list customer and supplier payments")
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping
    public ResponseEntity<PaymentRecord> recordPayment(@Valid @RequestBody CreatePaymentRequest request) {
        PaymentRecord payment = paymentService.recordPayment(request, SecurityUtils.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(payment);
    }

    @GetMapping
    public ResponseEntity<List<PaymentRecord>> listPayments(
            @RequestParam(required = false) PaymentType type,
            @RequestParam(required = false) PaymentStatus status,
            @RequestParam(required = false) String invoiceId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        PaymentFilter filter = PaymentFilter.builder()
                .type(type)
                .status(status)
                .relatedInvoiceId(invoiceId)
                .isoDate(date == null ? null : date.toString())
                .build();
        return ResponseEntity.ok(paymentService.listPayments(filter));
    }
}
