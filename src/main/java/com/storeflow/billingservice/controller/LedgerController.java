package com.storeflow.billingservice.controller;

import com.storeflow.billingservice.dto.request.CreateLedgerEntryRequest;
import com.storeflow.billingservice.security.SecurityUtils;
import com.storeflow.billingservice.service.LedgerService;
import com.storeflow.common.model.LedgerEntry;
import jakarta.validation.Valid;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/billing/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Daily sales and purchase ledger")
public class LedgerController {

    private final LedgerService ledgerService;
    private final Clock clock;

    @PostMapping
    public ResponseEntity<LedgerEntry> recordEntry(@Valid @RequestBody CreateLedgerEntryRequest request) {
        LedgerEntry entry = ledgerService.recordEntry(request, SecurityUtils.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping
    public ResponseEntity<List<LedgerEntry>> listEntries(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(ledgerService.listEntries(date != null ? date : LocalDate.now(clock)));
    }
}
