package com.storeflow.billingservice.controller;

import com.storeflow.billingservice.dto.request.StockAdjustmentRequest;
import com.storeflow.billingservice.dto.response.ProductStockResponse;
import com.storeflow.billingservice.service.StockService;
import jakarta.validation.Valid;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/billing/stock")
@RequiredArgsConstructor
@Tag(name = "Stock", description = "Stock levels and manual stock corrections")
public class StockController {

    private final StockService stockService;

    @GetMapping
    public ResponseEntity<List<ProductStockResponse>> listStock() {
        return ResponseEntity.ok(stockService.listStock());
    }

    @PatchMapping("/{productId}")
    public ResponseEntity<ProductStockResponse> adjustStock(@PathVariable String productId, @Valid @RequestBody StockAdjustmentRequest request) {
        return ResponseEntity.ok(stockService.adjustStock(productId, request));
    }
}
