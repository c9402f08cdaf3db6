package com.storeflow.billingservice.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Custom exception thrown when a bill or ledger commit cannot be completed because one or
 * more products do not have enough quantity in stock.
 * <p>
 * This is a recoverable business rule violation: the whole commit was aborted and nothing was
 * written. It maps to a 409 Conflict HTTP status and carries every violating product, so the
 * caller can correct all lines at once.
 */
@ResponseStatus(HttpStatus.CONFLICT)
public class InsufficientStockException extends RuntimeException {

    private final List<StockShortfall> shortfalls;

    public InsufficientStockException(List<StockShortfall> shortfalls) {
        super(describe(shortfalls));
        this.shortfalls = List.copyOf(shortfalls);
    }

    public List<StockShortfall> getShortfalls() {
        return shortfalls;
    }

    private static String describe(List<StockShortfall> shortfalls) {
        return "Insufficient stock for " + shortfalls.stream()
                .map(s -> s.getProductId() + " (Required: " + s.getRequested() + ", Available: " + s.getAvailable() + ")")
                .collect(Collectors.joining(", "));
    }
}
