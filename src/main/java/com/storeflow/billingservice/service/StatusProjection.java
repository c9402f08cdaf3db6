package com.storeflow.billingservice.service;

import com.storeflow.billingservice.config.BillingProperties;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.model.StockStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Display statuses derived from stored numbers. Nothing here is persisted.
 */
@Component
@RequiredArgsConstructor
public class StatusProjection {

    private final BillingProperties properties;
    private final InvoiceStatusMachine statusMachine;

    public StockStatus stockStatus(int stock) {
        if (stock <= 0) {
            return StockStatus.OUT_OF_STOCK;
        }
        if (stock < properties.getLowStockThreshold()) {
            return StockStatus.LOW_STOCK;
        }
        return StockStatus.IN_STOCK;
    }

    public InvoiceStatus invoiceStatus(Invoice invoice, BalanceSummary balance) {
        return statusMachine.applyDerived(invoice.getStatus(), balance.getDerivedStatus());
    }
}
