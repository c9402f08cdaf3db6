package com.storeflow.billingservice.service;

import com.storeflow.billingservice.config.BillingProperties;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.model.StockStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class StatusProjectionTest {

    private final BillingProperties properties = new BillingProperties();
    private final StatusProjection projection = new StatusProjection(properties, new InvoiceStatusMachine());

    @Test
    void stockStatus_usesConfiguredThreshold() {
        assertThat(projection.stockStatus(0)).isEqualTo(StockStatus.OUT_OF_STOCK);
        assertThat(projection.stockStatus(-3)).isEqualTo(StockStatus.OUT_OF_STOCK);
        assertThat(projection.stockStatus(9)).isEqualTo(StockStatus.LOW_STOCK);
        assertThat(projection.stockStatus(10)).isEqualTo(StockStatus.IN_STOCK);

        properties.setLowStockThreshold(3);
        assertThat(projection.stockStatus(5)).isEqualTo(StockStatus.IN_STOCK);
    }

    @Test
    void invoiceStatus_overdueInvoiceNotMovedByPartialPayment() {
        Invoice overdue = Invoice.builder().invoiceId("inv_1").status(InvoiceStatus.OVERDUE).build();
        BalanceSummary partial = new BalanceSummary(new BigDecimal("100.00"), new BigDecimal("40.00"),
                new BigDecimal("60.00"), 1, InvoiceStatus.PARTIALLY_PAID);
        BalanceSummary full = new BalanceSummary(new BigDecimal("100.00"), new BigDecimal("100.00"),
                BigDecimal.ZERO, 1, InvoiceStatus.PAID);

        assertThat(projection.invoiceStatus(overdue, partial)).isEqualTo(InvoiceStatus.OVERDUE);
        assertThat(projection.invoiceStatus(overdue, full)).isEqualTo(InvoiceStatus.PAID);
    }
}
