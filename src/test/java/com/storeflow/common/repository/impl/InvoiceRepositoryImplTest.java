package com.storeflow.common.repository.impl;

import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceLine;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.store.impl.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InvoiceRepositoryImplTest {

    private final InMemoryDocumentStore store = new InMemoryDocumentStore();
    private final InvoiceRepositoryImpl repository = new InvoiceRepositoryImpl(store);

    @Test
    void saveInTransaction_persistsMoneyAsMinorUnits() {
        Invoice invoice = Invoice.builder()
                .invoiceId("inv_1")
                .invoiceNumber("INV-20261019-ABC123")
                .customerId("c1")
                .customerName("Asha Traders")
                .lines(List.of(InvoiceLine.builder().productId("p1").name("Rice 5kg").unitOfMeasure("bag")
                        .quantity(3).unitPrice(new BigDecimal("333.33")).lineTotal(new BigDecimal("999.99")).build()))
                .subTotal(new BigDecimal("999.99"))
                .cgst(new BigDecimal("90.00"))
                .sgst(new BigDecimal("90.00"))
                .igst(new BigDecimal("0.00"))
                .grandTotal(new BigDecimal("1179.99"))
                .status(InvoiceStatus.PENDING)
                .createdIsoDate("2026-10-19T10:00:00+05:30")
                .createdBy("user_1")
                .build();

        store.runTransaction(transaction -> {
            repository.saveInTransaction(transaction, invoice);
            return null;
        });

        Map<String, Object> document = store.get("invoices", "inv_1").orElseThrow();
        assertThat(document).containsEntry("grandTotalMinor", 117999L).containsEntry("isoDate", "2026-10-19T10:00:00+05:30");
        assertThat(repository.findById("inv_1")).contains(invoice);
    }

    @Test
    void updateStatusInTransaction_touchesOnlyStatusFields() {
        store.set("invoices", "inv_1", Map.of("invoiceId", "inv_1", "status", "PENDING", "grandTotalMinor", 1000L));

        store.runTransaction(transaction -> {
            repository.updateStatusInTransaction(transaction, "inv_1", InvoiceStatus.PAID, "2026-10-19T11:00:00+05:30");
            return null;
        });

        Invoice loaded = repository.findById("inv_1").orElseThrow();
        assertThat(loaded.getStatus()).isEqualTo(InvoiceStatus.PAID);
        assertThat(loaded.getUpdatedIsoDate()).isEqualTo("2026-10-19T11:00:00+05:30");
        assertThat(loaded.getGrandTotal()).isEqualByComparingTo("10.00");
    }
}
