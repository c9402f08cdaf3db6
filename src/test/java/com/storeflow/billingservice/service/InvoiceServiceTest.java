package com.storeflow.billingservice.service;

import com.storeflow.billingservice.dto.request.CreatePaymentRequest;
import com.storeflow.billingservice.dto.response.InvoiceBalanceResponse;
import com.storeflow.billingservice.exception.ResourceNotFoundException;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.model.PaymentStatus;
import com.storeflow.common.model.PaymentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static com.storeflow.billingservice.service.BillingTestFixture.line;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InvoiceServiceTest {

    private BillingTestFixture fixture;
    private InvoiceService invoiceService;

    @BeforeEach
    void setUp() {
        fixture = new BillingTestFixture();
        invoiceService = fixture.invoiceService();
        fixture.product("p1", "100.00", 50);
        fixture.customer("local", "29ABCDE1234F1Z5");
    }

    @Test
    void getInvoice_missing_isNotFound() {
        assertThatThrownBy(() -> invoiceService.getInvoice("inv_missing"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void listInvoices_newestFirst() {
        Invoice older = fixture.coordinator().createBill("local", List.of(line("p1", 1)), "user_1");
        fixture.store.set("invoices", older.getInvoiceId(), Map.of(
                "invoiceId", older.getInvoiceId(), "isoDate", "2026-10-01T09:00:00+05:30", "status", "PENDING"));
        Invoice newer = fixture.coordinator().createBill("local", List.of(line("p1", 2)), "user_1");

        assertThat(invoiceService.listInvoices()).extracting(Invoice::getInvoiceId)
                .containsExactly(newer.getInvoiceId(), older.getInvoiceId());
    }

    @Test
    void updateStatus_manualChangeIsAlwaysAllowed() {
        Invoice invoice = fixture.coordinator().createBill("local", List.of(line("p1", 1)), "user_1");

        invoiceService.updateStatus(invoice.getInvoiceId(), InvoiceStatus.CANCELLED);
        Invoice reopened = invoiceService.updateStatus(invoice.getInvoiceId(), InvoiceStatus.PENDING);

        assertThat(reopened.getStatus()).isEqualTo(InvoiceStatus.PENDING);
        assertThat(invoiceService.getInvoice(invoice.getInvoiceId()).getStatus()).isEqualTo(InvoiceStatus.PENDING);
        assertThat(invoiceService.getInvoice(invoice.getInvoiceId()).getUpdatedIsoDate()).startsWith("2026-10-19");
    }

    @Test
    void getBalance_recomputesFromPayments() {
        Invoice invoice = fixture.coordinator().createBill("local", List.of(line("p1", 10)), "user_1");
        CreatePaymentRequest payment = new CreatePaymentRequest();
        payment.setType(PaymentType.CUSTOMER);
        payment.setRelatedInvoiceId(invoice.getInvoiceId());
        payment.setAmountPaid(new BigDecimal("1180.00"));
        payment.setStatus(PaymentStatus.COMPLETED);
        fixture.paymentService().recordPayment(payment, "user_1");

        InvoiceBalanceResponse balance = invoiceService.getBalance(invoice.getInvoiceId());

        assertThat(balance.getGrandTotal()).isEqualByComparingTo("1180.00");
        assertThat(balance.getAmountPaid()).isEqualByComparingTo("1180.00");
        assertThat(balance.getRemainingBalance()).isEqualByComparingTo("0");
        assertThat(balance.getPaymentCount()).isEqualTo(1);
        assertThat(balance.getProjectedStatus()).isEqualTo(InvoiceStatus.PAID);
    }
}
