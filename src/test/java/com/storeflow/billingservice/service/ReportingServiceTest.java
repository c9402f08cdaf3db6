package com.storeflow.billingservice.service;

import com.storeflow.billingservice.dto.request.CreatePaymentRequest;
import com.storeflow.billingservice.dto.response.DashboardSummaryResponse;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.model.PaymentStatus;
import com.storeflow.common.model.PaymentType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static com.storeflow.billingservice.service.BillingTestFixture.line;
import static org.assertj.core.api.Assertions.assertThat;

class ReportingServiceTest {

    private BillingTestFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new BillingTestFixture();
        fixture.product("p1", "100.00", 30);
        fixture.product("p2", "50.00", 3);
        fixture.product("p3", "10.00", 0);
        fixture.customer("walkin", null);
    }

    @Test
    void getDashboard_summarisesTodayAndOutstandingBalances() {
        BillTransactionCoordinator coordinator = fixture.coordinator();
        Invoice paid = coordinator.createBill("walkin", List.of(line("p1", 2)), "user_1");        // 200.00
        Invoice partial = coordinator.createBill("walkin", List.of(line("p1", 3)), "user_1");     // 300.00
        Invoice cancelled = coordinator.createBill("walkin", List.of(line("p1", 1)), "user_1");   // 100.00
        fixture.invoiceService().updateStatus(cancelled.getInvoiceId(), InvoiceStatus.CANCELLED);

        PaymentService payments = fixture.paymentService();
        payments.recordPayment(payment(PaymentType.CUSTOMER, paid.getInvoiceId(), "200.00", PaymentStatus.COMPLETED), "user_1");
        payments.recordPayment(payment(PaymentType.CUSTOMER, partial.getInvoiceId(), "120.00", PaymentStatus.RECEIVED), "user_1");
        payments.recordPayment(payment(PaymentType.SUPPLIER, null, "75.00", PaymentStatus.PENDING), "user_1");

        DashboardSummaryResponse dashboard = fixture.reportingService().getDashboard();

        assertThat(dashboard.getDate()).isEqualTo(LocalDate.of(2026, 10, 19));
        assertThat(dashboard.getTodayBillCount()).isEqualTo(2);
        assertThat(dashboard.getTodaySalesTotal()).isEqualByComparingTo("500.00");
        assertThat(dashboard.getOutstandingInvoiceCount()).isEqualTo(1);
        assertThat(dashboard.getOutstandingBalanceTotal()).isEqualByComparingTo("180.00");
        assertThat(dashboard.getPayments().getReceivedToday()).isEqualByComparingTo("320.00");
        assertThat(dashboard.getPayments().getPendingToSuppliers()).isEqualByComparingTo("75.00");
        // p1 is down to 24, p2 is low, p3 is out
        assertThat(dashboard.getLowStockCount()).isEqualTo(1);
        assertThat(dashboard.getOutOfStockCount()).isEqualTo(1);
    }

    private static CreatePaymentRequest payment(PaymentType type, String relatedId, String amount, PaymentStatus status) {
        CreatePaymentRequest request = new CreatePaymentRequest();
        request.setType(type);
        request.setRelatedInvoiceId(relatedId);
        request.setAmountPaid(new BigDecimal(amount));
        request.setStatus(status);
        return request;
    }
}
