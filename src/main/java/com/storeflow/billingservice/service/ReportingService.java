package com.storeflow.billingservice.service;

import com.storeflow.billingservice.dto.response.DashboardSummaryResponse;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.model.Product;
import com.storeflow.common.model.StockStatus;
import com.storeflow.common.repository.InvoiceRepository;
import com.storeflow.common.repository.PaymentRepository;
import com.storeflow.common.repository.ProductRepository;
import com.storeflow.common.util.IsoDates;
import com.storeflow.common.util.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Dashboard figures. Everything is recomputed from the stored invoices, payments and products on
 * each call; no running totals are kept.
 */
@Service
@RequiredArgsConstructor
public class ReportingService {

    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final ProductRepository productRepository;
    private final PaymentReconciler paymentReconciler;
    private final StatusProjection statusProjection;
    private final Clock clock;

    public DashboardSummaryResponse getDashboard() {
        LocalDate today = IsoDates.today(clock);
        List<PaymentRecord> payments = paymentRepository.findAll();
        List<Invoice> invoices = invoiceRepository.findAll();
        List<Product> products = productRepository.findAll();

        Map<String, List<PaymentRecord>> paymentsByInvoice = payments.stream()
                .filter(payment -> payment.getRelatedInvoiceId() != null)
                .collect(Collectors.groupingBy(PaymentRecord::getRelatedInvoiceId));

        long todayBillCount = 0;
        BigDecimal todaySales = Money.ZERO;
        long outstandingCount = 0;
        BigDecimal outstandingTotal = Money.ZERO;
        for (Invoice invoice : invoices) {
            if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
                continue;
            }
            if (IsoDates.isOnDate(invoice.getCreatedIsoDate(), today)) {
                todayBillCount++;
                todaySales = todaySales.add(Money.nullToZero(invoice.getGrandTotal()));
            }
            BalanceSummary balance = paymentReconciler.reconcile(invoice,
                    paymentsByInvoice.getOrDefault(invoice.getInvoiceId(), Collections.emptyList()));
            if (balance.getRemainingBalance().signum() > 0) {
                outstandingCount++;
                outstandingTotal = outstandingTotal.add(balance.getRemainingBalance());
            }
        }

        long lowStock = 0;
        long outOfStock = 0;
        for (Product product : products) {
            StockStatus status = statusProjection.stockStatus(product.getStock());
            if (status == StockStatus.LOW_STOCK) lowStock++;
            if (status == StockStatus.OUT_OF_STOCK) outOfStock++;
        }

        return DashboardSummaryResponse.builder()
                .date(today)
                .payments(paymentReconciler.aggregate(payments, today))
                .todayBillCount(todayBillCount)
                .todaySalesTotal(todaySales)
                .outstandingInvoiceCount(outstandingCount)
                .outstandingBalanceTotal(outstandingTotal)
                .lowStockCount(lowStock)
                .outOfStockCount(outOfStock)
                .build();
    }
}
