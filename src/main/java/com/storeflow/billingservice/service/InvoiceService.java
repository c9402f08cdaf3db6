package com.storeflow.billingservice.service;

import com.storeflow.billingservice.dto.response.InvoiceBalanceResponse;
import com.storeflow.billingservice.exception.ResourceNotFoundException;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.repository.InvoiceRepository;
import com.storeflow.common.repository.PaymentFilter;
import com.storeflow.common.repository.PaymentRepository;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.util.IsoDates;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class InvoiceService {

    static final Comparator<Invoice> NEWEST_FIRST =
            Comparator.comparing(Invoice::getCreatedIsoDate, Comparator.nullsFirst(Comparator.<String>naturalOrder())).reversed();

    private final DocumentStore documentStore;
    private final InvoiceRepository invoiceRepository;
    private final PaymentRepository paymentRepository;
    private final PaymentReconciler paymentReconciler;
    private final InvoiceStatusMachine statusMachine;
    private final StatusProjection statusProjection;
    private final Clock clock;

    public Invoice getInvoice(String invoiceId) {
        return invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice with ID " + invoiceId + " not found."));
    }

    public List<Invoice> listInvoices() {
        return invoiceRepository.findAll().stream()
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    /**
     * Sets the status an operator chose. Any status may be chosen, including moves the payment
     * driven transitions would never make, such as reopening a cancelled invoice.
     */
    public Invoice updateStatus(String invoiceId, InvoiceStatus status) {
        Invoice updated = documentStore.runTransaction(transaction -> {
            Invoice invoice = invoiceRepository.findById(transaction, invoiceId)
                    .orElseThrow(() -> new ResourceNotFoundException("Invoice with ID " + invoiceId + " not found."));
            if (invoice.getStatus() != status && !statusMachine.canTransition(invoice.getStatus(), status)) {
                log.info("Manual status override on invoice {}: {} -> {}", invoice.getInvoiceNumber(), invoice.getStatus(), status);
            }
            String now = IsoDates.now(clock);
            invoiceRepository.updateStatusInTransaction(transaction, invoiceId, status, now);
            return invoice.toBuilder().status(status).updatedIsoDate(now).build();
        });
        log.info("Invoice {} status set to {}", updated.getInvoiceId(), status);
        return updated;
    }

    public InvoiceBalanceResponse getBalance(String invoiceId) {
        Invoice invoice = getInvoice(invoiceId);
        List<PaymentRecord> payments = paymentRepository.findByFilter(
                PaymentFilter.builder().relatedInvoiceId(invoiceId).build());
        BalanceSummary balance = paymentReconciler.reconcile(invoice, payments);
        return InvoiceBalanceResponse.builder()
                .invoiceId(invoice.getInvoiceId())
                .invoiceNumber(invoice.getInvoiceNumber())
                .grandTotal(balance.getGrandTotal())
                .amountPaid(balance.getAmountPaid())
                .remainingBalance(balance.getRemainingBalance())
                .paymentCount(balance.getCountedPayments())
                .status(invoice.getStatus())
                .projectedStatus(statusProjection.invoiceStatus(invoice, balance))
                .build();
    }
}
