package com.storeflow.billingservice.service;

import com.storeflow.billingservice.dto.request.CreatePaymentRequest;
import com.storeflow.billingservice.exception.ResourceNotFoundException;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.model.PaymentType;
import com.storeflow.common.repository.InvoiceRepository;
import com.storeflow.common.repository.PaymentFilter;
import com.storeflow.common.repository.PaymentRepository;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.util.IdGenerator;
import com.storeflow.common.util.IsoDates;
import com.storeflow.common.util.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Records customer and supplier payments. Payment records are never edited after the fact;
 * balances are always recomputed from them by {@link PaymentReconciler}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final DocumentStore documentStore;
    private final PaymentRepository paymentRepository;
    private final InvoiceRepository invoiceRepository;
    private final PaymentReconciler paymentReconciler;
    private final InvoiceStatusMachine statusMachine;
    private final Clock clock;

    public PaymentRecord recordPayment(CreatePaymentRequest request, String userId) {
        PaymentRecord payment = PaymentRecord.builder()
                .paymentId(IdGenerator.newId("pay"))
                .type(request.getType())
                .relatedInvoiceId(StringUtils.hasText(request.getRelatedInvoiceId()) ? request.getRelatedInvoiceId() : null)
                .counterpartyName(request.getCounterpartyName())
                .amountPaid(Money.round(request.getAmountPaid()))
                .originalAmount(request.getOriginalAmount() == null ? null : Money.round(request.getOriginalAmount()))
                .method(request.getMethod())
                .status(request.getStatus())
                .isoDate(IsoDates.now(clock))
                .createdBy(userId)
                .build();

        PaymentRecord saved;
        if (payment.getType() == PaymentType.CUSTOMER && payment.getRelatedInvoiceId() != null) {
            saved = recordAgainstInvoice(payment);
        } else if (payment.getType() == PaymentType.SUPPLIER && payment.getRelatedInvoiceId() != null
                && payment.getOriginalAmount() != null) {
            saved = recordAgainstSupplierBill(payment);
        } else {
            saved = paymentRepository.save(payment);
        }
        log.info("Recorded {} payment {} of {} ({}) for {}", saved.getType(), saved.getPaymentId(),
                saved.getAmountPaid(), saved.getStatus(), saved.getRelatedInvoiceId());
        return saved;
    }

    public List<PaymentRecord> listPayments(PaymentFilter filter) {
        return paymentRepository.findByFilter(filter).stream()
                .sorted(Comparator.comparing(PaymentRecord::getIsoDate, Comparator.nullsFirst(Comparator.<String>naturalOrder())).reversed())
                .collect(Collectors.toList());
    }

    private PaymentRecord recordAgainstInvoice(PaymentRecord payment) {
        return documentStore.runTransaction(transaction -> {
            Invoice invoice = invoiceRepository.findById(transaction, payment.getRelatedInvoiceId())
                    .orElseThrow(() -> new ResourceNotFoundException("Invoice with ID " + payment.getRelatedInvoiceId() + " not found."));
            if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
                throw new IllegalStateException("Cannot record a payment against cancelled invoice " + invoice.getInvoiceNumber() + ".");
            }
            List<PaymentRecord> payments = new ArrayList<>(paymentRepository.findByRelatedInvoiceId(transaction, invoice.getInvoiceId()));
            payments.add(payment);

            BalanceSummary balance = paymentReconciler.reconcile(invoice, payments);
            PaymentRecord snapshot = payment.toBuilder()
                    .counterpartyName(payment.getCounterpartyName() != null ? payment.getCounterpartyName() : invoice.getCustomerName())
                    .originalAmount(balance.getGrandTotal())
                    .remainingBalance(balance.getRemainingBalance())
                    .build();

            InvoiceStatus next = statusMachine.applyDerived(invoice.getStatus(), balance.getDerivedStatus());
            if (next != invoice.getStatus()) {
                invoiceRepository.updateStatusInTransaction(transaction, invoice.getInvoiceId(), next, IsoDates.now(clock));
                log.info("Invoice {} moved {} -> {} after payment", invoice.getInvoiceNumber(), invoice.getStatus(), next);
            }
            paymentRepository.saveInTransaction(transaction, snapshot);
            return snapshot;
        });
    }

    private PaymentRecord recordAgainstSupplierBill(PaymentRecord payment) {
        return documentStore.runTransaction(transaction -> {
            List<PaymentRecord> payments = paymentRepository.findByRelatedInvoiceId(transaction, payment.getRelatedInvoiceId())
                    .stream()
                    .filter(earlier -> earlier.getType() == PaymentType.SUPPLIER)
                    .collect(Collectors.toCollection(ArrayList::new));
            payments.add(payment);

            BalanceSummary balance = paymentReconciler.reconcile(payment.getOriginalAmount(), PaymentType.SUPPLIER, payments);
            PaymentRecord snapshot = payment.toBuilder()
                    .remainingBalance(balance.getRemainingBalance())
                    .build();
            paymentRepository.saveInTransaction(transaction, snapshot);
            return snapshot;
        });
    }
}
