package com.storeflow.billingservice.service;

import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.model.PaymentStatus;
import com.storeflow.common.model.PaymentType;
import com.storeflow.common.util.Money;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Recomputes what has been paid against a bill from the payment records themselves. The
 * {@code remainingBalance} snapshot stored on a payment is never consulted.
 */
@Component
@RequiredArgsConstructor
public class PaymentReconciler {

    private static final Set<PaymentStatus> COUNTED_CUSTOMER =
            EnumSet.of(PaymentStatus.COMPLETED, PaymentStatus.RECEIVED, PaymentStatus.PARTIAL);
    private static final Set<PaymentStatus> COUNTED_SUPPLIER =
            EnumSet.of(PaymentStatus.COMPLETED, PaymentStatus.SENT, PaymentStatus.PARTIAL);

    private final InvoiceStatusMachine statusMachine;

    public BalanceSummary reconcile(Invoice invoice, Collection<PaymentRecord> payments) {
        BigDecimal paid = Money.ZERO;
        int counted = 0;
        for (PaymentRecord payment : payments) {
            if (payment.getType() == PaymentType.CUSTOMER
                    && invoice.getInvoiceId().equals(payment.getRelatedInvoiceId())
                    && COUNTED_CUSTOMER.contains(payment.getStatus())) {
                paid = paid.add(Money.nullToZero(payment.getAmountPaid()));
                counted++;
            }
        }
        return summarize(Money.nullToZero(invoice.getGrandTotal()), paid, counted);
    }

    /**
     * Reconciles a bill that has no invoice document, such as a supplier bill identified only by
     * its reference. Every payment passed in is assumed to belong to that bill.
     */
    public BalanceSummary reconcile(BigDecimal total, PaymentType type, Collection<PaymentRecord> payments) {
        Set<PaymentStatus> countedStatuses = countedStatuses(type);
        BigDecimal paid = Money.ZERO;
        int counted = 0;
        for (PaymentRecord payment : payments) {
            if (payment.getType() == type && countedStatuses.contains(payment.getStatus())) {
                paid = paid.add(Money.nullToZero(payment.getAmountPaid()));
                counted++;
            }
        }
        return summarize(Money.nullToZero(total), paid, counted);
    }

    public boolean isCounted(PaymentRecord payment) {
        return countedStatuses(payment.getType()).contains(payment.getStatus());
    }

    public PaymentMetrics aggregate(Collection<PaymentRecord> payments, LocalDate today) {
        String todayPrefix = today.toString();
        BigDecimal received = Money.ZERO, sent = Money.ZERO, pendingIn = Money.ZERO, pendingOut = Money.ZERO;
        BigDecimal receivedToday = Money.ZERO, sentToday = Money.ZERO, pendingInToday = Money.ZERO, pendingOutToday = Money.ZERO;
        long failed = 0, failedToday = 0;

        for (PaymentRecord payment : payments) {
            BigDecimal amount = Money.nullToZero(payment.getAmountPaid());
            boolean isToday = payment.getIsoDate() != null && payment.getIsoDate().startsWith(todayPrefix);
            boolean customer = payment.getType() == PaymentType.CUSTOMER;

            if (payment.getStatus() == PaymentStatus.FAILED) {
                failed++;
                if (isToday) failedToday++;
            } else if (payment.getStatus() == PaymentStatus.PENDING) {
                if (customer) {
                    pendingIn = pendingIn.add(amount);
                    if (isToday) pendingInToday = pendingInToday.add(amount);
                } else {
                    pendingOut = pendingOut.add(amount);
                    if (isToday) pendingOutToday = pendingOutToday.add(amount);
                }
            } else if (isCounted(payment)) {
                if (customer) {
                    received = received.add(amount);
                    if (isToday) receivedToday = receivedToday.add(amount);
                } else {
                    sent = sent.add(amount);
                    if (isToday) sentToday = sentToday.add(amount);
                }
            }
        }

        return PaymentMetrics.builder()
                .totalReceived(received)
                .totalSent(sent)
                .pendingFromCustomers(pendingIn)
                .pendingToSuppliers(pendingOut)
                .failedCount(failed)
                .receivedToday(receivedToday)
                .sentToday(sentToday)
                .pendingFromCustomersToday(pendingInToday)
                .pendingToSuppliersToday(pendingOutToday)
                .failedToday(failedToday)
                .build();
    }

    private BalanceSummary summarize(BigDecimal total, BigDecimal paid, int counted) {
        BigDecimal remaining = total.subtract(paid).max(Money.ZERO);
        return new BalanceSummary(total, Money.round(paid), Money.round(remaining), counted,
                statusMachine.deriveStatus(total, paid, counted));
    }

    private static Set<PaymentStatus> countedStatuses(PaymentType type) {
        return type == PaymentType.SUPPLIER ? COUNTED_SUPPLIER : COUNTED_CUSTOMER;
    }
}
