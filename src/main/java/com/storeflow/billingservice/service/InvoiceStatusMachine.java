package com.storeflow.billingservice.service;

import com.storeflow.common.model.InvoiceStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.storeflow.common.model.InvoiceStatus.*;

/**
 * Which invoice statuses payment activity may move an invoice into. A person changing the
 * status by hand is not bound by this table.
 */
@Component
public class InvoiceStatusMachine {

    private static final Map<InvoiceStatus, Set<InvoiceStatus>> TRANSITIONS = new EnumMap<>(InvoiceStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(PARTIALLY_PAID, PAID, OVERDUE, CANCELLED));
        TRANSITIONS.put(PARTIALLY_PAID, EnumSet.of(PAID, OVERDUE, CANCELLED));
        TRANSITIONS.put(OVERDUE, EnumSet.of(PAID, CANCELLED));
        TRANSITIONS.put(PAID, EnumSet.noneOf(InvoiceStatus.class));
        TRANSITIONS.put(CANCELLED, EnumSet.noneOf(InvoiceStatus.class));
    }

    public boolean canTransition(InvoiceStatus from, InvoiceStatus to) {
        return TRANSITIONS.getOrDefault(from, Collections.emptySet()).contains(to);
    }

    public boolean isTerminal(InvoiceStatus status) {
        return TRANSITIONS.getOrDefault(status, Collections.emptySet()).isEmpty();
    }

    /**
     * The status the payments alone justify. Never OVERDUE or CANCELLED: those need a person
     * or a due date to decide.
     */
    public InvoiceStatus deriveStatus(BigDecimal grandTotal, BigDecimal amountPaid, int countedPayments) {
        if (amountPaid.signum() <= 0) {
            return PENDING;
        }
        if (amountPaid.compareTo(grandTotal) >= 0 && countedPayments > 0) {
            return PAID;
        }
        return PARTIALLY_PAID;
    }

    /**
     * Moves {@code current} to {@code derived} when allowed, otherwise keeps {@code current}.
     * Terminal statuses are never left through payment activity.
     */
    public InvoiceStatus applyDerived(InvoiceStatus current, InvoiceStatus derived) {
        if (current == null) {
            return derived;
        }
        if (isTerminal(current) || current == derived || !canTransition(current, derived)) {
            return current;
        }
        return derived;
    }
}
