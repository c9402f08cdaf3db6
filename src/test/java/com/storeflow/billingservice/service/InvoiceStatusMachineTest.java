package com.storeflow.billingservice.service;

import com.storeflow.common.model.InvoiceStatus;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static com.storeflow.common.model.InvoiceStatus.*;
import static org.assertj.core.api.Assertions.assertThat;

class InvoiceStatusMachineTest {

    private final InvoiceStatusMachine machine = new InvoiceStatusMachine();

    @Test
    void canTransition_followsTheTable() {
        assertThat(machine.canTransition(PENDING, PARTIALLY_PAID)).isTrue();
        assertThat(machine.canTransition(PENDING, PAID)).isTrue();
        assertThat(machine.canTransition(PARTIALLY_PAID, PAID)).isTrue();
        assertThat(machine.canTransition(OVERDUE, PAID)).isTrue();
        assertThat(machine.canTransition(PARTIALLY_PAID, PENDING)).isFalse();
        assertThat(machine.canTransition(OVERDUE, PARTIALLY_PAID)).isFalse();
    }

    @Test
    void paidAndCancelled_areTerminal() {
        assertThat(machine.isTerminal(PAID)).isTrue();
        assertThat(machine.isTerminal(CANCELLED)).isTrue();
        assertThat(machine.canTransition(CANCELLED, PENDING)).isFalse();
        assertThat(machine.canTransition(PAID, PARTIALLY_PAID)).isFalse();
    }

    @Test
    void deriveStatus_fromAmountPaid() {
        BigDecimal total = new BigDecimal("1180.00");

        assertThat(machine.deriveStatus(total, BigDecimal.ZERO, 0)).isEqualTo(PENDING);
        assertThat(machine.deriveStatus(total, new BigDecimal("500.00"), 1)).isEqualTo(PARTIALLY_PAID);
        assertThat(machine.deriveStatus(total, new BigDecimal("1180.00"), 1)).isEqualTo(PAID);
        assertThat(machine.deriveStatus(total, new BigDecimal("1200.00"), 2)).isEqualTo(PAID);
    }

    @Test
    void deriveStatus_zeroTotalWithoutPayments_staysPending() {
        assertThat(machine.deriveStatus(BigDecimal.ZERO, BigDecimal.ZERO, 0)).isEqualTo(PENDING);
    }

    @Test
    void applyDerived_keepsCurrentWhenTransitionNotAllowed() {
        assertThat(machine.applyDerived(PENDING, PAID)).isEqualTo(PAID);
        assertThat(machine.applyDerived(OVERDUE, PARTIALLY_PAID)).isEqualTo(OVERDUE);
        assertThat(machine.applyDerived(CANCELLED, PAID)).isEqualTo(CANCELLED);
        assertThat(machine.applyDerived(PARTIALLY_PAID, PENDING)).isEqualTo(PARTIALLY_PAID);
    }

    @Test
    void applyDerived_terminalStatusNeverMoves() {
        for (InvoiceStatus derived : InvoiceStatus.values()) {
            assertThat(machine.applyDerived(PAID, derived)).isEqualTo(PAID);
            assertThat(machine.applyDerived(CANCELLED, derived)).isEqualTo(CANCELLED);
        }
        assertThat(machine.isTerminal(PENDING)).isFalse();
        assertThat(machine.isTerminal(OVERDUE)).isFalse();
    }
}
