package com.storeflow.billingservice.dto.request;

import com.storeflow.common.model.PaymentStatus;
import com.storeflow.common.model.PaymentType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class CreatePaymentRequest {

    @NotNull(message = "Payment type is required.")
    private PaymentType type;

    // Invoice id for customer payments; the supplier's bill reference for supplier payments.
    private String relatedInvoiceId;

    private String counterpartyName;

    @NotNull
    @DecimalMin(value = "0.01", message = "Amount paid must be positive.")
    @Digits(integer = 12, fraction = 2)
    private BigDecimal amountPaid;

    // Bill total, only needed for supplier payments.
    @DecimalMin(value = "0.00")
    @Digits(integer = 12, fraction = 2)
    private BigDecimal originalAmount;

    private String method;

    @NotNull(message = "Payment status is required.")
    private PaymentStatus status;
}
