package com.storeflow.billingservice.service;

import com.storeflow.common.util.Money;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;

/**
 * Splits GST on a bill subtotal.
 * <p>
 * A customer without a registered jurisdiction is billed no tax. A customer in the store's own
 * state pays CGST and SGST at half the rate each; anyone else pays IGST at the full rate.
 * Jurisdictions are compared on their first two characters, the GSTIN state code.
 */
@Component
public class TaxCalculator {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public TaxBreakdown computeTax(BigDecimal subTotal, String customerJurisdiction, String homeJurisdiction, BigDecimal rate) {
        if (subTotal == null || subTotal.signum() < 0) {
            throw new IllegalArgumentException("Subtotal must be zero or positive, got " + subTotal);
        }
        if (rate == null || rate.signum() < 0) {
            throw new IllegalArgumentException("Tax rate must be zero or positive, got " + rate);
        }
        if (!StringUtils.hasText(homeJurisdiction)) {
            throw new IllegalArgumentException("Home jurisdiction must be configured");
        }
        if (!StringUtils.hasText(customerJurisdiction)) {
            return TaxBreakdown.none();
        }

        BigDecimal tax = subTotal.multiply(rate);
        if (stateCode(customerJurisdiction).equals(stateCode(homeJurisdiction))) {
            BigDecimal half = Money.round(tax.divide(TWO));
            return new TaxBreakdown(half, half, Money.ZERO);
        }
        return new TaxBreakdown(Money.ZERO, Money.ZERO, Money.round(tax));
    }

    public TaxBreakdown computeTax(BigDecimal subTotal, String customerJurisdiction, TaxInputs inputs) {
        return computeTax(subTotal, customerJurisdiction, inputs.getHomeJurisdiction(), inputs.getRate());
    }

    private static String stateCode(String jurisdiction) {
        String trimmed = jurisdiction.trim();
        return trimmed.length() <= 2 ? trimmed : trimmed.substring(0, 2);
    }
}
