package com.storeflow.common.repository.impl;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storeflow.common.model.Customer;
import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceLine;
import com.storeflow.common.model.LedgerEntry;
import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.model.Product;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Converts models to and from the field maps kept in the document store.
 * <p>
 * Stored field names differ from the model (and from the HTTP representation) in a few places,
 * so the document shape is declared through mix-ins here instead of on the models.
 */
final class DocumentMapper {

    private static final TypeReference<Map<String, Object>> DOCUMENT = new TypeReference<>() {
    };

    // Firestore hands integers back as Long; the in-memory store should look the same.
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.USE_LONG_FOR_INTS, true)
            .addMixIn(Product.class, ProductDocument.class)
            .addMixIn(Customer.class, CustomerDocument.class)
            .addMixIn(InvoiceLine.class, InvoiceLineDocument.class)
            .addMixIn(Invoice.class, InvoiceDocument.class)
            .addMixIn(PaymentRecord.class, PaymentDocument.class)
            .addMixIn(LedgerEntry.class, LedgerEntryDocument.class);

    private DocumentMapper() {
    }

    static Map<String, Object> toDocument(Object model) {
        return MAPPER.convertValue(model, DOCUMENT);
    }

    static <T> T fromDocument(Map<String, Object> document, Class<T> type) {
        return MAPPER.convertValue(document, type);
    }

    abstract static class ProductDocument {
        @MinorUnits
        @JsonProperty("unitPriceMinor")
        BigDecimal unitPrice;
    }

    abstract static class CustomerDocument {
        @JsonProperty("gstin")
        String taxRegistrationId;

        @JsonIgnore
        abstract String getJurisdictionCode();
    }

    abstract static class InvoiceLineDocument {
        @MinorUnits
        @JsonProperty("unitPriceMinor")
        BigDecimal unitPrice;

        @MinorUnits
        @JsonProperty("lineTotalMinor")
        BigDecimal lineTotal;
    }

    abstract static class InvoiceDocument {
        @JsonProperty("items")
        List<InvoiceLine> lines;

        @MinorUnits
        @JsonProperty("subTotalMinor")
        BigDecimal subTotal;

        @MinorUnits
        @JsonProperty("cgstMinor")
        BigDecimal cgst;

        @MinorUnits
        @JsonProperty("sgstMinor")
        BigDecimal sgst;

        @MinorUnits
        @JsonProperty("igstMinor")
        BigDecimal igst;

        @MinorUnits
        @JsonProperty("grandTotalMinor")
        BigDecimal grandTotal;

        @JsonProperty("isoDate")
        String createdIsoDate;
    }

    abstract static class PaymentDocument {
        @MinorUnits
        @JsonProperty("amountPaidMinor")
        BigDecimal amountPaid;

        @MinorUnits
        @JsonProperty("originalAmountMinor")
        BigDecimal originalAmount;

        @MinorUnits
        @JsonProperty("remainingBalanceMinor")
        BigDecimal remainingBalance;
    }

    abstract static class LedgerEntryDocument {
        @MinorUnits
        @JsonProperty("subTotalMinor")
        BigDecimal subTotal;

        @MinorUnits
        @JsonProperty("taxAmountMinor")
        BigDecimal taxAmount;

        @MinorUnits
        @JsonProperty("grandTotalMinor")
        BigDecimal grandTotal;
    }
}
