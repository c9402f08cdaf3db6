package com.storeflow.billingservice.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "billing")
public class BillingProperties {

    /** Two character tax region of the store itself (the GSTIN state code). */
    @NotBlank
    private String homeJurisdiction = "29";

    /** Combined GST rate as a fraction, split evenly into CGST and SGST for intra-state sales. */
    @NotNull
    @DecimalMin("0.0")
    private BigDecimal gstRate = new BigDecimal("0.18");

    @Min(0)
    private int lowStockThreshold = 10;

    @NotBlank
    private String zoneId = "Asia/Kolkata";

    private Store store = new Store();

    private List<String> corsAllowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));

    @Data
    public static class Store {
        /** {@code firestore} or {@code memory}. */
        private String type = "firestore";
        private String projectId;
        /** Service account JSON. When empty, application default credentials are used. */
        private String credentialsPath;
        @Min(1)
        private int transactionAttempts = 1;
    }
}
