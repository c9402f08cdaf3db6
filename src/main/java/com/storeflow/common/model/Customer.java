package com.storeflow.common.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Customer {
    private String customerId;
    private String name;
    private String phone;
    private String email;
    // GSTIN. Optional; customers without one are billed untaxed.
    private String taxRegistrationId;

    /**
     * The two character tax region prefix of the registration id, or {@code null} when the
     * customer has no usable registration on file.
     */
    public String getJurisdictionCode() {
        if (taxRegistrationId == null) {
            return null;
        }
        String trimmed = taxRegistrationId.trim();
        return trimmed.length() < 2 ? null : trimmed.substring(0, 2);
    }
}
