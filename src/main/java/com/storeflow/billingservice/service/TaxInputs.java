package com.storeflow.billingservice.service;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class TaxInputs {
    String homeJurisdiction;
    BigDecimal rate;
}
