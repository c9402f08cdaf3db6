package com.storeflow.billingservice.dto.response;

import com.storeflow.billingservice.service.PaymentMetrics;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
public class DashboardSummaryResponse {
    private LocalDate date;
    private PaymentMetrics payments;

    private long todayBillCount;
    private BigDecimal todaySalesTotal;

    private long outstandingInvoiceCount;
    private BigDecimal outstandingBalanceTotal;

    private long lowStockCount;
    private long outOfStockCount;
}
