package com.storeflow.common.repository;

import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.store.StoreTransaction;

import java.util.List;

/**
 * Payment records are append-only: there is no update or delete.
 */
public interface PaymentRepository {

    List<PaymentRecord> findAll();

    List<PaymentRecord> findByFilter(PaymentFilter filter);

    PaymentRecord save(PaymentRecord payment);

    List<PaymentRecord> findByRelatedInvoiceId(StoreTransaction transaction, String relatedInvoiceId);

    void saveInTransaction(StoreTransaction transaction, PaymentRecord payment);
}
