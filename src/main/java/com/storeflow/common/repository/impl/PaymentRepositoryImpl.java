package com.storeflow.common.repository.impl;

import com.storeflow.common.model.PaymentRecord;
import com.storeflow.common.repository.PaymentFilter;
import com.storeflow.common.repository.PaymentRepository;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.StoreTransaction;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class PaymentRepositoryImpl implements PaymentRepository {

    static final String COLLECTION = "payments";

    private final DocumentStore documentStore;

    public PaymentRepositoryImpl(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public List<PaymentRecord> findAll() {
        return documentStore.list(COLLECTION).stream()
                .map(PaymentRepositoryImpl::fromDocument)
                .collect(Collectors.toList());
    }

    @Override
    public List<PaymentRecord> findByFilter(PaymentFilter filter) {
        // Narrow server side on the most selective field, then finish in memory.
        // Avoids composite indexes for every filter combination.
        List<Map<String, Object>> candidates;
        if (filter.getRelatedInvoiceId() != null) {
            candidates = documentStore.query(COLLECTION, "relatedInvoiceId", filter.getRelatedInvoiceId());
        } else if (filter.getType() != null) {
            candidates = documentStore.query(COLLECTION, "type", filter.getType().name());
        } else {
            candidates = documentStore.list(COLLECTION);
        }
        return candidates.stream()
                .map(PaymentRepositoryImpl::fromDocument)
                .filter(filter::matches)
                .collect(Collectors.toList());
    }

    @Override
    public PaymentRecord save(PaymentRecord payment) {
        documentStore.set(COLLECTION, payment.getPaymentId(), toDocument(payment));
        return payment;
    }

    @Override
    public List<PaymentRecord> findByRelatedInvoiceId(StoreTransaction transaction, String relatedInvoiceId) {
        return transaction.query(COLLECTION, "relatedInvoiceId", relatedInvoiceId).stream()
                .map(PaymentRepositoryImpl::fromDocument)
                .collect(Collectors.toList());
    }

    @Override
    public void saveInTransaction(StoreTransaction transaction, PaymentRecord payment) {
        transaction.set(COLLECTION, payment.getPaymentId(), toDocument(payment));
    }

    private static Map<String, Object> toDocument(PaymentRecord model) {
        return DocumentMapper.toDocument(model);
    }

    private static PaymentRecord fromDocument(Map<String, Object> document) {
        return DocumentMapper.fromDocument(document, PaymentRecord.class);
    }
}
