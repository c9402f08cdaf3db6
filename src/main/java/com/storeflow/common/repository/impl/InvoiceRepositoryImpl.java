package com.storeflow.common.repository.impl;

import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.repository.InvoiceRepository;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.StoreTransaction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class InvoiceRepositoryImpl implements InvoiceRepository {

    static final String COLLECTION = "invoices";

    private final DocumentStore documentStore;

    public InvoiceRepositoryImpl(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public Optional<Invoice> findById(String invoiceId) {
        return documentStore.get(COLLECTION, invoiceId).map(InvoiceRepositoryImpl::fromDocument);
    }

    @Override
    public List<Invoice> findAll() {
        return documentStore.list(COLLECTION).stream()
                .map(InvoiceRepositoryImpl::fromDocument)
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Invoice> findById(StoreTransaction transaction, String invoiceId) {
        return transaction.get(COLLECTION, invoiceId).map(InvoiceRepositoryImpl::fromDocument);
    }

    @Override
    public void saveInTransaction(StoreTransaction transaction, Invoice invoice) {
        transaction.set(COLLECTION, invoice.getInvoiceId(), toDocument(invoice));
    }

    @Override
    public void updateStatusInTransaction(StoreTransaction transaction, String invoiceId, InvoiceStatus status, String updatedIsoDate) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("status", status.name());
        fields.put("updatedIsoDate", updatedIsoDate);
        transaction.update(COLLECTION, invoiceId, fields);
    }

    @Override
    public void deleteInTransaction(StoreTransaction transaction, String invoiceId) {
        transaction.delete(COLLECTION, invoiceId);
    }

    private static Map<String, Object> toDocument(Invoice model) {
        return DocumentMapper.toDocument(model);
    }

    private static Invoice fromDocument(Map<String, Object> document) {
        return DocumentMapper.fromDocument(document, Invoice.class);
    }
}
