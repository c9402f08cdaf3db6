package com.storeflow.common.repository;

import com.storeflow.common.model.Invoice;
import com.storeflow.common.model.InvoiceStatus;
import com.storeflow.common.store.StoreTransaction;

import java.util.List;
import java.util.Optional;

public interface InvoiceRepository {

    Optional<Invoice> findById(String invoiceId);

    List<Invoice> findAll();

    Optional<Invoice> findById(StoreTransaction transaction, String invoiceId);

    void saveInTransaction(StoreTransaction transaction, Invoice invoice);

    void updateStatusInTransaction(StoreTransaction transaction, String invoiceId, InvoiceStatus status, String updatedIsoDate);

    void deleteInTransaction(StoreTransaction transaction, String invoiceId);
}
