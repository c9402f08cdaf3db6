package com.storeflow.common.repository.impl;

import com.storeflow.common.model.LedgerEntry;
import com.storeflow.common.repository.LedgerEntryRepository;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.StoreTransaction;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public class LedgerEntryRepositoryImpl implements LedgerEntryRepository {

    static final String COLLECTION = "ledgerEntries";

    private final DocumentStore documentStore;

    public LedgerEntryRepositoryImpl(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public List<LedgerEntry> findAllByDate(String isoDate) {
        return documentStore.query(COLLECTION, "date", isoDate).stream()
                .map(LedgerEntryRepositoryImpl::fromDocument)
                .collect(Collectors.toList());
    }

    @Override
    public void saveInTransaction(StoreTransaction transaction, LedgerEntry entry) {
        transaction.set(COLLECTION, entry.getEntryId(), toDocument(entry));
    }

    private static Map<String, Object> toDocument(LedgerEntry model) {
        return DocumentMapper.toDocument(model);
    }

    private static LedgerEntry fromDocument(Map<String, Object> document) {
        return DocumentMapper.fromDocument(document, LedgerEntry.class);
    }
}
