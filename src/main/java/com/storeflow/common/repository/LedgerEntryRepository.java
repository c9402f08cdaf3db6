package com.storeflow.common.repository;

import com.storeflow.common.model.LedgerEntry;
import com.storeflow.common.store.StoreTransaction;

import java.util.List;

public interface LedgerEntryRepository {

    List<LedgerEntry> findAllByDate(String isoDate);

    void saveInTransaction(StoreTransaction transaction, LedgerEntry entry);
}
