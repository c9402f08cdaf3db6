package com.storeflow.common.store;

@FunctionalInterface
public interface TransactionCallback<T> {

    T doInTransaction(StoreTransaction transaction);
}
