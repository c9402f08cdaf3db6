package com.storeflow.common.repository;

import com.storeflow.common.model.Product;
import com.storeflow.common.store.StoreTransaction;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ProductRepository {

    Optional<Product> findById(String productId);

    List<Product> findAll();

    Product save(Product product);

    Optional<Product> findById(StoreTransaction transaction, String productId);

    /** Products that exist among {@code productIds}, keyed by id. */
    Map<String, Product> findAllById(StoreTransaction transaction, Collection<String> productIds);

    void updateStockInTransaction(StoreTransaction transaction, String productId, int newStock);
}
