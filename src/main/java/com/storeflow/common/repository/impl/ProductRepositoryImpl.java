package com.storeflow.common.repository.impl;

import com.storeflow.common.model.Product;
import com.storeflow.common.repository.ProductRepository;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.StoreTransaction;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class ProductRepositoryImpl implements ProductRepository {

    static final String COLLECTION = "products";

    private final DocumentStore documentStore;

    public ProductRepositoryImpl(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public Optional<Product> findById(String productId) {
        return documentStore.get(COLLECTION, productId).map(ProductRepositoryImpl::fromDocument);
    }

    @Override
    public List<Product> findAll() {
        return documentStore.list(COLLECTION).stream()
                .map(ProductRepositoryImpl::fromDocument)
                .collect(Collectors.toList());
    }

    @Override
    public Product save(Product product) {
        documentStore.set(COLLECTION, product.getProductId(), toDocument(product));
        return product;
    }

    @Override
    public Optional<Product> findById(StoreTransaction transaction, String productId) {
        return transaction.get(COLLECTION, productId).map(ProductRepositoryImpl::fromDocument);
    }

    @Override
    public Map<String, Product> findAllById(StoreTransaction transaction, Collection<String> productIds) {
        Map<String, Product> products = new LinkedHashMap<>();
        transaction.getAll(COLLECTION, productIds)
                .forEach((id, document) -> products.put(id, fromDocument(document)));
        return products;
    }

    @Override
    public void updateStockInTransaction(StoreTransaction transaction, String productId, int newStock) {
        if (newStock < 0) {
            throw new IllegalArgumentException("Stock for product " + productId + " cannot be negative: " + newStock);
        }
        transaction.update(COLLECTION, productId, Map.of("stock", newStock));
    }

    private static Map<String, Object> toDocument(Product model) {
        return DocumentMapper.toDocument(model);
    }

    private static Product fromDocument(Map<String, Object> document) {
        return DocumentMapper.fromDocument(document, Product.class);
    }
}
