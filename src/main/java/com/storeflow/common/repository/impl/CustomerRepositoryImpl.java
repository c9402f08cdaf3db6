package com.storeflow.common.repository.impl;

import com.storeflow.common.model.Customer;
import com.storeflow.common.repository.CustomerRepository;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.StoreTransaction;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

public class CustomerRepositoryImpl implements CustomerRepository {

    static final String COLLECTION = "customers";

    private final DocumentStore documentStore;

    public CustomerRepositoryImpl(DocumentStore documentStore) {
        this.documentStore = documentStore;
    }

    @Override
    public Optional<Customer> findById(String customerId) {
        return documentStore.get(COLLECTION, customerId).map(CustomerRepositoryImpl::fromDocument);
    }

    @Override
    public List<Customer> findAll() {
        return documentStore.list(COLLECTION).stream()
                .map(CustomerRepositoryImpl::fromDocument)
                .collect(Collectors.toList());
    }

    @Override
    public Customer save(Customer customer) {
        documentStore.set(COLLECTION, customer.getCustomerId(), toDocument(customer));
        return customer;
    }

    @Override
    public Optional<Customer> findById(StoreTransaction transaction, String customerId) {
        return transaction.get(COLLECTION, customerId).map(CustomerRepositoryImpl::fromDocument);
    }

    private static Map<String, Object> toDocument(Customer model) {
        return DocumentMapper.toDocument(model);
    }

    private static Customer fromDocument(Map<String, Object> document) {
        return DocumentMapper.fromDocument(document, Customer.class);
    }
}
