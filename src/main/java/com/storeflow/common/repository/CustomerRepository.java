package com.storeflow.common.repository;

import com.storeflow.common.model.Customer;
import com.storeflow.common.store.StoreTransaction;

import java.util.List;
import java.util.Optional;

public interface CustomerRepository {

    Optional<Customer> findById(String customerId);

    List<Customer> findAll();

    Customer save(Customer customer);

    Optional<Customer> findById(StoreTransaction transaction, String customerId);
}
