package com.storeflow.billingservice.config;

import com.storeflow.common.repository.*;
import com.storeflow.common.repository.impl.*;
import com.storeflow.common.store.DocumentStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EntityConfiguration {

    @Bean
    ProductRepository productRepository(DocumentStore documentStore) {
        return new ProductRepositoryImpl(documentStore);
    }

    @Bean
    CustomerRepository customerRepository(DocumentStore documentStore) {
        return new CustomerRepositoryImpl(documentStore);
    }

    @Bean
    InvoiceRepository invoiceRepository(DocumentStore documentStore) {
        return new InvoiceRepositoryImpl(documentStore);
    }

    @Bean
    PaymentRepository paymentRepository(DocumentStore documentStore) {
        return new PaymentRepositoryImpl(documentStore);
    }

    @Bean
    LedgerEntryRepository ledgerEntryRepository(DocumentStore documentStore) {
        return new LedgerEntryRepositoryImpl(documentStore);
    }
}
