package com.storeflow.billingservice;

import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.impl.InMemoryDocumentStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "billing.store.type=memory")
class BillingServiceApplicationTests {

    @Autowired
    private DocumentStore documentStore;

    @Test
    void contextLoads() {
        assertThat(documentStore).isInstanceOf(InMemoryDocumentStore.class);
    }
}
