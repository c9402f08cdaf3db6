package com.storeflow.billingservice.config;

import com.google.auth.oauth2.GoogleCredentials;
import com.google.cloud.firestore.Firestore;
import com.google.firebase.FirebaseApp;
import com.google.firebase.FirebaseOptions;
import com.google.firebase.cloud.FirestoreClient;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.impl.FirestoreDocumentStore;
import com.storeflow.common.store.impl.InMemoryDocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.ZoneId;

@Slf4j
@Configuration
public class StoreConfiguration {

    @Bean
    @ConditionalOnProperty(name = "billing.store.type", havingValue = "firestore", matchIfMissing = true)
    Firestore firestore(BillingProperties properties) throws IOException {
        if (FirebaseApp.getApps().isEmpty()) {
            BillingProperties.Store store = properties.getStore();
            GoogleCredentials credentials;
            if (StringUtils.hasText(store.getCredentialsPath())) {
                try (InputStream serviceAccount = new FileInputStream(store.getCredentialsPath())) {
                    credentials = GoogleCredentials.fromStream(serviceAccount);
                }
            } else {
                credentials = GoogleCredentials.getApplicationDefault();
            }
            FirebaseOptions.Builder options = FirebaseOptions.builder().setCredentials(credentials);
            if (StringUtils.hasText(store.getProjectId())) {
                options.setProjectId(store.getProjectId());
            }
            FirebaseApp.initializeApp(options.build());
            log.info("Firebase initialized for project {}", store.getProjectId());
        }
        return FirestoreClient.getFirestore();
    }

    @Bean
    @ConditionalOnProperty(name = "billing.store.type", havingValue = "firestore", matchIfMissing = true)
    DocumentStore firestoreDocumentStore(Firestore firestore, BillingProperties properties) {
        return new FirestoreDocumentStore(firestore, properties.getStore().getTransactionAttempts());
    }

    @Bean
    @ConditionalOnProperty(name = "billing.store.type", havingValue = "memory")
    DocumentStore inMemoryDocumentStore() {
        log.warn("Using the in-memory document store; data is lost on restart");
        return new InMemoryDocumentStore();
    }

    @Bean
    Clock clock(BillingProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }
}
