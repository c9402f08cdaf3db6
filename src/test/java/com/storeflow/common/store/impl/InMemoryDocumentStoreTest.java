package com.storeflow.common.store.impl;

import com.storeflow.common.store.ConflictException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryDocumentStoreTest {

    private InMemoryDocumentStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore();
        store.set("products", "p1", Map.of("productId", "p1", "stock", 10));
        store.set("products", "p2", Map.of("productId", "p2", "stock", 5));
    }

    @Test
    void runTransaction_commitsAllStagedWritesTogether() {
        store.runTransaction(transaction -> {
            transaction.get("products", "p1");
            transaction.get("products", "p2");
            transaction.update("products", "p1", Map.of("stock", 7));
            transaction.update("products", "p2", Map.of("stock", 2));
            return null;
        });

        assertThat(store.get("products", "p1").orElseThrow()).containsEntry("stock", 7).containsEntry("productId", "p1");
        assertThat(store.get("products", "p2").orElseThrow()).containsEntry("stock", 2);
    }

    @Test
    void runTransaction_callbackFailure_discardsEverything() {
        assertThatThrownBy(() -> store.runTransaction(transaction -> {
            transaction.get("products", "p1");
            transaction.update("products", "p1", Map.of("stock", 0));
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("boom");

        assertThat(store.get("products", "p1").orElseThrow()).containsEntry("stock", 10);
    }

    @Test
    void runTransaction_documentChangedAfterRead_isAConflict() {
        assertThatThrownBy(() -> store.runTransaction(transaction -> {
            transaction.get("products", "p1");
            store.set("products", "p1", Map.of("productId", "p1", "stock", 3));
            transaction.update("products", "p1", Map.of("stock", 9));
            return null;
        })).isInstanceOf(ConflictException.class);

        assertThat(store.get("products", "p1").orElseThrow()).containsEntry("stock", 3);
    }

    @Test
    void runTransaction_documentCreatedAfterAbsentRead_isAConflict() {
        assertThatThrownBy(() -> store.runTransaction(transaction -> {
            assertThat(transaction.get("invoices", "inv_1")).isEmpty();
            store.set("invoices", "inv_1", Map.of("invoiceId", "inv_1"));
            transaction.set("invoices", "inv_1", Map.of("invoiceId", "inv_1", "note", "mine"));
            return null;
        })).isInstanceOf(ConflictException.class);
    }

    @Test
    void runTransaction_queryResultChanged_isAConflict() {
        store.set("payments", "pay_1", Map.of("relatedInvoiceId", "inv_1"));

        assertThatThrownBy(() -> store.runTransaction(transaction -> {
            assertThat(transaction.query("payments", "relatedInvoiceId", "inv_1")).hasSize(1);
            store.set("payments", "pay_2", Map.of("relatedInvoiceId", "inv_1"));
            transaction.set("payments", "pay_3", Map.of("relatedInvoiceId", "inv_1"));
            return null;
        })).isInstanceOf(ConflictException.class);

        assertThat(store.query("payments", "relatedInvoiceId", "inv_1")).hasSize(2);
    }

    @Test
    void runTransaction_disjointDocumentsDoNotConflict() {
        store.runTransaction(transaction -> {
            transaction.get("products", "p1");
            store.set("products", "p2", Map.of("productId", "p2", "stock", 1));
            transaction.update("products", "p1", Map.of("stock", 4));
            return null;
        });

        assertThat(store.get("products", "p1").orElseThrow()).containsEntry("stock", 4);
        assertThat(store.get("products", "p2").orElseThrow()).containsEntry("stock", 1);
    }

    @Test
    void runTransaction_readAfterWrite_isRejected() {
        assertThatThrownBy(() -> store.runTransaction(transaction -> {
            transaction.update("products", "p1", Map.of("stock", 4));
            return transaction.get("products", "p2");
        })).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void runTransaction_updateOfDeletedDocument_isAConflict() {
        assertThatThrownBy(() -> store.runTransaction(transaction -> {
            transaction.update("products", "missing", Map.of("stock", 4));
            return null;
        })).isInstanceOf(ConflictException.class);
    }

    @Test
    void getAll_returnsOnlyExistingDocuments() {
        Map<String, Map<String, Object>> found = store.runTransaction(transaction ->
                transaction.getAll("products", List.of("p1", "nope", "p2")));

        assertThat(found).containsOnlyKeys("p1", "p2");
    }

    @Test
    void returnedDocumentsAreCopies() {
        Map<String, Object> nested = new HashMap<>();
        nested.put("items", new ArrayList<>(List.of(Map.of("productId", "p1"))));
        store.set("invoices", "inv_1", nested);
        nested.put("status", "PAID");

        Map<String, Object> loaded = store.get("invoices", "inv_1").orElseThrow();
        loaded.put("status", "CANCELLED");

        assertThat(store.get("invoices", "inv_1").orElseThrow()).doesNotContainKey("status");
    }
}
