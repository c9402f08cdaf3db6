package com.storeflow.common.store.impl;

import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.api.gax.rpc.StatusCode;
import com.google.cloud.firestore.CollectionReference;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreException;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.Transaction;
import com.google.cloud.firestore.TransactionOptions;
import com.storeflow.common.store.ConflictException;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.StoreTransaction;
import com.storeflow.common.store.StoreUnavailableException;
import com.storeflow.common.store.TransactionCallback;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;

/**
 * {@link DocumentStore} backed by Cloud Firestore.
 * <p>
 * Transactions run through {@link Firestore#runTransaction(Transaction.Function, TransactionOptions)}.
 * Firestore transactions are optimistic: contention surfaces as an {@code ABORTED} status, which is
 * reported as {@link ConflictException} once the configured attempts are used up.
 */
@Slf4j
public class FirestoreDocumentStore implements DocumentStore {

    private final Firestore firestore;
    private final TransactionOptions transactionOptions;

    public FirestoreDocumentStore(Firestore firestore, int transactionAttempts) {
        this.firestore = firestore;
        this.transactionOptions = TransactionOptions.createReadWriteOptionsBuilder()
                .setNumberOfAttempts(Math.max(1, transactionAttempts))
                .build();
    }

    @Override
    public Optional<Map<String, Object>> get(String collection, String id) {
        DocumentSnapshot snapshot = await(firestore.collection(collection).document(id).get(), "read " + collection + "/" + id);
        return snapshot.exists() ? Optional.ofNullable(snapshot.getData()) : Optional.empty();
    }

    @Override
    public List<Map<String, Object>> list(String collection) {
        return toMaps(await(firestore.collection(collection).get(), "list " + collection).getDocuments());
    }

    @Override
    public List<Map<String, Object>> query(String collection, String field, Object value) {
        return toMaps(await(firestore.collection(collection).whereEqualTo(field, value).get(),
                "query " + collection).getDocuments());
    }

    @Override
    public void set(String collection, String id, Map<String, Object> data) {
        await(firestore.collection(collection).document(id).set(data), "write " + collection + "/" + id);
    }

    @Override
    public <T> T runTransaction(TransactionCallback<T> callback) {
        ApiFuture<T> result = firestore.runTransaction(
                transaction -> callback.doInTransaction(new FirestoreTransaction(transaction)),
                transactionOptions);
        return await(result, "transaction");
    }

    private static List<Map<String, Object>> toMaps(List<QueryDocumentSnapshot> documents) {
        List<Map<String, Object>> results = new ArrayList<>();
        for (QueryDocumentSnapshot document : documents) {
            results.add(document.getData());
        }
        return results;
    }

    private static <T> T await(ApiFuture<T> future, String operation) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw translate(operation, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted during Firestore " + operation + ".", e);
        }
    }

    /**
     * Maps a Firestore failure onto the store taxonomy. Exceptions the transaction callback threw
     * on purpose (validation, stock, not-found) pass through untouched.
     */
    static RuntimeException translate(String operation, Throwable failure) {
        if (failure instanceof ApiException) {
            StatusCode.Code code = ((ApiException) failure).getStatusCode().getCode();
            if (code == StatusCode.Code.ABORTED) {
                log.warn("Firestore {} aborted by a concurrent writer", operation);
                return new ConflictException("Concurrent modification detected during " + operation + ". Re-read and retry.", failure);
            }
            log.error("Firestore {} failed with status {}", operation, code, failure);
            return new StoreUnavailableException("Firestore " + operation + " failed: " + code, failure);
        }
        if (failure instanceof FirestoreException) {
            log.error("Firestore {} failed", operation, failure);
            return new StoreUnavailableException("Firestore " + operation + " failed: " + failure.getMessage(), failure);
        }
        if (failure instanceof RuntimeException) {
            return (RuntimeException) failure;
        }
        log.error("Firestore {} failed", operation, failure);
        return new StoreUnavailableException("Firestore " + operation + " failed: " + failure.getMessage(), failure);
    }

    private final class FirestoreTransaction implements StoreTransaction {

        private final Transaction transaction;

        private FirestoreTransaction(Transaction transaction) {
            this.transaction = transaction;
        }

        @Override
        public Optional<Map<String, Object>> get(String collection, String id) {
            DocumentSnapshot snapshot = await(transaction.get(reference(collection, id)), "read " + collection + "/" + id);
            return snapshot.exists() ? Optional.ofNullable(snapshot.getData()) : Optional.empty();
        }

        @Override
        public Map<String, Map<String, Object>> getAll(String collection, Collection<String> ids) {
            Map<String, Map<String, Object>> found = new LinkedHashMap<>();
            if (ids.isEmpty()) {
                return found;
            }
            DocumentReference[] references = ids.stream()
                    .map(id -> reference(collection, id))
                    .toArray(DocumentReference[]::new);
            for (DocumentSnapshot snapshot : await(transaction.getAll(references), "batch read " + collection)) {
                if (snapshot.exists()) {
                    found.put(snapshot.getId(), snapshot.getData());
                }
            }
            return found;
        }

        @Override
        public List<Map<String, Object>> query(String collection, String field, Object value) {
            CollectionReference reference = firestore.collection(collection);
            return toMaps(await(transaction.get(reference.whereEqualTo(field, value)), "query " + collection).getDocuments());
        }

        @Override
        public void set(String collection, String id, Map<String, Object> data) {
            transaction.set(reference(collection, id), data);
        }

        @Override
        public void update(String collection, String id, Map<String, Object> fields) {
            transaction.update(reference(collection, id), fields);
        }

        @Override
        public void delete(String collection, String id) {
            transaction.delete(reference(collection, id));
        }

        private DocumentReference reference(String collection, String id) {
            return firestore.collection(collection).document(id);
        }
    }
}
