package com.storeflow.common.store.impl;

import com.storeflow.common.store.ConflictException;
import com.storeflow.common.store.DocumentStore;
import com.storeflow.common.store.StoreTransaction;
import com.storeflow.common.store.TransactionCallback;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Process-local {@link DocumentStore} with optimistic concurrency control.
 * <p>
 * Every write stamps the document with a fresh value from a store-wide sequence. A transaction
 * remembers the stamp of each document it read (0 for "absent") and the id set of each query it
 * ran; at commit, under the store lock, any change to those means another writer got there
 * first and the whole transaction is rejected with {@link ConflictException}. Staged writes are
 * applied only after that validation passes.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, VersionedDocument>> collections = new HashMap<>();
    private final Object lock = new Object();
    private long versionSequence;

    @Override
    public Optional<Map<String, Object>> get(String collection, String id) {
        synchronized (lock) {
            VersionedDocument document = collection(collection).get(id);
            return document == null ? Optional.empty() : Optional.of(deepCopy(document.data));
        }
    }

    @Override
    public List<Map<String, Object>> list(String collection) {
        synchronized (lock) {
            return collection(collection).values().stream()
                    .map(document -> deepCopy(document.data))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public List<Map<String, Object>> query(String collection, String field, Object value) {
        synchronized (lock) {
            return collection(collection).values().stream()
                    .filter(document -> Objects.equals(document.data.get(field), value))
                    .map(document -> deepCopy(document.data))
                    .collect(Collectors.toList());
        }
    }

    @Override
    public void set(String collection, String id, Map<String, Object> data) {
        synchronized (lock) {
            collection(collection).put(id, new VersionedDocument(++versionSequence, deepCopy(data)));
        }
    }

    @Override
    public <T> T runTransaction(TransactionCallback<T> callback) {
        InMemoryTransaction transaction = new InMemoryTransaction();
        T result = callback.doInTransaction(transaction);
        commit(transaction);
        return result;
    }

    private void commit(InMemoryTransaction transaction) {
        synchronized (lock) {
            for (Map.Entry<DocumentKey, Long> read : transaction.readVersions.entrySet()) {
                if (currentVersion(read.getKey()) != read.getValue()) {
                    log.warn("Transaction conflict on {}/{}", read.getKey().collection, read.getKey().id);
                    throw new ConflictException("Document " + read.getKey() + " was modified by a concurrent transaction.");
                }
            }
            for (QueryRead query : transaction.queries) {
                if (!matchingIds(query.collection, query.field, query.value).equals(query.matchedIds)) {
                    log.warn("Transaction conflict on query {}.{} == {}", query.collection, query.field, query.value);
                    throw new ConflictException("Documents in '" + query.collection + "' matching "
                            + query.field + " = " + query.value + " changed during the transaction.");
                }
            }
            for (PendingWrite write : transaction.writes) {
                if (write.kind == WriteKind.UPDATE && !collection(write.key.collection).containsKey(write.key.id)) {
                    throw new ConflictException("Document " + write.key + " no longer exists.");
                }
            }
            for (PendingWrite write : transaction.writes) {
                Map<String, VersionedDocument> documents = collection(write.key.collection);
                switch (write.kind) {
                    case SET:
                        documents.put(write.key.id, new VersionedDocument(++versionSequence, write.data));
                        break;
                    case UPDATE:
                        Map<String, Object> merged = deepCopy(documents.get(write.key.id).data);
                        merged.putAll(write.data);
                        documents.put(write.key.id, new VersionedDocument(++versionSequence, merged));
                        break;
                    case DELETE:
                        documents.remove(write.key.id);
                        break;
                }
            }
        }
    }

    private Map<String, VersionedDocument> collection(String name) {
        return collections.computeIfAbsent(name, ignored -> new LinkedHashMap<>());
    }

    private long currentVersion(DocumentKey key) {
        VersionedDocument document = collection(key.collection).get(key.id);
        return document == null ? 0L : document.version;
    }

    private Set<String> matchingIds(String collection, String field, Object value) {
        return collection(collection).entrySet().stream()
                .filter(entry -> Objects.equals(entry.getValue().data.get(field), value))
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    @SuppressWarnings("unchecked")
    private static <V> V deepCopyValue(V value) {
        if (value instanceof Map) {
            return (V) deepCopy((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                copy.add(deepCopyValue(element));
            }
            return (V) copy;
        }
        return value;
    }

    private static Map<String, Object> deepCopy(Map<String, Object> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        data.forEach((key, value) -> copy.put(key, deepCopyValue(value)));
        return copy;
    }

    private final class InMemoryTransaction implements StoreTransaction {

        private final Map<DocumentKey, Long> readVersions = new HashMap<>();
        private final List<QueryRead> queries = new ArrayList<>();
        private final List<PendingWrite> writes = new ArrayList<>();

        @Override
        public Optional<Map<String, Object>> get(String collection, String id) {
            checkNoWritesYet();
            synchronized (lock) {
                DocumentKey key = new DocumentKey(collection, id);
                VersionedDocument document = collection(collection).get(id);
                readVersions.putIfAbsent(key, document == null ? 0L : document.version);
                return document == null ? Optional.empty() : Optional.of(deepCopy(document.data));
            }
        }

        @Override
        public Map<String, Map<String, Object>> getAll(String collection, Collection<String> ids) {
            Map<String, Map<String, Object>> found = new LinkedHashMap<>();
            for (String id : ids) {
                get(collection, id).ifPresent(document -> found.put(id, document));
            }
            return found;
        }

        @Override
        public List<Map<String, Object>> query(String collection, String field, Object value) {
            checkNoWritesYet();
            synchronized (lock) {
                Set<String> ids = matchingIds(collection, field, value);
                queries.add(new QueryRead(collection, field, value, ids));
                List<Map<String, Object>> results = new ArrayList<>();
                for (String id : ids) {
                    VersionedDocument document = collection(collection).get(id);
                    readVersions.putIfAbsent(new DocumentKey(collection, id), document.version);
                    results.add(deepCopy(document.data));
                }
                return results;
            }
        }

        @Override
        public void set(String collection, String id, Map<String, Object> data) {
            writes.add(new PendingWrite(new DocumentKey(collection, id), WriteKind.SET, deepCopy(data)));
        }

        @Override
        public void update(String collection, String id, Map<String, Object> fields) {
            writes.add(new PendingWrite(new DocumentKey(collection, id), WriteKind.UPDATE, deepCopy(fields)));
        }

        @Override
        public void delete(String collection, String id) {
            writes.add(new PendingWrite(new DocumentKey(collection, id), WriteKind.DELETE, null));
        }

        private void checkNoWritesYet() {
            if (!writes.isEmpty()) {
                throw new IllegalStateException("All reads must be executed before any write in a transaction.");
            }
        }
    }

    private static final class VersionedDocument {
        private final long version;
        private final Map<String, Object> data;

        private VersionedDocument(long version, Map<String, Object> data) {
            this.version = version;
            this.data = data;
        }
    }

    private static final class DocumentKey {
        private final String collection;
        private final String id;

        private DocumentKey(String collection, String id) {
            this.collection = collection;
            this.id = id;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof DocumentKey)) return false;
            DocumentKey that = (DocumentKey) o;
            return collection.equals(that.collection) && id.equals(that.id);
        }

        @Override
        public int hashCode() {
            return Objects.hash(collection, id);
        }

        @Override
        public String toString() {
            return collection + "/" + id;
        }
    }

    private static final class QueryRead {
        private final String collection;
        private final String field;
        private final Object value;
        private final Set<String> matchedIds;

        private QueryRead(String collection, String field, Object value, Set<String> matchedIds) {
            this.collection = collection;
            this.field = field;
            this.value = value;
            this.matchedIds = matchedIds;
        }
    }

    private enum WriteKind { SET, UPDATE, DELETE }

    private static final class PendingWrite {
        private final DocumentKey key;
        private final WriteKind kind;
        private final Map<String, Object> data;

        private PendingWrite(DocumentKey key, WriteKind kind, Map<String, Object> data) {
            this.key = key;
            this.kind = kind;
            this.data = data;
        }
    }
}
