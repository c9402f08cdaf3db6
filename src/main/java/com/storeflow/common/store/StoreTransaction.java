package com.storeflow.common.store;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Handle to one atomic unit of work against the document store.
 * <p>
 * Reads made through the handle belong to the transaction's snapshot; writes are buffered and
 * applied together when the transaction commits. All reads must happen before the first write,
 * which is what Firestore requires of its transactions.
 */
public interface StoreTransaction {

    Optional<Map<String, Object>> get(String collection, String id);

    /** Returns the documents that exist, keyed by id. Missing ids are simply absent from the map. */
    Map<String, Map<String, Object>> getAll(String collection, Collection<String> ids);

    List<Map<String, Object>> query(String collection, String field, Object value);

    void set(String collection, String id, Map<String, Object> data);

    void update(String collection, String id, Map<String, Object> fields);

    void delete(String collection, String id);
}
