package com.storeflow.common.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A document database holding schemaless maps grouped into collections, with an explicit
 * transaction boundary.
 * <p>
 * {@link #runTransaction(TransactionCallback)} commits every write staged on the handle
 * atomically, or none of them. Exceptions thrown by the callback abort the transaction and
 * propagate to the caller unchanged. A snapshot conflict is reported as {@link ConflictException}
 * and a transport failure as {@link StoreUnavailableException}.
 */
public interface DocumentStore {

    Optional<Map<String, Object>> get(String collection, String id);

    List<Map<String, Object>> list(String collection);

    List<Map<String, Object>> query(String collection, String field, Object value);

    void set(String collection, String id, Map<String, Object> data);

    <T> T runTransaction(TransactionCallback<T> callback);
}
