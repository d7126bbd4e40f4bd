package com.irledger.adapter.out.persistence;

import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.port.out.FieldValues;
import com.irledger.application.port.out.ListenerRegistration;
import com.irledger.domain.exception.IndexUnavailableException;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.exception.StoreUnavailableException;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory implementation of DocumentStore
 * Used for local runs ({@code store.type: memory}) and as the store behind the service tests.
 *
 * <p>Writes are serialized on this instance and listeners are notified
 * synchronously after each write. Server timestamps strictly increase.
 * Ordered queries can be declared unindexed to reproduce the missing-index
 * failure of a real store, and the whole store can be switched unavailable.
 */
@Slf4j
public class InMemoryDocumentStore implements DocumentStore {

    private final Map<String, Map<String, JsonObject>> collections = new LinkedHashMap<>();
    private final Set<String> unindexedOrderings = new HashSet<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private long lastTimestamp;
    private volatile boolean unavailable;

    public InMemoryDocumentStore() {
        this(Clock.systemUTC());
    }

    public InMemoryDocumentStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Make ordered queries on {@code collection} by {@code field} fail as if the
     * supporting index had not been provisioned
     */
    public synchronized InMemoryDocumentStore withoutIndex(String collection, String field) {
        unindexedOrderings.add(collection + "." + field);
        return this;
    }

    /**
     * Simulate a transport or permission failure. Live listeners receive the error.
     */
    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
        if (unavailable) {
            StoreUnavailableException error = new StoreUnavailableException("Document store is unavailable");
            for (Listener listener : listeners) {
                listener.fail(error);
            }
        }
    }

    public synchronized int count(String collection) {
        return collection(collection).size();
    }

    @Override
    public synchronized Future<Optional<JsonObject>> get(String collection, String id) {
        if (unavailable) {
            return unavailable();
        }
        JsonObject doc = collection(collection).get(id);
        return Future.succeededFuture(Optional.ofNullable(doc).map(JsonObject::copy));
    }

    @Override
    public Future<String> add(String collection, JsonObject data) {
        String id = UUID.randomUUID().toString().replace("-", "").substring(0, 20);
        return set(collection, id, data).map(id);
    }

    @Override
    public Future<Void> set(String collection, String id, JsonObject data) {
        synchronized (this) {
            if (unavailable) {
                return unavailable();
            }
            collection(collection).put(id, stamp(data).put("id", id));
        }
        log.debug("Set {}/{}", collection, id);
        notifyListeners(collection);
        return Future.succeededFuture();
    }

    @Override
    public Future<Void> update(String collection, String id, JsonObject fields) {
        synchronized (this) {
            if (unavailable) {
                return unavailable();
            }
            JsonObject existing = collection(collection).get(id);
            if (existing == null) {
                return Future.failedFuture(NotFoundException.of("Document " + collection, id));
            }
            existing.mergeIn(stamp(fields));
        }
        notifyListeners(collection);
        return Future.succeededFuture();
    }

    @Override
    public Future<Boolean> updateIf(String collection, String id, JsonObject expected, JsonObject fields) {
        synchronized (this) {
            if (unavailable) {
                return unavailable();
            }
            JsonObject existing = collection(collection).get(id);
            if (existing == null) {
                return Future.failedFuture(NotFoundException.of("Document " + collection, id));
            }
            for (String field : expected.fieldNames()) {
                if (!DocumentQuery.valuesEqual(expected.getValue(field), existing.getValue(field))) {
                    log.debug("Precondition on {}/{} failed for field {}", collection, id, field);
                    return Future.succeededFuture(false);
                }
            }
            existing.mergeIn(stamp(fields));
        }
        notifyListeners(collection);
        return Future.succeededFuture(true);
    }

    @Override
    public Future<Boolean> createIfAbsent(String collection, String id, JsonObject data) {
        synchronized (this) {
            if (unavailable) {
                return unavailable();
            }
            if (collection(collection).containsKey(id)) {
                return Future.succeededFuture(false);
            }
            collection(collection).put(id, stamp(data).put("id", id));
        }
        notifyListeners(collection);
        return Future.succeededFuture(true);
    }

    @Override
    public synchronized Future<List<JsonObject>> query(DocumentQuery query) {
        if (unavailable) {
            return unavailable();
        }
        if (isUnindexed(query)) {
            return Future.failedFuture(missingIndex(query));
        }
        return Future.succeededFuture(evaluate(query));
    }

    @Override
    public ListenerRegistration listen(DocumentQuery query,
                                       Handler<List<JsonObject>> onSnapshot,
                                       Handler<Throwable> onError) {
        if (unavailable) {
            onError.handle(new StoreUnavailableException("Document store is unavailable"));
            return () -> { };
        }
        if (isUnindexed(query)) {
            onError.handle(missingIndex(query));
            return () -> { };
        }
        Listener listener = new Listener(query, onSnapshot, onError);
        listeners.add(listener);
        listener.deliver(snapshot(query));
        return () -> listeners.remove(listener);
    }

    private void notifyListeners(String collection) {
        for (Listener listener : listeners) {
            if (listener.query.collection().equals(collection)) {
                listener.deliver(snapshot(listener.query));
            }
        }
    }

    private synchronized List<JsonObject> snapshot(DocumentQuery query) {
        return evaluate(query);
    }

    private List<JsonObject> evaluate(DocumentQuery query) {
        List<JsonObject> rows = new ArrayList<>();
        for (JsonObject doc : collection(query.collection()).values()) {
            if (query.matches(doc)) {
                rows.add(doc.copy());
            }
        }
        if (query.isOrdered()) {
            rows.sort(query.order().comparator());
        }
        if (query.limit() != null && rows.size() > query.limit()) {
            return new ArrayList<>(rows.subList(0, query.limit()));
        }
        return rows;
    }

    private boolean isUnindexed(DocumentQuery query) {
        return query.isOrdered()
                && unindexedOrderings.contains(query.collection() + "." + query.order().field());
    }

    private IndexUnavailableException missingIndex(DocumentQuery query) {
        return new IndexUnavailableException("The query requires an index: " + query.shape());
    }

    private Map<String, JsonObject> collection(String name) {
        return collections.computeIfAbsent(name, key -> new LinkedHashMap<>());
    }

    private JsonObject stamp(JsonObject data) {
        lastTimestamp = Math.max(clock.millis(), lastTimestamp + 1);
        return FieldValues.resolveServerTimestamps(data, lastTimestamp);
    }

    private static <T> Future<T> unavailable() {
        return Future.failedFuture(new StoreUnavailableException("Document store is unavailable"));
    }

    private final class Listener {
        private final DocumentQuery query;
        private final Handler<List<JsonObject>> onSnapshot;
        private final Handler<Throwable> onError;

        private Listener(DocumentQuery query, Handler<List<JsonObject>> onSnapshot, Handler<Throwable> onError) {
            this.query = query;
            this.onSnapshot = onSnapshot;
            this.onError = onError;
        }

        void deliver(List<JsonObject> rows) {
            onSnapshot.handle(rows);
        }

        void fail(Throwable error) {
            listeners.remove(this);
            onError.handle(error);
        }
    }
}
