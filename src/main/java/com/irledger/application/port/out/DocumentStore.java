package com.irledger.application.port.out;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;

import java.util.List;
import java.util.Optional;

/**
 * Output port for the external document store
 * Part of hexagonal architecture - the store owns all durable state, services hold none.
 *
 * <p>Documents returned by the store always carry their id in the {@code id} field.
 * Any field written with {@link FieldValues#SERVER_TIMESTAMP} is replaced by the
 * store clock (epoch millis, never decreasing).
 *
 * <p>Failures are reported as {@code IndexUnavailableException} when an ordered
 * query lacks a supporting index and as {@code StoreUnavailableException} for
 * transport or permission problems.
 */
public interface DocumentStore {

    /**
     * Read a single document
     * @return the document, or empty if it does not exist
     */
    Future<Optional<JsonObject>> get(String collection, String id);

    /**
     * Insert a document under a store-generated id
     * @return the generated id
     */
    Future<String> add(String collection, JsonObject data);

    /**
     * Create or replace the document with the given id
     */
    Future<Void> set(String collection, String id, JsonObject data);

    /**
     * Merge fields into an existing document
     * Fails with {@code NotFoundException} if the document does not exist.
     */
    Future<Void> update(String collection, String id, JsonObject fields);

    /**
     * Compare-and-set: merge fields only if every field of {@code expected}
     * currently holds the given value (a null value matches a missing field)
     * @return true if the update was applied, false if the precondition did not hold
     */
    Future<Boolean> updateIf(String collection, String id, JsonObject expected, JsonObject fields);

    /**
     * Insert a document under an explicit id unless that id is already taken
     * @return true if this call created the document
     */
    Future<Boolean> createIfAbsent(String collection, String id, JsonObject data);

    /**
     * Run a one-shot query
     */
    Future<List<JsonObject>> query(DocumentQuery query);

    /**
     * Register a live query. The full result set is delivered once on
     * registration and again after every change that affects the collection.
     * Errors are reported through {@code onError}; the listener is dead afterwards.
     */
    ListenerRegistration listen(DocumentQuery query,
                                Handler<List<JsonObject>> onSnapshot,
                                Handler<Throwable> onError);
}
