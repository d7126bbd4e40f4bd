package com.irledger.adapter.out.persistence;

import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.application.port.out.FieldValues;
import com.irledger.application.port.out.ListenerRegistration;
import com.irledger.domain.exception.IndexUnavailableException;
import com.irledger.domain.exception.NotFoundException;
import com.irledger.domain.exception.StoreUnavailableException;
import com.mongodb.MongoException;
import com.mongodb.client.model.changestream.ChangeStreamDocument;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.streams.ReadStream;
import io.vertx.ext.mongo.FindOptions;
import io.vertx.ext.mongo.MongoClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * MongoDB implementation of DocumentStore on top of the Vert.x Mongo client
 * Live queries use change streams, so the server must run as a replica set.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoDocumentStore implements DocumentStore {

    private static final int DUPLICATE_KEY = 11000;
    private static final int NO_QUERY_EXECUTION_PLANS = 291;
    private static final int SORT_EXCEEDED_MEMORY_LIMIT = 292;
    private static final int QUERY_PLAN_FAILED = 17007;
    private static final int BAD_VALUE = 2;
    private static final int CHANGE_STREAM_BATCH_SIZE = 100;

    private final MongoClient mongoClient;
    private final AtomicLong lastTimestamp = new AtomicLong();

    @Override
    public Future<Optional<JsonObject>> get(String collection, String id) {
        return mongoClient.findOne(collection, byId(id), null)
                .map(doc -> Optional.ofNullable(doc).map(MongoDocumentStore::fromMongo))
                .recover(error -> failed("get " + collection + "/" + id, error));
    }

    @Override
    public Future<String> add(String collection, JsonObject data) {
        return mongoClient.insert(collection, stamp(data))
                .onSuccess(id -> log.debug("Inserted {}/{}", collection, id))
                .recover(error -> failed("insert into " + collection, error));
    }

    @Override
    public Future<Void> set(String collection, String id, JsonObject data) {
        return mongoClient.save(collection, toMongo(id, data))
                .<Void>mapEmpty()
                .recover(error -> failed("save " + collection + "/" + id, error));
    }

    @Override
    public Future<Void> update(String collection, String id, JsonObject fields) {
        return mongoClient.updateCollection(collection, byId(id), new JsonObject().put("$set", stamp(fields)))
                .recover(error -> failed("update " + collection + "/" + id, error))
                .compose(result -> {
                    if (result == null || result.getDocMatched() == 0) {
                        return Future.<Void>failedFuture(NotFoundException.of("Document " + collection, id));
                    }
                    return Future.<Void>succeededFuture();
                });
    }

    @Override
    public Future<Boolean> updateIf(String collection, String id, JsonObject expected, JsonObject fields) {
        JsonObject filter = byId(id);
        expected.forEach(entry -> filter.put(entry.getKey(), entry.getValue()));

        return mongoClient.updateCollection(collection, filter, new JsonObject().put("$set", stamp(fields)))
                .recover(error -> failed("update " + collection + "/" + id, error))
                .compose(result -> {
                    if (result != null && result.getDocMatched() > 0) {
                        return Future.<Boolean>succeededFuture(true);
                    }
                    // Distinguish a failed precondition from a missing document
                    return get(collection, id).compose(existing -> {
                        if (existing.isEmpty()) {
                            return Future.<Boolean>failedFuture(NotFoundException.of("Document " + collection, id));
                        }
                        return Future.succeededFuture(false);
                    });
                });
    }

    @Override
    public Future<Boolean> createIfAbsent(String collection, String id, JsonObject data) {
        return mongoClient.insert(collection, toMongo(id, data))
                .map(ignored -> true)
                .recover(error -> {
                    if (error instanceof MongoException mongoError && mongoError.getCode() == DUPLICATE_KEY) {
                        log.debug("Document {}/{} already exists", collection, id);
                        return Future.succeededFuture(false);
                    }
                    return MongoDocumentStore.<Boolean>failed("insert " + collection + "/" + id, error);
                });
    }

    @Override
    public Future<List<JsonObject>> query(DocumentQuery query) {
        FindOptions options = new FindOptions();
        if (query.isOrdered()) {
            int direction = query.order().isDescending() ? -1 : 1;
            options.setSort(new JsonObject()
                    .put(query.order().field(), direction)
                    .put("_id", direction));
        }
        if (query.limit() != null) {
            options.setLimit(query.limit());
        }

        return mongoClient.findWithOptions(query.collection(), toFilter(query), options)
                .map(rows -> rows.stream().map(MongoDocumentStore::fromMongo).collect(Collectors.toList()))
                .recover(error -> failed("query " + query.shape(), error));
    }

    @Override
    public ListenerRegistration listen(DocumentQuery query,
                                       Handler<List<JsonObject>> onSnapshot,
                                       Handler<Throwable> onError) {
        ReadStream<ChangeStreamDocument<JsonObject>> changes =
                mongoClient.watch(query.collection(), new JsonArray(), false, CHANGE_STREAM_BATCH_SIZE);
        LiveQuery live = new LiveQuery(query, changes, onSnapshot, onError);
        changes.exceptionHandler(error -> live.fail(toStoreException("watch " + query.collection(), error)));
        changes.handler(change -> live.refresh());
        live.refresh();
        return live::close;
    }

    private JsonObject toFilter(DocumentQuery query) {
        JsonObject filter = new JsonObject();
        for (Map.Entry<String, Object> entry : query.equalTo().entrySet()) {
            String field = "id".equals(entry.getKey()) ? "_id" : entry.getKey();
            filter.put(field, entry.getValue());
        }
        if (query.arrayContains() != null) {
            // Equality against an array field matches any element
            filter.put(query.arrayContains().field(), query.arrayContains().value());
        }
        return filter;
    }

    private JsonObject stamp(JsonObject data) {
        long now = lastTimestamp.updateAndGet(last -> Math.max(System.currentTimeMillis(), last));
        return FieldValues.resolveServerTimestamps(data, now);
    }

    private JsonObject toMongo(String id, JsonObject data) {
        JsonObject doc = stamp(data);
        doc.remove("id");
        return doc.put("_id", id);
    }

    private static JsonObject byId(String id) {
        return new JsonObject().put("_id", id);
    }

    private static JsonObject fromMongo(JsonObject doc) {
        JsonObject copy = doc.copy();
        Object id = copy.remove("_id");
        return copy.put("id", id instanceof JsonObject oid ? oid.getString("$oid") : String.valueOf(id));
    }

    private static <T> Future<T> failed(String operation, Throwable error) {
        return Future.failedFuture(toStoreException(operation, error));
    }

    static RuntimeException toStoreException(String operation, Throwable error) {
        if (error instanceof NotFoundException notFound) {
            return notFound;
        }
        if (error instanceof MongoException mongoError && isIndexError(mongoError)) {
            return new IndexUnavailableException("Index unavailable for " + operation, error);
        }
        log.error("MongoDB {} failed: {}", operation, error.getMessage());
        return new StoreUnavailableException("MongoDB " + operation + " failed: " + error.getMessage(), error);
    }

    private static boolean isIndexError(MongoException error) {
        switch (error.getCode()) {
            case NO_QUERY_EXECUTION_PLANS:
            case SORT_EXCEEDED_MEMORY_LIMIT:
            case QUERY_PLAN_FAILED:
                return true;
            case BAD_VALUE:
                // e.g. "hint provided does not correspond to an existing index"
                return String.valueOf(error.getMessage()).toLowerCase().contains("index");
            default:
                return false;
        }
    }

    /**
     * A change stream driving re-queries of one live query
     *
     * <p>Refreshes run one at a time. Changes that arrive while a refresh is
     * in flight collapse into a single follow-up refresh, so snapshots reach
     * the listener in the order the server produced them.
     */
    private final class LiveQuery {

        private final DocumentQuery query;
        private final ReadStream<ChangeStreamDocument<JsonObject>> changes;
        private final Handler<List<JsonObject>> onSnapshot;
        private final Handler<Throwable> onError;

        private boolean active = true;
        private boolean running;
        private boolean dirty;
        private boolean detached;

        LiveQuery(DocumentQuery query, ReadStream<ChangeStreamDocument<JsonObject>> changes,
                  Handler<List<JsonObject>> onSnapshot, Handler<Throwable> onError) {
            this.query = query;
            this.changes = changes;
            this.onSnapshot = onSnapshot;
            this.onError = onError;
        }

        void refresh() {
            synchronized (this) {
                if (!active) {
                    return;
                }
                if (running) {
                    dirty = true;
                    return;
                }
                running = true;
            }
            query(query).onComplete(this::completed);
        }

        void fail(Throwable error) {
            synchronized (this) {
                if (!active) {
                    return;
                }
                active = false;
            }
            detach();
            onError.handle(error);
        }

        void close() {
            synchronized (this) {
                active = false;
            }
            detach();
        }

        private void completed(AsyncResult<List<JsonObject>> result) {
            if (result.failed()) {
                fail(result.cause());
                return;
            }
            boolean again;
            synchronized (this) {
                if (!active) {
                    return;
                }
                again = dirty;
                dirty = false;
                running = again;
            }
            onSnapshot.handle(result.result());
            if (again) {
                query(query).onComplete(this::completed);
            }
        }

        private void detach() {
            synchronized (this) {
                if (detached) {
                    return;
                }
                detached = true;
            }
            // A null handler cancels the underlying change stream subscription
            changes.handler(null);
            log.debug("Change stream on {} closed", query.collection());
        }
    }
}
