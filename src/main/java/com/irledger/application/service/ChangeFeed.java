package com.irledger.application.service;

import com.irledger.application.port.out.DocumentQuery;
import com.irledger.application.port.out.DocumentStore;
import com.irledger.domain.exception.IndexUnavailableException;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Query runner shared by all services, for one-shot fetches and live subscriptions.
 *
 * <p>Ordered queries go to the store first. When the store reports that the
 * ordering needs an index it does not have, the query shape is remembered and
 * served from then on by an unordered fetch sorted in memory with the same
 * comparator the store path uses, so both paths return identical rows in
 * identical order.
 *
 * <p>One-shot fetches propagate store errors. Live subscriptions never do:
 * a failed listener delivers an empty list instead.
 */
@Slf4j
public class ChangeFeed implements AutoCloseable {

    private final DocumentStore store;
    private final Set<String> unindexedShapes = ConcurrentHashMap.newKeySet();
    private final Set<Subscription> openSubscriptions = ConcurrentHashMap.newKeySet();
    private final boolean sortInMemory;

    public ChangeFeed(DocumentStore store) {
        this(store, false);
    }

    /**
     * @param sortInMemory serve every ordered query through the in-memory sort,
     *                     without asking the store to order
     */
    public ChangeFeed(DocumentStore store, boolean sortInMemory) {
        this.store = store;
        this.sortInMemory = sortInMemory;
    }

    public Future<List<JsonObject>> fetch(DocumentQuery query) {
        if (!usesStoreOrdering(query)) {
            return fetchAndSort(query);
        }
        return store.query(query)
                .recover(error -> {
                    if (error instanceof IndexUnavailableException) {
                        markUnindexed(query, error);
                        return fetchAndSort(query);
                    }
                    return Future.failedFuture(error);
                });
    }

    public Subscription subscribe(DocumentQuery query, Handler<List<JsonObject>> callback) {
        Subscription subscription = new Subscription(callback, openSubscriptions::remove);
        openSubscriptions.add(subscription);
        attach(subscription, query);
        log.debug("Subscribed to {}", query.shape());
        return subscription;
    }

    public int openSubscriptionCount() {
        return openSubscriptions.size();
    }

    /**
     * Cancel every subscription still open on this feed
     */
    @Override
    public void close() {
        List<Subscription> open = new ArrayList<>(openSubscriptions);
        open.forEach(Subscription::cancel);
        if (!open.isEmpty()) {
            log.info("Closed {} open change feed subscriptions", open.size());
        }
    }

    private void attach(Subscription subscription, DocumentQuery query) {
        boolean storeOrdered = usesStoreOrdering(query);
        long generation = subscription.nextGeneration();

        subscription.bind(generation, store.listen(
                storeOrdered ? query : query.withoutOrder(),
                rows -> subscription.deliver(generation, storeOrdered ? rows : sortAndLimit(rows, query)),
                error -> {
                    if (storeOrdered && error instanceof IndexUnavailableException) {
                        markUnindexed(query, error);
                        attach(subscription, query);
                        return;
                    }
                    log.warn("Live feed on {} failed, delivering empty result: {}", query.shape(), error.getMessage());
                    subscription.deliver(generation, List.of());
                }));
    }

    private Future<List<JsonObject>> fetchAndSort(DocumentQuery query) {
        if (!query.isOrdered()) {
            return store.query(query);
        }
        return store.query(query.withoutOrder())
                .map(rows -> sortAndLimit(rows, query));
    }

    private boolean usesStoreOrdering(DocumentQuery query) {
        return query.isOrdered() && !sortInMemory && !unindexedShapes.contains(query.shape());
    }

    private void markUnindexed(DocumentQuery query, Throwable error) {
        if (unindexedShapes.add(query.shape())) {
            log.warn("No index for {}, falling back to in-memory sort: {}", query.shape(), error.getMessage());
        }
    }

    static List<JsonObject> sortAndLimit(List<JsonObject> rows, DocumentQuery query) {
        List<JsonObject> sorted = new ArrayList<>(rows);
        sorted.sort(query.order().comparator());
        if (query.limit() != null && sorted.size() > query.limit()) {
            return new ArrayList<>(sorted.subList(0, query.limit()));
        }
        return sorted;
    }
}
