package com.irledger.application.port.out;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Query shape supported by the document store: equality filters, at most one
 * array-contains filter, an optional ordering and an optional limit.
 */
public record DocumentQuery(
        String collection,
        Map<String, Object> equalTo,
        ArrayContains arrayContains,
        SortOrder order,
        Integer limit
) {

    public record ArrayContains(String field, Object value) {
    }

    public DocumentQuery {
        Objects.requireNonNull(collection, "collection");
        equalTo = equalTo == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(equalTo));
    }

    public static DocumentQuery of(String collection) {
        return new DocumentQuery(collection, Map.of(), null, null, null);
    }

    public DocumentQuery where(String field, Object value) {
        Map<String, Object> filters = new LinkedHashMap<>(equalTo);
        filters.put(field, value);
        return new DocumentQuery(collection, filters, arrayContains, order, limit);
    }

    public DocumentQuery whereArrayContains(String field, Object value) {
        return new DocumentQuery(collection, equalTo, new ArrayContains(field, value), order, limit);
    }

    public DocumentQuery orderBy(SortOrder sortOrder) {
        return new DocumentQuery(collection, equalTo, arrayContains, sortOrder, limit);
    }

    public DocumentQuery limit(int maxResults) {
        return new DocumentQuery(collection, equalTo, arrayContains, order, maxResults);
    }

    /**
     * Same filters, no ordering and no limit: the full unordered result set
     * a caller needs to sort and cut locally.
     */
    public DocumentQuery withoutOrder() {
        return new DocumentQuery(collection, equalTo, arrayContains, null, null);
    }

    public boolean isOrdered() {
        return order != null;
    }

    /**
     * Identifies the index an ordered query needs: collection, filtered fields and ordering.
     */
    public String shape() {
        StringBuilder shape = new StringBuilder(collection).append('|')
                .append(String.join(",", new TreeSet<>(equalTo.keySet())));
        if (arrayContains != null) {
            shape.append("|contains:").append(arrayContains.field());
        }
        if (order != null) {
            shape.append("|order:").append(order.field()).append(':').append(order.direction());
        }
        return shape.toString();
    }

    public boolean matches(JsonObject doc) {
        for (Map.Entry<String, Object> filter : equalTo.entrySet()) {
            if (!valuesEqual(filter.getValue(), doc.getValue(filter.getKey()))) {
                return false;
            }
        }
        if (arrayContains != null) {
            Object values = doc.getValue(arrayContains.field());
            if (!(values instanceof JsonArray array)) {
                return false;
            }
            return array.stream().anyMatch(value -> valuesEqual(arrayContains.value(), value));
        }
        return true;
    }

    public static boolean valuesEqual(Object expected, Object actual) {
        if (expected instanceof Number && actual instanceof Number) {
            return new BigDecimal(expected.toString()).compareTo(new BigDecimal(actual.toString())) == 0;
        }
        return Objects.equals(expected, actual);
    }
}
