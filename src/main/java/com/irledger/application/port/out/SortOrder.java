package com.irledger.application.port.out;

import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;

/**
 * Ordering of a query result by a single field, with the document id as tie-breaker.
 * The same comparator backs the in-memory store and the change feed fallback
 * sort, so both paths produce identical orderings.
 */
public record SortOrder(String field, Direction direction) {

    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    public static SortOrder ascending(String field) {
        return new SortOrder(field, Direction.ASCENDING);
    }

    public static SortOrder descending(String field) {
        return new SortOrder(field, Direction.DESCENDING);
    }

    public boolean isDescending() {
        return direction == Direction.DESCENDING;
    }

    /**
     * Comparator for documents under this ordering. Documents missing the
     * field sort last in either direction.
     */
    public Comparator<JsonObject> comparator() {
        Comparator<JsonObject> byField = (a, b) -> compareValues(a.getValue(field), b.getValue(field));
        Comparator<JsonObject> natural = byField.thenComparing(doc -> doc.getString("id", ""));
        Comparator<JsonObject> directed = isDescending() ? natural.reversed() : natural;
        return Comparator.<JsonObject, Boolean>comparing(doc -> doc.getValue(field) == null)
                .thenComparing(directed);
    }

    static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : 1) : -1;
        }
        if (a instanceof Number && b instanceof Number) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString()));
        }
        if (a instanceof String left && b instanceof String right) {
            LocalDate leftDate = parseDate(left);
            LocalDate rightDate = parseDate(right);
            if (leftDate != null && rightDate != null) {
                return leftDate.compareTo(rightDate);
            }
            return left.compareTo(right);
        }
        return a.toString().compareTo(b.toString());
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
