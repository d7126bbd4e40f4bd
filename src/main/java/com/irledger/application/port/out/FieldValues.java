package com.irledger.application.port.out;

import io.vertx.core.json.JsonObject;

/**
 * Sentinel field values understood by every {@link DocumentStore} adapter
 */
public final class FieldValues {

    /**
     * Replaced by the store clock at write time
     */
    public static final String SERVER_TIMESTAMP = "__server_timestamp__";

    private FieldValues() {
    }

    /**
     * Replace top-level server timestamp sentinels with the given instant
     */
    public static JsonObject resolveServerTimestamps(JsonObject data, long epochMillis) {
        JsonObject resolved = data.copy();
        for (String field : data.fieldNames()) {
            if (SERVER_TIMESTAMP.equals(data.getValue(field))) {
                resolved.put(field, epochMillis);
            }
        }
        return resolved;
    }
}
