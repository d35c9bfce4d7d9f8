package com.shopstream.sink;

import lombok.Value;

/**
 * Outcome of one document within a bulk upsert.
 */
@Value
public class UpsertResult {

    String documentId;
    boolean success;
    String error;

    public static UpsertResult ok(String documentId) {
        return new UpsertResult(documentId, true, null);
    }

    public static UpsertResult failed(String documentId, String error) {
        return new UpsertResult(documentId, false, error);
    }
}
