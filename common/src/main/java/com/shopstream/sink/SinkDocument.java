package com.shopstream.sink;

/**
 * A document written to the upsert sink.  Writing two documents with the same id leaves
 * only the last one, which makes re-delivery harmless.
 */
public interface SinkDocument {

    /** Stable identity of the document in the sink. */
    String getDocumentId();
}
