package com.shopstream.sink;

import java.io.Closeable;
import java.util.List;

/**
 * Idempotent document store: {@code PUT {index, id, document}} with a result per document.
 */
public interface UpsertSink extends Closeable {

    /**
     * Upserts every document, keyed by {@link SinkDocument#getDocumentId()}.
     *
     * @return one result per input document, in input order
     * @throws SinkWriteFailedException if the request as a whole failed
     */
    List<UpsertResult> upsert(List<? extends SinkDocument> documents);

    @Override
    void close();
}
