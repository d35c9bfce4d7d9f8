package com.shopstream.source;

import lombok.Value;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * One poll's worth of records from a single source, handed from a source worker to the
 * evaluation loop.
 *
 * <p>{@code nextOffsets} holds, per partition touched by this batch, the offset to resume
 * from once the batch has been applied.  It also covers records that were skipped because
 * they could not be decoded.</p>
 */
@Value
public class SourceBatch {

    String source;
    List<SourceRecord<?>> records;
    Map<Integer, Long> nextOffsets;
    long watermark;
    boolean available;
    boolean idle;
    String failure;

    public static SourceBatch of(String source, List<SourceRecord<?>> records,
                                 Map<Integer, Long> nextOffsets, long watermark, boolean idle) {
        return new SourceBatch(source, records, nextOffsets, watermark, true, idle, null);
    }

    public static SourceBatch unavailable(String source, long watermark, String failure) {
        return new SourceBatch(source, Collections.emptyList(), Collections.emptyMap(),
                watermark, false, false, failure);
    }

    public boolean isEmpty() {
        return records.isEmpty() && nextOffsets.isEmpty();
    }
}
