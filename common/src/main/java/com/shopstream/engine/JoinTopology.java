package com.shopstream.engine;

import com.shopstream.config.SourceConfig;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.sink.SinkDocument;
import com.shopstream.source.RecordDecoder;
import com.shopstream.state.DimensionDescriptor;
import com.shopstream.state.FactBufferDescriptor;
import com.shopstream.state.KeyedStateStore;

import java.util.List;

/**
 * What a domain module plugs into the generic engine: how to decode each source, which
 * state tables exist, and the join itself.
 *
 * @param <O> the enriched output type
 */
public interface JoinTopology<O extends SinkDocument> {

    /**
     * @throws IllegalArgumentException if the source is not part of this topology
     */
    RecordDecoder<?> decoderFor(SourceConfig source);

    List<DimensionDescriptor<?>> dimensionTables();

    List<FactBufferDescriptor<?>> factBuffers();

    Class<O> outputType();

    StreamProcessor createProcessor(KeyedStateStore store, Emitter<O> emitter, PipelineMetrics metrics);
}
