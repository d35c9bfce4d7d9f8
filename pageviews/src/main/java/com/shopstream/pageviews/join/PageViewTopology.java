package com.shopstream.pageviews.join;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.config.PipelineConfig;
import com.shopstream.config.SourceConfig;
import com.shopstream.engine.Emitter;
import com.shopstream.engine.JoinTopology;
import com.shopstream.engine.StreamProcessor;
import com.shopstream.metrics.PipelineMetrics;
import com.shopstream.pageviews.model.EnrichedRecord;
import com.shopstream.pageviews.model.FinalizedView;
import com.shopstream.pageviews.model.ProductRecord;
import com.shopstream.pageviews.model.SaleEvent;
import com.shopstream.pageviews.model.UserRecord;
import com.shopstream.pageviews.model.ViewEvent;
import com.shopstream.source.JsonRecordDecoder;
import com.shopstream.source.RecordDecoder;
import com.shopstream.state.DimensionDescriptor;
import com.shopstream.state.FactBufferDescriptor;
import com.shopstream.state.KeyedStateStore;

import java.util.List;

/**
 * Wires the four shop streams into the page-view join: products and users as dimension
 * tables, sales and pending views as fact buffers keyed by product id, and markers of
 * emitted views keyed by view id.
 */
public class PageViewTopology implements JoinTopology<EnrichedRecord> {

    private final PipelineConfig config;
    private final ObjectMapper objectMapper;
    private final Long viewLatenessMs;
    private final FactBufferDescriptor<SaleEvent> sales;
    private final FactBufferDescriptor<FinalizedView> finalized;

    public PageViewTopology(PipelineConfig config, ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.viewLatenessMs = config.getSource(PageViewState.VIEWS_SOURCE).getAllowedLatenessMs();
        for (String required : List.of(PageViewState.PRODUCTS_SOURCE, PageViewState.USERS_SOURCE,
                PageViewState.SALES_SOURCE)) {
            config.getSource(required);
        }
        this.sales = PageViewState.sales(config.getMatchWindowMs(), viewLatenessMs);
        this.finalized = PageViewState.finalizedViews(viewLatenessMs, config.getDedupHorizonMs());
    }

    @Override
    public RecordDecoder<?> decoderFor(SourceConfig source) {
        switch (source.getName()) {
            case PageViewState.PRODUCTS_SOURCE:
                return new JsonRecordDecoder<>(ProductRecord.class, objectMapper);
            case PageViewState.USERS_SOURCE:
                return new JsonRecordDecoder<>(UserRecord.class, objectMapper);
            case PageViewState.SALES_SOURCE:
                return new JsonRecordDecoder<>(SaleEvent.class, objectMapper);
            case PageViewState.VIEWS_SOURCE:
                return new JsonRecordDecoder<>(ViewEvent.class, objectMapper);
            default:
                throw new IllegalArgumentException("Source '" + source.getName()
                        + "' is not part of the page-view join");
        }
    }

    @Override
    public List<DimensionDescriptor<?>> dimensionTables() {
        return List.of(PageViewState.PRODUCTS, PageViewState.USERS);
    }

    @Override
    public List<FactBufferDescriptor<?>> factBuffers() {
        return List.of(sales, PageViewState.PENDING_VIEWS, finalized);
    }

    @Override
    public Class<EnrichedRecord> outputType() {
        return EnrichedRecord.class;
    }

    @Override
    public StreamProcessor createProcessor(KeyedStateStore store, Emitter<EnrichedRecord> emitter,
                                           PipelineMetrics metrics) {
        return new PageViewJoinEngine(store, emitter, metrics, sales, finalized, viewLatenessMs,
                config.getMatchWindowMs(), config.getEngine().getCapacityPolicy());
    }
}
