package com.shopstream.pageviews;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.shopstream.ShopstreamJobBase;
import com.shopstream.config.PipelineConfig;
import com.shopstream.engine.JoinTopology;
import com.shopstream.pageviews.join.PageViewTopology;
import com.shopstream.pageviews.model.EnrichedRecord;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the page-view enrichment job.
 *
 * <p>Usage:
 * <pre>
 *   java -jar shopstream-pageviews.jar [config-path]
 * </pre>
 *
 * <p>If no config path is supplied, the classpath resource {@code pipeline-config.yaml}
 * is used.</p>
 */
@Slf4j
public class PageViewsJob extends ShopstreamJobBase<EnrichedRecord> {

    private static final String DEFAULT_CONFIG = "pipeline-config.yaml";

    @Override
    protected String getDefaultConfigResource() {
        return DEFAULT_CONFIG;
    }

    @Override
    protected String getJobName(PipelineConfig config) {
        return "Shopstream Page Views [" + config.getElasticsearch().getIndex() + "]";
    }

    @Override
    protected JoinTopology<EnrichedRecord> createTopology(PipelineConfig config, ObjectMapper objectMapper) {
        return new PageViewTopology(config, objectMapper);
    }

    public static void main(String[] args) throws Exception {
        System.exit(new PageViewsJob().run(args));
    }
}
