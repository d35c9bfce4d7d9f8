package com.shopstream.watermark;

import lombok.Value;

import java.util.List;

/**
 * Observable state of event-time progress: the global watermark, every source's
 * contribution, and the sources currently holding it back without progressing.
 */
@Value
public class WatermarkHealth {

    long globalWatermark;
    List<SourceStatus> sources;
    List<String> stalledSources;

    public boolean isHealthy() {
        return stalledSources.isEmpty();
    }

    @Value
    public static class SourceStatus {
        String name;
        long watermark;
        boolean idle;
        boolean available;
        long lastProgressAt;
        boolean stalled;
        String failure;
    }
}
