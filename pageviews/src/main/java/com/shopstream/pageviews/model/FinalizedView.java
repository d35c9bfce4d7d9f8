package com.shopstream.pageviews.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shopstream.state.FactEvent;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Marker left behind by a view that has been emitted, so that a re-delivery of the same
 * view is recognised.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FinalizedView implements FactEvent {

    @JsonProperty("view_id")
    private String viewId;

    /** Event time of the emitted view. */
    @JsonProperty("event_time")
    private long eventTime;
}
