package com.shopstream.pageviews.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shopstream.state.FactEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A product page view; the stream that drives the join.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ViewEvent implements FactEvent {

    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("view_time")
    private long viewTime;

    @JsonProperty("page_url")
    private String pageUrl;

    private String ip;

    @JsonProperty("event_time")
    private long eventTime;

    /**
     * Identity of the view, and of the record it produces.
     */
    @JsonIgnore
    public String getViewId() {
        return EnrichedRecord.documentId(productId, userId, viewTime);
    }
}
