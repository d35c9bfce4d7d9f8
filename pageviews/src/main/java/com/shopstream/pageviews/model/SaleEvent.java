package com.shopstream.pageviews.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.shopstream.state.FactEvent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A completed order line for one product.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SaleEvent implements FactEvent {

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("customer_id")
    private String customerId;

    @JsonProperty("event_time")
    private long eventTime;
}
