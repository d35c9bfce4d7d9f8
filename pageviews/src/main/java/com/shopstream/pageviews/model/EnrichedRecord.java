package com.shopstream.pageviews.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.shopstream.sink.SinkDocument;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A page view joined with its product, user and most recent sale.  Fields of an absent
 * side of the join are {@code null}.
 *
 * <p>Document id: {@code product_id:user_id:view_time}.</p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnrichedRecord implements SinkDocument {

    @JsonProperty("product_id")
    private String productId;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("first_name")
    private String firstName;

    @JsonProperty("last_name")
    private String lastName;

    @JsonProperty("product_name")
    private String productName;

    private String brand;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("order_date")
    private Long orderDate;

    @JsonProperty("view_time")
    private long viewTime;

    @Override
    @JsonIgnore
    public String getDocumentId() {
        return documentId(productId, userId, viewTime);
    }

    public static String documentId(String productId, String userId, long viewTime) {
        return productId + ":" + userId + ":" + viewTime;
    }
}
