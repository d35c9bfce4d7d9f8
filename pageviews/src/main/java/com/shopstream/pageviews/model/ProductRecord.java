package com.shopstream.pageviews.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Catalog entry from the products topic.  The latest record per {@code id} wins.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductRecord {

    private String id;
    private String brand;
    private String name;

    @JsonProperty("sale_price")
    private BigDecimal salePrice;

    private Double rating;
}
