package com.shopstream.pageviews.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Customer profile from the users topic.  The latest record per {@code id} wins.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserRecord {

    private String id;

    @JsonProperty("first_name")
    private String firstName;

    @JsonProperty("last_name")
    private String lastName;

    private String email;
    private String phone;

    @JsonProperty("street_address")
    private String streetAddress;

    private String city;
    private String state;

    @JsonProperty("zip_code")
    private String zipCode;

    private String country;
}
