package com.leasedesk.showing.property.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * AppFolio property record (GET /api/v0/properties)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppFolioProperty {

    @JsonProperty("Id")
    private String id;

    @JsonProperty("Name")
    private String name;

    @JsonProperty("Address1")
    private String address1;

    @JsonProperty("City")
    private String city;

    @JsonProperty("State")
    private String state;

    @Builder.Default
    @JsonProperty("PropertyGroupIds")
    private List<String> propertyGroupIds = new ArrayList<>();
}
