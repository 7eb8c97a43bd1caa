package com.leasedesk.showing.property.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * AppFolio property group (GET /api/v0/property_groups)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppFolioGroup {

    @JsonProperty("Id")
    private String id;

    @JsonProperty("Name")
    private String name;  // "PD1", "Downtown", ...
}
