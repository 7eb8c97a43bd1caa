package com.leasedesk.showing.property.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Property summary returned to the caller
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PropertyInfo {

    private String id;

    private String name;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String address;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String city;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String state;

    public static PropertyInfo from(AppFolioProperty property) {
        return PropertyInfo.builder()
                .id(property.getId())
                .name(property.getName())
                .address(property.getAddress1())
                .city(property.getCity())
                .state(property.getState())
                .build();
    }
}
