package com.leasedesk.showing.showing.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Showing availability request
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShowingAvailabilityRequest {

    @Schema(description = "Free text property query", example = "828 Main Street")
    @NotBlank(message = "Query is required")
    @JsonProperty("Query")
    private String query;

    @Schema(description = "Caller phone number")
    @JsonProperty("Phone")
    private String phone;

    /**
     * AppFolio property id resolved by an earlier step (optional).
     * When present the property search is skipped.
     */
    @Schema(description = "Pre-resolved AppFolio property id")
    @JsonProperty("PropertyId")
    private String propertyId;
}
