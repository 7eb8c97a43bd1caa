package com.leasedesk.showing.showing.dto;

import com.leasedesk.showing.agent.dto.AgentInfo;
import com.leasedesk.showing.availability.dto.AvailabilityDto;
import com.leasedesk.showing.property.dto.PropertyInfo;
import com.leasedesk.showing.showing.service.PipelineOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Showing availability response. Failed lookups still carry whatever was resolved before the failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShowingAvailabilityResponse {

    private boolean success;

    private PipelineOutcome outcome;

    @Builder.Default
    private PropertyInfo property = new PropertyInfo();

    @Builder.Default
    private AgentInfo agent = new AgentInfo();

    @Builder.Default
    private AvailabilityDto availability = AvailabilityDto.empty();

    /** Short status for machines. */
    private String message;

    /** Text to read or show to the caller. */
    private String formattedMessage;
}
