package com.leasedesk.showing.showing.service;

import com.leasedesk.showing.agent.dto.AgentInfo;
import com.leasedesk.showing.availability.algorithm.SlotGenerationResult;
import com.leasedesk.showing.availability.algorithm.TimeInterval;
import com.leasedesk.showing.availability.dto.AvailabilityDto;
import com.leasedesk.showing.property.dto.AppFolioGroup;
import com.leasedesk.showing.property.dto.AppFolioProperty;
import com.leasedesk.showing.property.dto.PropertyInfo;
import com.leasedesk.showing.showing.dto.ShowingQuery;
import lombok.Getter;
import lombok.Setter;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Data gathered by the stages of one invocation. Never shared between invocations.
 */
@Getter
@Setter
class PipelineState {

    private final ShowingQuery query;
    private final ZonedDateTime now;

    private String propertyId;
    private AppFolioProperty property;
    private List<AppFolioGroup> groups;
    private AgentInfo agent;
    private String accessToken;
    private List<TimeInterval> busyIntervals;
    private SlotGenerationResult slots;
    private AvailabilityDto availability;
    private String formattedMessage;

    PipelineState(ShowingQuery query, ZonedDateTime now) {
        this.query = query;
        this.now = now;
    }

    PropertyInfo propertyInfo() {
        return property != null ? PropertyInfo.from(property) : new PropertyInfo();
    }

    AgentInfo agentInfo() {
        return agent != null ? agent : new AgentInfo();
    }
}
