package com.leasedesk.showing.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Leasing agent assigned to a property zone
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentInfo {

    private String id;

    private String name;

    private String email;

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String zone;  // PD1, PD2, ...

    /**
     * Property group label as it appeared in AppFolio (not normalized)
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private String zoneGroup;
}
