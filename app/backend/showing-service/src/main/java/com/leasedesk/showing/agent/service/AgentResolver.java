package com.leasedesk.showing.agent.service;

import com.leasedesk.showing.agent.dto.AgentInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Maps AppFolio property group labels to the leasing agent of the zone.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentResolver {

    private final AgentDirectory agentDirectory;

    /**
     * Returns the agent of the first label, in input order, that names a known zone.
     * The returned record carries that label unchanged as its zone group.
     *
     * @param groupLabels property group names
     * @return the agent, or empty when no label names a zone
     */
    public Optional<AgentInfo> resolve(List<String> groupLabels) {
        for (String label : groupLabels) {
            if (label == null) {
                continue;
            }
            Optional<AgentInfo> agent = agentDirectory.findByZone(label);
            if (agent.isPresent()) {
                log.debug("Zone matched: group={}, zone={}", label, agent.get().getZone());
                return Optional.of(agent.get().toBuilder().zoneGroup(label).build());
            }
        }
        log.debug("No zone group among labels: {}", groupLabels);
        return Optional.empty();
    }
}
