package com.leasedesk.showing.agent.service;

import com.leasedesk.showing.agent.dto.AgentInfo;
import com.leasedesk.showing.common.config.ShowingProperties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup table of leasing agents keyed by normalized zone code.
 */
public final class AgentDirectory {

    private final Map<String, AgentInfo> agentsByZone;

    private AgentDirectory(Map<String, AgentInfo> agentsByZone) {
        this.agentsByZone = Collections.unmodifiableMap(agentsByZone);
    }

    public static AgentDirectory from(Map<String, ShowingProperties.Agent> agents) {
        Map<String, AgentInfo> byZone = new LinkedHashMap<>();
        agents.forEach((zone, agent) -> {
            String code = normalize(zone);
            byZone.put(code, AgentInfo.builder()
                    .id(agent.getId())
                    .name(agent.getName())
                    .email(agent.getEmail())
                    .zone(code)
                    .build());
        });
        return new AgentDirectory(byZone);
    }

    public static AgentDirectory of(Map<String, AgentInfo> agentsByZone) {
        Map<String, AgentInfo> byZone = new LinkedHashMap<>();
        agentsByZone.forEach((zone, agent) -> byZone.put(normalize(zone), agent));
        return new AgentDirectory(byZone);
    }

    /**
     * @param zoneCode zone code, matched after trimming and upper-casing
     */
    public Optional<AgentInfo> findByZone(String zoneCode) {
        if (zoneCode == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(agentsByZone.get(normalize(zoneCode)));
    }

    public int size() {
        return agentsByZone.size();
    }

    static String normalize(String zoneCode) {
        return zoneCode.trim().toUpperCase(Locale.ROOT);
    }
}
