package com.leasedesk.showing.showing.service;

import com.leasedesk.showing.agent.dto.AgentInfo;
import com.leasedesk.showing.agent.service.AgentResolver;
import com.leasedesk.showing.availability.algorithm.SlotGenerator;
import com.leasedesk.showing.availability.dto.AvailabilityDto;
import com.leasedesk.showing.calendar.client.CalendarTokenClient;
import com.leasedesk.showing.calendar.client.GoogleCalendarClient;
import com.leasedesk.showing.common.config.ShowingProperties;
import com.leasedesk.showing.common.exception.InvalidQueryException;
import com.leasedesk.showing.matching.client.OpenAiAddressMatcher;
import com.leasedesk.showing.property.client.AppFolioClient;
import com.leasedesk.showing.property.client.PropertySearchClient;
import com.leasedesk.showing.property.dto.AppFolioGroup;
import com.leasedesk.showing.property.dto.PropertyInfo;
import com.leasedesk.showing.showing.dto.ShowingAvailabilityResponse;
import com.leasedesk.showing.showing.dto.ShowingQuery;
import com.leasedesk.showing.showing.message.ShowingMessageFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Showing availability pipeline
 *
 * Resolves the property a caller asked about, finds its leasing agent and returns the agent's
 * free showing slots for the coming week. Every collaborator failure ends the pipeline with a
 * partial response; nothing but input errors leaves this class as an exception.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShowingAvailabilityService {

    static final Duration SEARCH_WINDOW = Duration.ofDays(7);

    private final PropertySearchClient propertySearchClient;
    private final AppFolioClient appFolioClient;
    private final AgentResolver agentResolver;
    private final CalendarTokenClient calendarTokenClient;
    private final GoogleCalendarClient googleCalendarClient;
    private final OpenAiAddressMatcher addressMatcher;
    private final SlotGenerator slotGenerator;
    private final ShowingMessageFormatter messageFormatter;
    private final ShowingProperties properties;
    private final Clock clock;

    /**
     * Runs the pipeline for one query.
     *
     * @throws InvalidQueryException query is blank
     */
    public ShowingAvailabilityResponse getAvailability(ShowingQuery query) {
        if (query.getQuery() == null || query.getQuery().isBlank()) {
            throw new InvalidQueryException("Query is required");
        }

        long startedAt = System.currentTimeMillis();
        log.info("Showing availability lookup: query='{}', candidates={}",
                query.getQuery(), query.getCandidates().size());

        PipelineState state = new PipelineState(query, ZonedDateTime.ofInstant(clock.instant(), slotGenerator.getZone()));
        state.setPropertyId(resolvePreselectedPropertyId(query));

        ShowingAvailabilityResponse response = runStages(state);

        log.info("Showing availability lookup finished: outcome={}, duration={}ms",
                response.getOutcome(), System.currentTimeMillis() - startedAt);
        return response;
    }

    private ShowingAvailabilityResponse runStages(PipelineState state) {
        for (PipelineStage stage : PipelineStage.values()) {
            StageResult result;
            try {
                result = execute(stage, state);
            } catch (RuntimeException e) {
                if (stage == PipelineStage.GENERATE_AVAILABILITY || stage == PipelineStage.FORMAT_MESSAGE) {
                    throw e;
                }
                log.warn("Stage failed: stage={}, error={}", stage, e.getMessage(), e);
                result = StageResult.halt(failure(stage, state));
            }

            if (result.isHalted()) {
                log.info("Pipeline halted: stage={}, outcome={}", stage, result.getResponse().getOutcome());
                return result.getResponse();
            }
            log.debug("Stage completed: stage={}", stage);
        }

        return ShowingAvailabilityResponse.builder()
                .success(true)
                .outcome(PipelineOutcome.SUCCESS)
                .property(state.propertyInfo())
                .agent(state.agentInfo())
                .availability(state.getAvailability())
                .message("Success")
                .formattedMessage(state.getFormattedMessage())
                .build();
    }

    private StageResult execute(PipelineStage stage, PipelineState state) {
        switch (stage) {
            case RESOLVE_PROPERTY_ID:
                if (state.getPropertyId() == null) {
                    state.setPropertyId(propertySearchClient.findPropertyId(state.getQuery().getQuery()));
                }
                return StageResult.advance();

            case FETCH_PROPERTY_DETAILS:
                state.setProperty(appFolioClient.getProperty(state.getPropertyId()));
                return StageResult.advance();

            case FETCH_PROPERTY_GROUPS:
                List<String> groupIds = state.getProperty().getPropertyGroupIds();
                state.setGroups(appFolioClient.getPropertyGroups(groupIds == null ? List.of() : groupIds));
                return StageResult.advance();

            case MAP_AGENT:
                List<String> labels = state.getGroups().stream()
                        .map(AppFolioGroup::getName)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toList());
                Optional<AgentInfo> agent = agentResolver.resolve(labels);
                if (agent.isEmpty()) {
                    PropertyInfo property = state.propertyInfo();
                    return StageResult.halt(partial(state, PipelineOutcome.AGENT_UNMAPPED,
                            "No leasing agent assigned (No PD group).",
                            String.format("I checked %s, but there doesn't seem to be a leasing agent assigned to it yet.",
                                    property.getAddress())));
                }
                state.setAgent(agent.get());
                return StageResult.advance();

            case FETCH_CALENDAR_CREDENTIAL:
                state.setAccessToken(calendarTokenClient.getAccessToken(state.getAgent().getEmail()));
                return StageResult.advance();

            case FETCH_BUSY_INTERVALS:
                ZonedDateTime now = state.getNow();
                state.setBusyIntervals(googleCalendarClient.getBusyIntervals(
                        state.getAccessToken(), state.getAgent().getEmail(), now, now.plus(SEARCH_WINDOW)));
                return StageResult.advance();

            case GENERATE_AVAILABILITY:
                state.setSlots(slotGenerator.generate(state.getBusyIntervals(), state.getNow().toInstant()));
                state.setAvailability(AvailabilityDto.from(state.getSlots()));
                return StageResult.advance();

            case FORMAT_MESSAGE:
                state.setFormattedMessage(messageFormatter.format(
                        state.propertyInfo(), state.agentInfo(), state.getAvailability()));
                return StageResult.advance();

            default:
                throw new IllegalStateException("Unhandled stage: " + stage);
        }
    }

    /**
     * Partial response for a stage that threw.
     */
    private ShowingAvailabilityResponse failure(PipelineStage stage, PipelineState state) {
        PropertyInfo property = state.propertyInfo();
        AgentInfo agent = state.agentInfo();

        switch (stage) {
            case RESOLVE_PROPERTY_ID:
                return partial(state, PipelineOutcome.PROPERTY_NOT_FOUND,
                        "Could not find property matching query.",
                        String.format("I couldn't find a property matching '%s'. Could you verify the address?",
                                state.getQuery().getQuery()));
            case FETCH_PROPERTY_DETAILS:
                return partial(state, PipelineOutcome.PROPERTY_DETAILS_UNAVAILABLE,
                        "Property found but details unavailable.",
                        "I found the property but couldn't access its details right now.");
            case FETCH_PROPERTY_GROUPS:
            case MAP_AGENT:
                return partial(state, PipelineOutcome.AGENT_UNMAPPED,
                        "Could not determine agent.",
                        String.format("I have the details for %s, but I'm having trouble finding the assigned agent.",
                                property.getAddress()));
            case FETCH_CALENDAR_CREDENTIAL:
                return partial(state, PipelineOutcome.CALENDAR_ACCESS_UNAVAILABLE,
                        "Agent calendar access unavailable.",
                        String.format("I'd love to schedule a viewing for %s, but I can't access %s's calendar right now. Please email them at %s.",
                                property.getAddress(), agent.getName(), agent.getEmail()));
            case FETCH_BUSY_INTERVALS:
                return partial(state, PipelineOutcome.CALENDAR_READ_FAILED,
                        "Failed to read calendar.",
                        String.format("I'm having trouble checking %s's availability. Please contact them directly at %s.",
                                agent.getName(), agent.getEmail()));
            default:
                throw new IllegalStateException("Stage cannot fail: " + stage);
        }
    }

    private ShowingAvailabilityResponse partial(PipelineState state, PipelineOutcome outcome,
                                                String message, String formattedMessage) {
        return ShowingAvailabilityResponse.builder()
                .success(false)
                .outcome(outcome)
                .property(state.propertyInfo())
                .agent(state.agentInfo())
                .availability(AvailabilityDto.empty())
                .message(message)
                .formattedMessage(formattedMessage)
                .build();
    }

    /**
     * Property id known before the search stage: the caller-supplied id, or the candidate the
     * address matcher picked. Returns null when the search service has to decide.
     */
    private String resolvePreselectedPropertyId(ShowingQuery query) {
        if (query.getPreResolvedPropertyId() != null && !query.getPreResolvedPropertyId().isBlank()) {
            log.debug("Using pre-resolved property id: {}", query.getPreResolvedPropertyId());
            return query.getPreResolvedPropertyId();
        }
        if (query.getCandidates().isEmpty() || !addressMatcher.isEnabled()) {
            return null;
        }

        Instant deadline = clock.instant().plus(properties.getOpenai().getMaxRateLimitWait());
        try {
            Optional<String> propertyId = addressMatcher.pickBestCandidate(
                    query.getQuery(), query.getCandidates(), deadline);
            if (propertyId.isPresent()) {
                log.info("Address matcher picked property: propertyId={}", propertyId.get());
                return propertyId.get();
            }
            log.info("Address matcher found no candidate, falling back to search");
        } catch (RuntimeException e) {
            log.warn("Address matching failed, falling back to search: error={}", e.getMessage());
        }
        return null;
    }
}
