package com.leasedesk.showing.vapi.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leasedesk.showing.common.exception.InvalidQueryException;
import com.leasedesk.showing.matching.dto.AddressCandidate;
import com.leasedesk.showing.showing.dto.ShowingQuery;
import com.leasedesk.showing.vapi.dto.VapiSearchResult;
import com.leasedesk.showing.vapi.dto.VapiWebhookPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a voice assistant "tool-calls" webhook into a pipeline query.
 *
 * Query and phone come from the first tool call. Address candidates are the search results
 * returned by earlier tool calls of the same conversation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VapiToolCallParser {

    static final String TOOL_CALLS_TYPE = "tool-calls";
    static final String TOOL_CALL_RESULT_ROLE = "tool_call_result";

    private final ObjectMapper objectMapper;

    /**
     * @throws InvalidQueryException payload is not a tool-calls message
     */
    public ShowingQuery parse(VapiWebhookPayload payload) {
        VapiWebhookPayload.Message message = payload == null ? null : payload.getMessage();
        if (message == null || !TOOL_CALLS_TYPE.equals(message.getType())) {
            throw new InvalidQueryException("Unsupported webhook message type: "
                    + (message == null ? null : message.getType()));
        }

        String query = null;
        String phone = null;
        if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
            VapiWebhookPayload.ToolCall first = message.getToolCalls().get(0);
            if (first != null && first.getFunction() != null && first.getFunction().getArguments() != null) {
                query = first.getFunction().getArguments().getQuery();
                phone = first.getFunction().getArguments().getPhone();
            }
        }

        List<AddressCandidate> candidates = collectCandidates(message.getArtifact());
        log.info("Tool call parsed: query='{}', candidates={}", query, candidates.size());

        return ShowingQuery.builder()
                .query(query)
                .phone(phone)
                .candidates(candidates)
                .build();
    }

    private List<AddressCandidate> collectCandidates(VapiWebhookPayload.Artifact artifact) {
        List<AddressCandidate> candidates = new ArrayList<>();
        if (artifact == null || artifact.getMessages() == null) {
            return candidates;
        }

        for (VapiWebhookPayload.ArtifactMessage msg : artifact.getMessages()) {
            if (msg == null || !TOOL_CALL_RESULT_ROLE.equals(msg.getRole())) {
                continue;
            }
            VapiSearchResult result = readSearchResult(msg.getResult());
            if (result == null || result.getResults() == null) {
                continue;
            }
            for (VapiSearchResult.Result r : result.getResults()) {
                VapiSearchResult.Metadata metadata = r == null ? null : r.getMetadata();
                if (metadata == null || isBlank(metadata.getAddress1()) || isBlank(metadata.getPropertyId())) {
                    continue;
                }
                candidates.add(new AddressCandidate(metadata.getAddress1(), metadata.getPropertyId()));
            }
        }
        return candidates;
    }

    /**
     * Search result object, or null for string results and shapes that do not bind.
     */
    private VapiSearchResult readSearchResult(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(raw, VapiSearchResult.class);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring unreadable tool call result: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
