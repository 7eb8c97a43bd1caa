package com.leasedesk.showing.showing.controller;

import com.leasedesk.showing.showing.dto.ShowingAvailabilityRequest;
import com.leasedesk.showing.showing.dto.ShowingAvailabilityResponse;
import com.leasedesk.showing.showing.dto.ShowingQuery;
import com.leasedesk.showing.showing.service.ShowingAvailabilityService;
import com.leasedesk.showing.vapi.dto.VapiWebhookPayload;
import com.leasedesk.showing.vapi.service.VapiToolCallParser;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Showing availability API
 */
@Tag(name = "Showing Availability", description = "Leasing agent showing availability API")
@RestController
@RequestMapping("/v1/showings")
@RequiredArgsConstructor
@Slf4j
public class ShowingAvailabilityController {

    private final ShowingAvailabilityService showingAvailabilityService;
    private final VapiToolCallParser vapiToolCallParser;

    @Operation(
            summary = "Find showing availability",
            description = "Resolves the property matching the query, its leasing agent and the agent's free showing slots for the next 7 days."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lookup finished (check success and outcome)"),
            @ApiResponse(responseCode = "400", description = "Missing query or malformed body")
    })
    @PostMapping("/availability")
    public ResponseEntity<ShowingAvailabilityResponse> getAvailability(
            @Valid @RequestBody ShowingAvailabilityRequest request
    ) {
        log.info("POST /v1/showings/availability - query: {}, propertyId: {}",
                request.getQuery(), request.getPropertyId());

        return ResponseEntity.ok(showingAvailabilityService.getAvailability(ShowingQuery.from(request)));
    }

    @Operation(
            summary = "Voice assistant tool call",
            description = "Same lookup driven by a voice assistant tool-calls webhook. Address candidates from earlier tool results are matched against the query first."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Lookup finished (check success and outcome)"),
            @ApiResponse(responseCode = "400", description = "Unsupported message type, missing query or malformed body")
    })
    @PostMapping("/vapi/tool-calls")
    public ResponseEntity<ShowingAvailabilityResponse> handleToolCall(
            @RequestBody VapiWebhookPayload payload
    ) {
        log.info("POST /v1/showings/vapi/tool-calls");

        ShowingQuery query = vapiToolCallParser.parse(payload);
        return ResponseEntity.ok(showingAvailabilityService.getAvailability(query));
    }
}
