package com.leasedesk.showing.showing.dto;

import com.leasedesk.showing.matching.dto.AddressCandidate;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * Pipeline input of one invocation
 */
@Getter
@Builder
@ToString
public class ShowingQuery {

    private final String query;

    private final String phone;

    /** Property id resolved out of band, skips the search lookup. */
    private final String preResolvedPropertyId;

    /** Addresses offered to the caller earlier in the conversation. */
    @Builder.Default
    private final List<AddressCandidate> candidates = Collections.emptyList();

    public static ShowingQuery from(ShowingAvailabilityRequest request) {
        return ShowingQuery.builder()
                .query(request.getQuery())
                .phone(request.getPhone())
                .preResolvedPropertyId(request.getPropertyId())
                .build();
    }
}
