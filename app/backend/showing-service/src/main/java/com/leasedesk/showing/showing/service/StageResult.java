package com.leasedesk.showing.showing.service;

import com.leasedesk.showing.showing.dto.ShowingAvailabilityResponse;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Result of one pipeline stage: advance to the next stage, or halt with a final response.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class StageResult {

    private static final StageResult ADVANCE = new StageResult(null);

    private final ShowingAvailabilityResponse response;

    public static StageResult advance() {
        return ADVANCE;
    }

    public static StageResult halt(ShowingAvailabilityResponse response) {
        return new StageResult(response);
    }

    public boolean isHalted() {
        return response != null;
    }
}
