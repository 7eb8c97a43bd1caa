package com.leasedesk.showing.availability.algorithm;

import com.leasedesk.showing.availability.dto.TimeSlotDto;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Output of one {@link SlotGenerator} run.
 */
@Getter
@AllArgsConstructor
public class SlotGenerationResult {

    /** Free slots, oldest first. */
    private final List<TimeSlotDto> freeSlots;

    /** Weekdays looked at, including days fully consumed by the start buffer. */
    private final int daysChecked;

    /** Every 30-minute candidate walked, free or busy. */
    private final int totalCandidateSlots;
}
