package com.leasedesk.showing.availability.dto;

import com.leasedesk.showing.availability.algorithm.SlotGenerationResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Agent availability returned to the caller
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityDto {

    public static final int MAX_SLOTS = 30;

    private int totalSlotsAvailable;

    private int daysChecked;

    /** At most {@link #MAX_SLOTS} slots, oldest first. */
    private List<TimeSlotDto> slots;

    public static AvailabilityDto from(SlotGenerationResult result) {
        List<TimeSlotDto> freeSlots = result.getFreeSlots();
        List<TimeSlotDto> capped = freeSlots.size() > MAX_SLOTS
                ? new ArrayList<>(freeSlots.subList(0, MAX_SLOTS))
                : new ArrayList<>(freeSlots);

        return AvailabilityDto.builder()
                .totalSlotsAvailable(freeSlots.size())
                .daysChecked(result.getDaysChecked())
                .slots(capped)
                .build();
    }

    public static AvailabilityDto empty() {
        return AvailabilityDto.builder()
                .totalSlotsAvailable(0)
                .daysChecked(0)
                .slots(new ArrayList<>())
                .build();
    }
}
