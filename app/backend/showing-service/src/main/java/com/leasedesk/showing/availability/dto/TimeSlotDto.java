package com.leasedesk.showing.availability.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * One bookable 30-minute showing window
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeSlotDto {

    private static final DateTimeFormatter DATE_FORMATTER =
            DateTimeFormatter.ofPattern("EEEE, MMMM d, yyyy", Locale.US);
    private static final DateTimeFormatter TIME_FORMATTER =
            DateTimeFormatter.ofPattern("h:mm a", Locale.US);

    private String date;  // "Friday, December 5, 2025"

    private String time;  // "9:00 AM"

    private OffsetDateTime start;

    private OffsetDateTime end;

    /**
     * Builds a slot whose labels are rendered in the zone of {@code start}.
     */
    public static TimeSlotDto of(ZonedDateTime start, ZonedDateTime end) {
        return TimeSlotDto.builder()
                .date(start.format(DATE_FORMATTER))
                .time(start.format(TIME_FORMATTER))
                .start(start.toOffsetDateTime())
                .end(end.toOffsetDateTime())
                .build();
    }
}
