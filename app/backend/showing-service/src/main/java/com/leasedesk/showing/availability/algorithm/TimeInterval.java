package com.leasedesk.showing.availability.algorithm;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Half-open time interval [start, end) on the absolute timeline.
 */
@Getter
@EqualsAndHashCode
@ToString
public class TimeInterval {

    private final Instant start;
    private final Instant end;

    public TimeInterval(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Interval bounds must not be null");
        }
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("Interval start must be before end: " + start + " / " + end);
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Strict overlap: intervals that only touch do not overlap.
     */
    public boolean overlaps(TimeInterval other) {
        return this.start.isBefore(other.end) && this.end.isAfter(other.start);
    }
}
