package com.leasedesk.showing.availability.algorithm;

import com.leasedesk.showing.availability.dto.TimeSlotDto;
import com.leasedesk.showing.common.config.ShowingProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Showing slot generation
 *
 * Steps:
 * 1. Walk the next 7 calendar days from the reference day, skipping weekends
 * 2. Clip each weekday to business hours (09:00-17:00, Friday until 15:30)
 * 3. Keep a 2 hour lead time after the reference instant, rounded up to a half hour
 * 4. Emit every 30 minute slot that overlaps no busy interval
 */
@Component
@Slf4j
public class SlotGenerator {

    static final int MAX_DAYS = 7;
    static final Duration SLOT_DURATION = Duration.ofMinutes(30);
    static final Duration LEAD_TIME = Duration.ofHours(2);
    static final LocalTime WORK_START = LocalTime.of(9, 0);
    static final LocalTime WORK_END = LocalTime.of(17, 0);
    static final LocalTime FRIDAY_WORK_END = LocalTime.of(15, 30);

    @Getter
    private final ZoneId zone;

    @Autowired
    public SlotGenerator(ShowingProperties properties) {
        this(properties.getTimezone());
    }

    public SlotGenerator(String timezone) {
        this.zone = resolveZone(timezone);
    }

    /**
     * Generates the free showing slots.
     *
     * @param busyIntervals  busy periods from the agent's calendar, any order
     * @param referenceTime  "now" for this invocation
     * @return free slots, weekdays checked and total candidates walked
     */
    public SlotGenerationResult generate(List<TimeInterval> busyIntervals, Instant referenceTime) {
        Instant minStartTime = referenceTime.plus(LEAD_TIME);
        LocalDate firstDay = referenceTime.atZone(zone).toLocalDate();

        List<TimeSlotDto> availableSlots = new ArrayList<>();
        int daysChecked = 0;
        int totalSlots = 0;

        for (int d = 0; d < MAX_DAYS; d++) {
            LocalDate day = firstDay.plusDays(d);
            DayOfWeek dayOfWeek = day.getDayOfWeek();

            if (dayOfWeek == DayOfWeek.SATURDAY || dayOfWeek == DayOfWeek.SUNDAY) {
                continue;
            }
            daysChecked++;

            ZonedDateTime workStart = day.atTime(WORK_START).atZone(zone);
            ZonedDateTime workEnd = day.atTime(dayOfWeek == DayOfWeek.FRIDAY ? FRIDAY_WORK_END : WORK_END).atZone(zone);

            if (workStart.toInstant().isBefore(minStartTime)) {
                workStart = minStartTime.atZone(zone);
                if (workStart.isAfter(workEnd)) {
                    log.debug("Day consumed by lead time: day={}, minStart={}", day, workStart);
                    continue;
                }
                workStart = roundUpToHalfHour(workStart);
            }

            ZonedDateTime current = workStart;
            while (!current.plus(SLOT_DURATION).isAfter(workEnd)) {
                ZonedDateTime slotEnd = current.plus(SLOT_DURATION);

                if (!isBusy(current.toInstant(), slotEnd.toInstant(), busyIntervals)) {
                    availableSlots.add(TimeSlotDto.of(current, slotEnd));
                }
                totalSlots++;

                current = slotEnd;
            }
        }

        log.debug("Slot generation finished: busy={}, daysChecked={}, candidates={}, free={}",
                busyIntervals.size(), daysChecked, totalSlots, availableSlots.size());
        return new SlotGenerationResult(availableSlots, daysChecked, totalSlots);
    }

    /**
     * Checks the candidate slot against every busy interval.
     */
    boolean isBusy(Instant start, Instant end, List<TimeInterval> busyIntervals) {
        TimeInterval candidate = new TimeInterval(start, end);
        for (TimeInterval busy : busyIntervals) {
            if (busy.overlaps(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Next :00 or :30 boundary at or after {@code time}.
     */
    static ZonedDateTime roundUpToHalfHour(ZonedDateTime time) {
        ZonedDateTime hour = time.truncatedTo(ChronoUnit.HOURS);
        ZonedDateTime boundary = hour.plusMinutes((time.getMinute() / 30) * 30L);
        return boundary.isBefore(time) ? boundary.plus(SLOT_DURATION) : boundary;
    }

    private static ZoneId resolveZone(String timezone) {
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            log.warn("Timezone load failed, falling back to UTC: timezone={}, error={}", timezone, e.getMessage());
            return ZoneOffset.UTC;
        }
    }
}
