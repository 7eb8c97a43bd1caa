package com.leasedesk.showing.showing.message;

import com.leasedesk.showing.agent.dto.AgentInfo;
import com.leasedesk.showing.availability.dto.AvailabilityDto;
import com.leasedesk.showing.availability.dto.TimeSlotDto;
import com.leasedesk.showing.property.dto.PropertyInfo;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the caller-facing availability message.
 *
 * Output is a pure function of its inputs: slots are grouped by date label in first-seen order,
 * at most {@value #MAX_DATES} dates and {@value #MAX_TIMES_PER_DATE} times per date are listed.
 */
@Component
public class ShowingMessageFormatter {

    static final int MAX_DATES = 5;
    static final int MAX_TIMES_PER_DATE = 6;

    public String format(PropertyInfo property, AgentInfo agent, AvailabilityDto availability) {
        StringBuilder sb = new StringBuilder();

        sb.append(String.format("🏠 PROPERTY: %s\n", property.getName()));
        sb.append(String.format("📍 %s, %s, %s\n\n", property.getAddress(), property.getCity(), property.getState()));
        sb.append(String.format("👤 LEASING AGENT: %s\n", agent.getName()));
        sb.append(String.format("📧 Email: %s\n\n", agent.getEmail()));

        List<TimeSlotDto> slots = availability.getSlots() == null ? List.of() : availability.getSlots();
        if (slots.isEmpty()) {
            sb.append("📅 SHOWING AVAILABILITY:\n");
            sb.append(String.format("No available time slots found in the next %d days.\n", availability.getDaysChecked()));
            sb.append(String.format("%s's calendar is fully booked.\n\n", agent.getName()));
            sb.append(String.format("📞 Please contact %s directly at %s to schedule.", agent.getName(), agent.getEmail()));
            return sb.toString();
        }

        Map<String, List<String>> timesByDate = groupByDate(slots);

        sb.append("📅 AVAILABLE SHOWING TIMES:\n\n");
        int dateCount = 0;
        for (Map.Entry<String, List<String>> entry : timesByDate.entrySet()) {
            if (dateCount >= MAX_DATES) {
                break;
            }
            sb.append(entry.getKey()).append(":\n");

            List<String> times = entry.getValue();
            for (int i = 0; i < times.size(); i++) {
                if (i >= MAX_TIMES_PER_DATE) {
                    sb.append(String.format("  • ...%d more times available\n", times.size() - MAX_TIMES_PER_DATE));
                    break;
                }
                sb.append("  • ").append(times.get(i)).append('\n');
            }
            sb.append('\n');
            dateCount++;
        }

        if (timesByDate.size() > MAX_DATES) {
            sb.append(String.format("...and %d more days with availability\n", timesByDate.size() - MAX_DATES));
        }

        sb.append(String.format("\n📞 Contact %s at %s to schedule your showing.", agent.getName(), agent.getEmail()));
        return sb.toString();
    }

    private static Map<String, List<String>> groupByDate(List<TimeSlotDto> slots) {
        Map<String, List<String>> timesByDate = new LinkedHashMap<>();
        for (TimeSlotDto slot : slots) {
            timesByDate.computeIfAbsent(slot.getDate(), k -> new ArrayList<>()).add(slot.getTime());
        }
        return timesByDate;
    }
}
