package com.leasedesk.showing.calendar.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Google Calendar freeBusy response, keyed by calendar id
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FreeBusyResponse {

    private Map<String, CalendarBusy> calendars;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CalendarBusy {

        @Builder.Default
        private List<BusyPeriod> busy = new ArrayList<>();

        @Builder.Default
        private List<CalendarError> errors = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BusyPeriod {
        private OffsetDateTime start;
        private OffsetDateTime end;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CalendarError {
        private String domain;
        private String reason;  // "notFound", "internalError", ...
    }
}
