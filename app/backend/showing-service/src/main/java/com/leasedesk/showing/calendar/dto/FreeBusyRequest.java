package com.leasedesk.showing.calendar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Google Calendar freeBusy query body
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FreeBusyRequest {

    private String timeMin;  // RFC 3339

    private String timeMax;  // RFC 3339

    private String timeZone;

    private List<Item> items;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Item {
        private String id;
    }
}
