package com.leasedesk.showing.calendar.client;

import com.leasedesk.showing.availability.algorithm.TimeInterval;
import com.leasedesk.showing.calendar.dto.FreeBusyRequest;
import com.leasedesk.showing.calendar.dto.FreeBusyResponse;
import com.leasedesk.showing.calendar.exception.CalendarReadException;
import com.leasedesk.showing.common.config.ShowingProperties;
import com.leasedesk.showing.common.exception.UpstreamServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Google Calendar freeBusy client
 */
@Component
@Slf4j
public class GoogleCalendarClient {

    static final String SERVICE = "google-calendar";

    private final RestTemplate restTemplate;
    private final String baseUrl;

    public GoogleCalendarClient(RestTemplateBuilder restTemplateBuilder, ShowingProperties properties) {
        ShowingProperties.GoogleCalendar calendar = properties.getGoogleCalendar();
        this.restTemplate = restTemplateBuilder
                .setConnectTimeout(calendar.getTimeout())
                .setReadTimeout(calendar.getTimeout())
                .build();
        this.baseUrl = calendar.getBaseUrl();
    }

    /**
     * Busy periods of the agent's primary calendar inside [timeMin, timeMax).
     *
     * @param accessToken agent's OAuth access token
     * @param email       calendar id (agent email)
     * @param timeMin     window start; its zone is sent as the query time zone
     * @param timeMax     window end
     * @throws CalendarReadException    calendar missing from the answer or reported errors
     * @throws UpstreamServiceException request failed (auth, quota, transport)
     */
    public List<TimeInterval> getBusyIntervals(String accessToken, String email,
                                               ZonedDateTime timeMin, ZonedDateTime timeMax) {
        FreeBusyRequest body = FreeBusyRequest.builder()
                .timeMin(rfc3339(timeMin))
                .timeMax(rfc3339(timeMax))
                .timeZone(timeMin.getZone().getId())
                .items(List.of(new FreeBusyRequest.Item(email)))
                .build();

        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setContentType(MediaType.APPLICATION_JSON);

        FreeBusyResponse response;
        try {
            log.debug("Calendar freeBusy request: email={}, timeMin={}, timeMax={}", email, body.getTimeMin(), body.getTimeMax());
            response = restTemplate.postForObject(baseUrl + "/freeBusy", new HttpEntity<>(body, headers), FreeBusyResponse.class);
        } catch (RestClientException e) {
            log.error("Calendar freeBusy request failed: email={}, error={}", email, e.getMessage());
            throw new UpstreamServiceException(SERVICE, "Google Calendar API error", e);
        }

        if (response == null || response.getCalendars() == null || !response.getCalendars().containsKey(email)) {
            throw new CalendarReadException("Calendar not found in response for " + email);
        }

        FreeBusyResponse.CalendarBusy calendar = response.getCalendars().get(email);
        if (calendar.getErrors() != null && !calendar.getErrors().isEmpty()) {
            throw new CalendarReadException("Calendar error: " + calendar.getErrors().get(0).getReason());
        }

        List<TimeInterval> intervals = new ArrayList<>();
        if (calendar.getBusy() != null) {
            for (FreeBusyResponse.BusyPeriod period : calendar.getBusy()) {
                if (period.getStart() == null || period.getEnd() == null || !period.getStart().isBefore(period.getEnd())) {
                    log.warn("Skipping malformed busy period: email={}, start={}, end={}", email, period.getStart(), period.getEnd());
                    continue;
                }
                intervals.add(new TimeInterval(period.getStart().toInstant(), period.getEnd().toInstant()));
            }
        }
        return intervals;
    }

    private static String rfc3339(ZonedDateTime time) {
        return time.truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
