package com.leasedesk.showing.showing.service;

import com.leasedesk.showing.agent.dto.AgentInfo;
import com.leasedesk.showing.agent.service.AgentDirectory;
import com.leasedesk.showing.agent.service.AgentResolver;
import com.leasedesk.showing.availability.algorithm.SlotGenerator;
import com.leasedesk.showing.availability.algorithm.TimeInterval;
import com.leasedesk.showing.calendar.client.CalendarTokenClient;
import com.leasedesk.showing.calendar.client.GoogleCalendarClient;
import com.leasedesk.showing.calendar.exception.CalendarReadException;
import com.leasedesk.showing.calendar.exception.CalendarTokenNotFoundException;
import com.leasedesk.showing.common.config.ShowingProperties;
import com.leasedesk.showing.common.exception.InvalidQueryException;
import com.leasedesk.showing.common.exception.UpstreamServiceException;
import com.leasedesk.showing.matching.client.OpenAiAddressMatcher;
import com.leasedesk.showing.matching.dto.AddressCandidate;
import com.leasedesk.showing.matching.ratelimit.RateLimitExceededException;
import com.leasedesk.showing.property.client.AppFolioClient;
import com.leasedesk.showing.property.client.PropertySearchClient;
import com.leasedesk.showing.property.dto.AppFolioGroup;
import com.leasedesk.showing.property.dto.AppFolioProperty;
import com.leasedesk.showing.property.exception.PropertyNotFoundException;
import com.leasedesk.showing.showing.dto.ShowingAvailabilityResponse;
import com.leasedesk.showing.showing.dto.ShowingQuery;
import com.leasedesk.showing.showing.message.ShowingMessageFormatter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ShowingAvailabilityService test")
class ShowingAvailabilityServiceTest {

    // Monday, December 1, 2025 08:00 in Los Angeles
    private static final Instant NOW = Instant.parse("2025-12-01T16:00:00Z");
    private static final ZoneId LA = ZoneId.of("America/Los_Angeles");
    private static final String EMAIL = "gracie@ltrealestateco.com";

    @Mock
    private PropertySearchClient propertySearchClient;

    @Mock
    private AppFolioClient appFolioClient;

    @Mock
    private CalendarTokenClient calendarTokenClient;

    @Mock
    private GoogleCalendarClient googleCalendarClient;

    @Mock
    private OpenAiAddressMatcher addressMatcher;

    private ShowingAvailabilityService service;

    private AppFolioProperty property;

    @BeforeEach
    void setUp() {
        AgentDirectory directory = AgentDirectory.of(Map.of(
                "PD1", AgentInfo.builder().id("agent-1").name("Gracie").email(EMAIL).zone("PD1").build()));

        service = new ShowingAvailabilityService(
                propertySearchClient,
                appFolioClient,
                new AgentResolver(directory),
                calendarTokenClient,
                googleCalendarClient,
                addressMatcher,
                new SlotGenerator("America/Los_Angeles"),
                new ShowingMessageFormatter(),
                new ShowingProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));

        property = AppFolioProperty.builder()
                .id("p-100")
                .name("Maple Court")
                .address1("828 Main Street")
                .city("Portland")
                .state("OR")
                .propertyGroupIds(List.of("g-1", "g-2"))
                .build();
    }

    private static ShowingQuery query(String text) {
        return ShowingQuery.builder().query(text).build();
    }

    private void givenPropertyWithAgent() {
        given(propertySearchClient.findPropertyId("828 Main")).willReturn("p-100");
        given(appFolioClient.getProperty("p-100")).willReturn(property);
        given(appFolioClient.getPropertyGroups(List.of("g-1", "g-2"))).willReturn(List.of(
                new AppFolioGroup("g-1", "Downtown"),
                new AppFolioGroup("g-2", "pd1")));
    }

    // ========================================
    // Success
    // ========================================

    @Test
    @DisplayName("Full pipeline - property, agent, slots and formatted message")
    void getAvailability_success() {
        // given
        givenPropertyWithAgent();
        given(calendarTokenClient.getAccessToken(EMAIL)).willReturn("ya29.token");
        given(googleCalendarClient.getBusyIntervals(eq("ya29.token"), eq(EMAIL), any(), any()))
                .willReturn(List.of(new TimeInterval(
                        Instant.parse("2025-12-01T18:00:00Z"), Instant.parse("2025-12-01T19:00:00Z"))));

        // when
        ShowingAvailabilityResponse response = service.getAvailability(query("828 Main"));

        // then
        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.SUCCESS);
        assertThat(response.getMessage()).isEqualTo("Success");
        assertThat(response.getProperty().getAddress()).isEqualTo("828 Main Street");
        assertThat(response.getAgent().getName()).isEqualTo("Gracie");
        assertThat(response.getAgent().getZoneGroup()).isEqualTo("pd1");
        assertThat(response.getAvailability().getDaysChecked()).isEqualTo(5);
        assertThat(response.getAvailability().getTotalSlotsAvailable()).isEqualTo(73);
        assertThat(response.getAvailability().getSlots()).hasSize(30);
        assertThat(response.getAvailability().getSlots().get(0).getTime()).isEqualTo("11:00 AM");
        assertThat(response.getFormattedMessage())
                .startsWith("🏠 PROPERTY: Maple Court\n")
                .contains("Monday, December 1, 2025:\n  • 11:00 AM\n")
                .endsWith("📞 Contact Gracie at gracie@ltrealestateco.com to schedule your showing.");
    }

    @Test
    @DisplayName("Calendar window is [now, now + 7 days) in the business time zone")
    void getAvailability_calendarWindow() {
        // given
        givenPropertyWithAgent();
        given(calendarTokenClient.getAccessToken(EMAIL)).willReturn("ya29.token");
        given(googleCalendarClient.getBusyIntervals(anyString(), anyString(), any(), any())).willReturn(List.of());

        // when
        service.getAvailability(query("828 Main"));

        // then
        ZonedDateTime now = ZonedDateTime.ofInstant(NOW, LA);
        then(googleCalendarClient).should().getBusyIntervals("ya29.token", EMAIL, now, now.plusDays(7));
    }

    @Test
    @DisplayName("Pre-resolved property id skips the search service")
    void getAvailability_preResolvedId() {
        // given
        given(appFolioClient.getProperty("p-100")).willReturn(property);
        given(appFolioClient.getPropertyGroups(anyList())).willReturn(List.of(new AppFolioGroup("g-2", "PD1")));
        given(calendarTokenClient.getAccessToken(EMAIL)).willReturn("t");
        given(googleCalendarClient.getBusyIntervals(anyString(), anyString(), any(), any())).willReturn(List.of());

        // when
        ShowingAvailabilityResponse response = service.getAvailability(
                ShowingQuery.builder().query("828 Main").preResolvedPropertyId("p-100").build());

        // then
        assertThat(response.isSuccess()).isTrue();
        then(propertySearchClient).shouldHaveNoInteractions();
        then(addressMatcher).shouldHaveNoInteractions();
    }

    // ========================================
    // Halts
    // ========================================

    @Test
    @DisplayName("Search finds nothing - PROPERTY_NOT_FOUND with the query in the message")
    void getAvailability_propertyNotFound() {
        // given
        given(propertySearchClient.findPropertyId("12 Nowhere Lane"))
                .willThrow(new PropertyNotFoundException("No property found for query: 12 Nowhere Lane"));

        // when
        ShowingAvailabilityResponse response = service.getAvailability(query("12 Nowhere Lane"));

        // then
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.PROPERTY_NOT_FOUND);
        assertThat(response.getMessage()).isEqualTo("Could not find property matching query.");
        assertThat(response.getFormattedMessage())
                .isEqualTo("I couldn't find a property matching '12 Nowhere Lane'. Could you verify the address?");
        assertThat(response.getProperty().getId()).isNull();
        assertThat(response.getAvailability().getSlots()).isEmpty();
        then(appFolioClient).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("AppFolio details fail - PROPERTY_DETAILS_UNAVAILABLE")
    void getAvailability_detailsUnavailable() {
        // given
        given(propertySearchClient.findPropertyId("828 Main")).willReturn("p-100");
        given(appFolioClient.getProperty("p-100")).willThrow(new UpstreamServiceException("appfolio", "timeout"));

        // when
        ShowingAvailabilityResponse response = service.getAvailability(query("828 Main"));

        // then
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.PROPERTY_DETAILS_UNAVAILABLE);
        assertThat(response.getMessage()).isEqualTo("Property found but details unavailable.");
        assertThat(response.getFormattedMessage())
                .isEqualTo("I found the property but couldn't access its details right now.");
        assertThat(response.getProperty().getName()).isNull();
    }

    @Test
    @DisplayName("Group lookup fails - AGENT_UNMAPPED carrying the property")
    void getAvailability_groupsFail() {
        // given
        given(propertySearchClient.findPropertyId("828 Main")).willReturn("p-100");
        given(appFolioClient.getProperty("p-100")).willReturn(property);
        given(appFolioClient.getPropertyGroups(anyList())).willThrow(new UpstreamServiceException("appfolio", "500"));

        // when
        ShowingAvailabilityResponse response = service.getAvailability(query("828 Main"));

        // then
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.AGENT_UNMAPPED);
        assertThat(response.getMessage()).isEqualTo("Could not determine agent.");
        assertThat(response.getFormattedMessage())
                .isEqualTo("I have the details for 828 Main Street, but I'm having trouble finding the assigned agent.");
        assertThat(response.getProperty().getId()).isEqualTo("p-100");
        assertThat(response.getAgent().getEmail()).isNull();
    }

    @Test
    @DisplayName("No zone group - AGENT_UNMAPPED, calendar never touched")
    void getAvailability_noZoneGroup() {
        // given
        given(propertySearchClient.findPropertyId("828 Main")).willReturn("p-100");
        given(appFolioClient.getProperty("p-100")).willReturn(property);
        given(appFolioClient.getPropertyGroups(anyList())).willReturn(List.of(new AppFolioGroup("g-1", "Downtown")));

        // when
        ShowingAvailabilityResponse response = service.getAvailability(query("828 Main"));

        // then
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.AGENT_UNMAPPED);
        assertThat(response.getMessage()).isEqualTo("No leasing agent assigned (No PD group).");
        assertThat(response.getFormattedMessage())
                .isEqualTo("I checked 828 Main Street, but there doesn't seem to be a leasing agent assigned to it yet.");
        assertThat(response.getProperty().getCity()).isEqualTo("Portland");
        then(calendarTokenClient).shouldHaveNoInteractions();
        then(googleCalendarClient).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("Property without groups - AGENT_UNMAPPED")
    void getAvailability_noGroups() {
        // given
        property.setPropertyGroupIds(List.of());
        given(propertySearchClient.findPropertyId("828 Main")).willReturn("p-100");
        given(appFolioClient.getProperty("p-100")).willReturn(property);
        given(appFolioClient.getPropertyGroups(List.of())).willReturn(List.of());

        // when
        ShowingAvailabilityResponse response = service.getAvailability(query("828 Main"));

        // then
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.AGENT_UNMAPPED);
        assertThat(response.getMessage()).isEqualTo("No leasing agent assigned (No PD group).");
    }

    @Test
    @DisplayName("No stored calendar token - CALENDAR_ACCESS_UNAVAILABLE with property, agent and email")
    void getAvailability_noCalendarToken() {
        // given
        givenPropertyWithAgent();
        given(calendarTokenClient.getAccessToken(EMAIL))
                .willThrow(new CalendarTokenNotFoundException("No token found for email: " + EMAIL));

        // when
        ShowingAvailabilityResponse response = service.getAvailability(query("828 Main"));

        // then
        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.CALENDAR_ACCESS_UNAVAILABLE);
        assertThat(response.getMessage()).isEqualTo("Agent calendar access unavailable.");
        assertThat(response.getFormattedMessage()).isEqualTo(
                "I'd love to schedule a viewing for 828 Main Street, but I can't access Gracie's calendar right now. "
                        + "Please email them at gracie@ltrealestateco.com.");
        assertThat(response.getProperty().getId()).isEqualTo("p-100");
        assertThat(response.getAgent().getEmail()).isEqualTo(EMAIL);
        then(googleCalendarClient).shouldHaveNoInteractions();
    }

    @Test
    @DisplayName("Calendar read fails - CALENDAR_READ_FAILED with property and agent")
    void getAvailability_calendarReadFails() {
        // given
        givenPropertyWithAgent();
        given(calendarTokenClient.getAccessToken(EMAIL)).willReturn("expired");
        given(googleCalendarClient.getBusyIntervals(anyString(), anyString(), any(), any()))
                .willThrow(new CalendarReadException("Calendar error: notFound"));

        // when
        ShowingAvailabilityResponse response = service.getAvailability(query("828 Main"));

        // then
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.CALENDAR_READ_FAILED);
        assertThat(response.getMessage()).isEqualTo("Failed to read calendar.");
        assertThat(response.getFormattedMessage()).isEqualTo(
                "I'm having trouble checking Gracie's availability. Please contact them directly at gracie@ltrealestateco.com.");
        assertThat(response.getProperty().getName()).isEqualTo("Maple Court");
        assertThat(response.getAgent().getName()).isEqualTo("Gracie");
    }

    @Test
    @DisplayName("Blank query - InvalidQueryException before any call")
    void getAvailability_blankQuery() {
        assertThatThrownBy(() -> service.getAvailability(query("   ")))
                .isInstanceOf(InvalidQueryException.class);
        assertThatThrownBy(() -> service.getAvailability(query(null)))
                .isInstanceOf(InvalidQueryException.class);

        then(propertySearchClient).shouldHaveNoInteractions();
    }

    // ========================================
    // Address candidates
    // ========================================

    @Test
    @DisplayName("Matcher picks a candidate - search is skipped")
    void getAvailability_matcherPicksCandidate() {
        // given
        List<AddressCandidate> candidates = List.of(
                new AddressCandidate("828 Main Street", "p-100"),
                new AddressCandidate("77 Harbor Way", "p-77"));
        given(addressMatcher.isEnabled()).willReturn(true);
        given(addressMatcher.pickBestCandidate(eq("eight twenty eight main"), eq(candidates), any()))
                .willReturn(Optional.of("p-100"));
        given(appFolioClient.getProperty("p-100")).willReturn(property);
        given(appFolioClient.getPropertyGroups(anyList())).willReturn(List.of(new AppFolioGroup("g-2", "PD1")));
        given(calendarTokenClient.getAccessToken(EMAIL)).willReturn("t");
        given(googleCalendarClient.getBusyIntervals(anyString(), anyString(), any(), any())).willReturn(List.of());

        // when
        ShowingAvailabilityResponse response = service.getAvailability(ShowingQuery.builder()
                .query("eight twenty eight main")
                .candidates(candidates)
                .build());

        // then
        assertThat(response.isSuccess()).isTrue();
        then(propertySearchClient).shouldHaveNoInteractions();
        then(addressMatcher).should().pickBestCandidate(eq("eight twenty eight main"), eq(candidates),
                eq(NOW.plusSeconds(10)));
    }

    @Test
    @DisplayName("Matcher rate limited - falls back to search")
    void getAvailability_matcherFailsFallsBackToSearch() {
        // given
        List<AddressCandidate> candidates = List.of(new AddressCandidate("828 Main Street", "p-100"));
        given(addressMatcher.isEnabled()).willReturn(true);
        given(addressMatcher.pickBestCandidate(anyString(), anyList(), any()))
                .willThrow(new RateLimitExceededException("rate limited"));
        given(propertySearchClient.findPropertyId("828 Main"))
                .willThrow(new PropertyNotFoundException("none"));

        // when
        ShowingAvailabilityResponse response = service.getAvailability(ShowingQuery.builder()
                .query("828 Main")
                .candidates(candidates)
                .build());

        // then
        assertThat(response.getOutcome()).isEqualTo(PipelineOutcome.PROPERTY_NOT_FOUND);
        then(propertySearchClient).should().findPropertyId("828 Main");
    }

    @Test
    @DisplayName("Matcher reports no match - falls back to search")
    void getAvailability_matcherNoMatchFallsBackToSearch() {
        // given
        given(addressMatcher.isEnabled()).willReturn(true);
        given(addressMatcher.pickBestCandidate(anyString(), anyList(), any())).willReturn(Optional.empty());
        given(propertySearchClient.findPropertyId("828 Main")).willThrow(new PropertyNotFoundException("none"));

        // when
        service.getAvailability(ShowingQuery.builder()
                .query("828 Main")
                .candidates(List.of(new AddressCandidate("77 Harbor Way", "p-77")))
                .build());

        // then
        then(propertySearchClient).should().findPropertyId("828 Main");
    }

    @Test
    @DisplayName("No API key - candidates are ignored")
    void getAvailability_matcherDisabled() {
        // given
        given(addressMatcher.isEnabled()).willReturn(false);
        given(propertySearchClient.findPropertyId("828 Main")).willThrow(new PropertyNotFoundException("none"));

        // when
        service.getAvailability(ShowingQuery.builder()
                .query("828 Main")
                .candidates(List.of(new AddressCandidate("828 Main Street", "p-100")))
                .build());

        // then
        then(addressMatcher).should(never()).pickBestCandidate(anyString(), anyList(), any());
    }
}
