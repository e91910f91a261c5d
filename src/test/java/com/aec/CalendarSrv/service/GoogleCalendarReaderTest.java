package com.aec.CalendarSrv.service;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.dto.CalendarEventDto;
import com.aec.CalendarSrv.exception.CalendarFetchException;
import com.aec.CalendarSrv.exception.CalendarLinkRequiredException;
import com.aec.CalendarSrv.exception.InvalidCalendarRequestException;
import com.aec.CalendarSrv.google.GoogleCalendarGateway;
import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpHeaders;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GoogleCalendarReaderTest {

    private static final long USER = 42L;
    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
    private static final Instant T1 = Instant.parse("2024-05-02T00:00:00Z");

    @Mock
    private CalendarCredentialProvider credentials;
    @Mock
    private GoogleCalendarGateway gateway;

    private GoogleCalendarProperties props;
    private GoogleCalendarReader reader;

    @BeforeEach
    void setUp() {
        props = new GoogleCalendarProperties();
        props.setClientId("client");
        props.setClientSecret("secret");
        props.setRedirectUri("http://localhost/api/google/auth/callback");
        props.setTokenEncryptionKey("000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f");
        reader = new GoogleCalendarReader(credentials, gateway, props);
    }

    @Test
    void keepsOnlyEventsOverlappingWindowInProviderOrder() throws IOException {
        givenToken();
        when(gateway.listPrimaryEvents(eq("access-1"), eq(T0), eq(T1), anyInt())).thenReturn(List.of(
                timed("ended-before", "2024-04-30T22:00:00Z", "2024-05-01T00:00:00Z"),
                timed("spans-start", "2024-04-30T23:00:00Z", "2024-05-01T01:00:00Z"),
                timed("inside", "2024-05-01T10:00:00Z", "2024-05-01T11:00:00Z"),
                allDay("all-day", "2024-05-01", "2024-05-02"),
                timed("starts-at-end", "2024-05-02T00:00:00Z", "2024-05-02T01:00:00Z")));

        List<CalendarEventDto> events = reader.listEvents(USER, T0, T1, null);

        assertThat(events).extracting(CalendarEventDto::getId)
                .containsExactly("spans-start", "inside", "all-day");
    }

    @Test
    void normalizesProviderFields() throws IOException {
        givenToken();
        Event event = timed("e1", "2024-05-01T10:00:00Z", "2024-05-01T11:00:00Z")
                .setSummary("  ")
                .setDescription("")
                .setLocation("Sala 3")
                .setStatus("confirmed")
                .setHtmlLink("https://calendar.google.com/event?eid=e1")
                .setOrganizer(new Event.Organizer().setEmail("boss@example.com").setDisplayName(""))
                .setAttendees(List.of(new EventAttendee()
                        .setEmail("ana@example.com")
                        .setDisplayName("Ana")
                        .setResponseStatus("accepted")));
        event.getStart().setTimeZone("America/Guayaquil");
        when(gateway.listPrimaryEvents(any(), any(), any(), anyInt())).thenReturn(List.of(event));

        CalendarEventDto dto = reader.listEvents(USER, T0, T1, null).get(0);

        assertThat(dto.getTitle()).isEqualTo("(No title)");
        assertThat(dto.getDescription()).isNull();
        assertThat(dto.getLocation()).isEqualTo("Sala 3");
        assertThat(dto.getStatus()).isEqualTo("confirmed");
        assertThat(dto.getHtmlLink()).isEqualTo("https://calendar.google.com/event?eid=e1");
        assertThat(dto.getStart().getDateTime()).isEqualTo("2024-05-01T10:00:00.000Z");
        assertThat(dto.getStart().getDate()).isNull();
        assertThat(dto.getStart().getTimeZone()).isEqualTo("America/Guayaquil");
        assertThat(dto.getOrganizer().getEmail()).isEqualTo("boss@example.com");
        assertThat(dto.getOrganizer().getDisplayName()).isNull();
        assertThat(dto.getAttendees()).singleElement().satisfies(a -> {
            assertThat(a.getEmail()).isEqualTo("ana@example.com");
            assertThat(a.getResponseStatus()).isEqualTo("accepted");
        });
    }

    @Test
    void allDayEventKeepsDateOnly() throws IOException {
        givenToken();
        when(gateway.listPrimaryEvents(any(), any(), any(), anyInt()))
                .thenReturn(List.of(allDay("holiday", "2024-05-01", "2024-05-02").setSummary("Feriado")));

        CalendarEventDto dto = reader.listEvents(USER, T0, T1, null).get(0);

        assertThat(dto.getTitle()).isEqualTo("Feriado");
        assertThat(dto.getStart().getDate()).isEqualTo("2024-05-01");
        assertThat(dto.getStart().getDateTime()).isNull();
        assertThat(dto.getAttendees()).isNull();
        assertThat(dto.getOrganizer()).isNull();
    }

    @Test
    void maxResultsDefaultsAndIsClamped() throws IOException {
        givenToken();
        when(gateway.listPrimaryEvents(any(), any(), any(), anyInt())).thenReturn(List.of());

        reader.listEvents(USER, T0, T1, null);
        verify(gateway).listPrimaryEvents("access-1", T0, T1, 50);

        reader.listEvents(USER, T0, T1, 0);
        verify(gateway).listPrimaryEvents("access-1", T0, T1, 1);

        reader.listEvents(USER, T0, T1, 10_000);
        verify(gateway).listPrimaryEvents("access-1", T0, T1, 2500);
    }

    @Test
    void invertedWindowIsRejectedBeforeAnyCall() {
        assertThatThrownBy(() -> reader.listEvents(USER, T1, T0, null))
                .isInstanceOf(InvalidCalendarRequestException.class);
        assertThatThrownBy(() -> reader.listEvents(USER, T0, T0, null))
                .isInstanceOf(InvalidCalendarRequestException.class);
        verifyNoInteractions(credentials, gateway);
    }

    @Test
    void linkRequiredPropagatesUnchanged() {
        CalendarLinkRequiredException linkRequired = new CalendarLinkRequiredException(USER, "no vinculado");
        when(credentials.getUsableCredential(USER)).thenThrow(linkRequired);

        assertThatThrownBy(() -> reader.listEvents(USER, T0, T1, null)).isSameAs(linkRequired);
        verifyNoInteractions(gateway);
    }

    @Test
    void googleErrorBecomesFetchExceptionWithProviderMessage() throws IOException {
        givenToken();
        GoogleJsonError details = new GoogleJsonError();
        details.setCode(403);
        details.setMessage("Calendar usage limits exceeded.");
        GoogleJsonResponseException error = new GoogleJsonResponseException(
                new HttpResponseException.Builder(403, "Forbidden", new HttpHeaders()), details);
        when(gateway.listPrimaryEvents(any(), any(), any(), anyInt())).thenThrow(error);

        assertThatThrownBy(() -> reader.listEvents(USER, T0, T1, null))
                .isInstanceOf(CalendarFetchException.class)
                .hasMessage("Calendar usage limits exceeded.")
                .hasCause(error);
    }

    @Test
    void networkErrorBecomesFetchException() throws IOException {
        givenToken();
        when(gateway.listPrimaryEvents(any(), any(), any(), anyInt()))
                .thenThrow(new SocketTimeoutException("Read timed out"));

        assertThatThrownBy(() -> reader.listEvents(USER, T0, T1, null))
                .isInstanceOf(CalendarFetchException.class)
                .hasMessage("Read timed out");
    }

    private void givenToken() {
        when(credentials.getUsableCredential(USER))
                .thenReturn(new UsableCredential("access-1", Instant.parse("2024-05-01T09:00:00Z")));
    }

    private static Event timed(String id, String start, String end) {
        return new Event()
                .setId(id)
                .setSummary("Evento " + id)
                .setStart(new EventDateTime().setDateTime(DateTime.parseRfc3339(start)))
                .setEnd(new EventDateTime().setDateTime(DateTime.parseRfc3339(end)));
    }

    private static Event allDay(String id, String startDate, String endDate) {
        return new Event()
                .setId(id)
                .setStart(new EventDateTime().setDate(DateTime.parseRfc3339(startDate)))
                .setEnd(new EventDateTime().setDate(DateTime.parseRfc3339(endDate)));
    }
}
