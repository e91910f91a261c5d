package com.aec.CalendarSrv.service;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.dto.CalendarEventDto;
import com.aec.CalendarSrv.dto.CalendarEventDto.EventPerson;
import com.aec.CalendarSrv.dto.CalendarEventDto.EventTime;
import com.aec.CalendarSrv.exception.CalendarFetchException;
import com.aec.CalendarSrv.exception.CalendarNotConfiguredException;
import com.aec.CalendarSrv.exception.InvalidCalendarRequestException;
import com.aec.CalendarSrv.google.GoogleCalendarGateway;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class GoogleCalendarReader {

    public static final int DEFAULT_MAX_RESULTS = 50;
    // Límite de Google para events.list
    public static final int MAX_RESULTS_LIMIT = 2500;
    static final String UNTITLED = "(No title)";

    private final CalendarCredentialProvider credentials;
    private final GoogleCalendarGateway gateway;
    private final GoogleCalendarProperties props;

    /**
     * Eventos del calendario principal que se superponen con {@code [timeMin, timeMax)}, en el
     * orden en que los entrega Google. Cada llamada consulta de nuevo.
     */
    public List<CalendarEventDto> listEvents(long userId, Instant timeMin, Instant timeMax, Integer maxResults) {
        if (!props.isConfigured()) {
            throw new CalendarNotConfiguredException();
        }
        if (timeMin == null || timeMax == null || !timeMin.isBefore(timeMax)) {
            throw new InvalidCalendarRequestException("timeMin debe ser anterior a timeMax");
        }
        int limit = maxResults == null ? DEFAULT_MAX_RESULTS : Math.max(1, Math.min(maxResults, MAX_RESULTS_LIMIT));

        UsableCredential credential = credentials.getUsableCredential(userId);
        List<Event> items;
        try {
            items = gateway.listPrimaryEvents(credential.accessToken(), timeMin, timeMax, limit);
        } catch (GoogleJsonResponseException e) {
            String message = e.getDetails() != null ? e.getDetails().getMessage() : e.getStatusMessage();
            log.error("Calendar.events.list ERROR usuario={}, code={}, message={}", userId, e.getStatusCode(), message);
            throw new CalendarFetchException(message, e);
        } catch (IOException e) {
            log.error("Calendar.events.list ERROR usuario={}: {}", userId, e.getMessage());
            throw new CalendarFetchException(e.getMessage(), e);
        }

        return items.stream()
                .filter(event -> overlaps(event, timeMin, timeMax))
                .map(GoogleCalendarReader::toDto)
                .collect(Collectors.toList());
    }

    static CalendarEventDto toDto(Event event) {
        return CalendarEventDto.builder()
                .id(event.getId())
                .title(hasText(event.getSummary()) ? event.getSummary() : UNTITLED)
                .description(textOrNull(event.getDescription()))
                .start(toTime(event.getStart()))
                .end(toTime(event.getEnd()))
                .organizer(event.getOrganizer() == null ? null
                        : person(event.getOrganizer().getEmail(), event.getOrganizer().getDisplayName(), null))
                .attendees(toAttendees(event.getAttendees()))
                .location(textOrNull(event.getLocation()))
                .status(textOrNull(event.getStatus()))
                .htmlLink(textOrNull(event.getHtmlLink()))
                .build();
    }

    private static EventTime toTime(EventDateTime time) {
        if (time == null) {
            return null;
        }
        String dateTime = time.getDateTime() != null ? time.getDateTime().toStringRfc3339() : null;
        String date = time.getDate() != null ? time.getDate().toStringRfc3339() : null;
        String zone = textOrNull(time.getTimeZone());
        if (dateTime == null && date == null && zone == null) {
            return null;
        }
        return new EventTime(dateTime, date, zone);
    }

    private static List<EventPerson> toAttendees(List<EventAttendee> attendees) {
        if (attendees == null || attendees.isEmpty()) {
            return null;
        }
        return attendees.stream()
                .map(a -> person(a.getEmail(), a.getDisplayName(), a.getResponseStatus()))
                .filter(p -> p != null)
                .collect(Collectors.toList());
    }

    private static EventPerson person(String email, String displayName, String responseStatus) {
        EventPerson p = new EventPerson(textOrNull(email), textOrNull(displayName), textOrNull(responseStatus));
        if (p.getEmail() == null && p.getDisplayName() == null && p.getResponseStatus() == null) {
            return null;
        }
        return p;
    }

    private static boolean overlaps(Event event, Instant timeMin, Instant timeMax) {
        Instant start = instantOf(event.getStart());
        if (start == null) {
            return true;
        }
        Instant end = instantOf(event.getEnd());
        if (!start.isBefore(timeMax)) {
            return false;
        }
        return !start.isBefore(timeMin) || (end != null && end.isAfter(timeMin));
    }

    private static Instant instantOf(EventDateTime time) {
        if (time == null) {
            return null;
        }
        DateTime value = time.getDateTime() != null ? time.getDateTime() : time.getDate();
        return value != null ? Instant.ofEpochMilli(value.getValue()) : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String textOrNull(String value) {
        return hasText(value) ? value : null;
    }
}
