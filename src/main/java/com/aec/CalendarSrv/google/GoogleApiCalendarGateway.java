package com.aec.CalendarSrv.google;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.Events;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.Collections;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class GoogleApiCalendarGateway implements GoogleCalendarGateway {

    private static final String PRIMARY = "primary";

    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final HttpRequestInitializer timeouts;
    private final GoogleCalendarProperties props;

    @Override
    public List<Event> listPrimaryEvents(String accessToken, Instant timeMin, Instant timeMax, int maxResults)
            throws IOException {
        // El token vive sólo para este cliente; no se cachea entre llamadas
        HttpRequestInitializer initializer = request -> {
            timeouts.initialize(request);
            request.getHeaders().setAuthorization("Bearer " + accessToken);
        };
        Calendar calendar = new Calendar.Builder(httpTransport, jsonFactory, initializer)
                .setApplicationName(props.getApplicationName())
                .build();

        Events result = calendar.events().list(PRIMARY)
                .setTimeMin(new DateTime(timeMin.toEpochMilli()))
                .setTimeMax(new DateTime(timeMax.toEpochMilli()))
                .setMaxResults(maxResults)
                .setSingleEvents(true)
                .setOrderBy("startTime")
                .execute();

        log.debug("Calendar.events.list OK -> items={}, timeMin={}, timeMax={}",
                result.getItems() != null ? result.getItems().size() : 0, timeMin, timeMax);
        return result.getItems() != null ? result.getItems() : Collections.emptyList();
    }
}
