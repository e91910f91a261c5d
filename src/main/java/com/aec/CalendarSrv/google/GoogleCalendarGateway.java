package com.aec.CalendarSrv.google;

import com.google.api.services.calendar.model.Event;

import java.io.IOException;
import java.time.Instant;
import java.util.List;

/** Lectura cruda de eventos del calendario principal con un access token ya válido. */
public interface GoogleCalendarGateway {

    List<Event> listPrimaryEvents(String accessToken, Instant timeMin, Instant timeMax, int maxResults)
            throws IOException;
}
