package com.aec.CalendarSrv.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.util.List;

/** Evento de calendario normalizado. Los campos opcionales ausentes quedan en null, nunca en "". */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CalendarEventDto {
    private String id;
    private String title;
    private String description;
    private EventTime start;
    private EventTime end;
    private EventPerson organizer;
    private List<EventPerson> attendees;
    private String location;
    private String status;
    private String htmlLink;

    /** Instante ({@code dateTime}) o día completo ({@code date}), con zona horaria opcional. */
    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EventTime {
        private String dateTime;
        private String date;
        private String timeZone;
    }

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EventPerson {
        private String email;
        private String displayName;
        private String responseStatus;
    }
}
