package com.aec.CalendarSrv.exception;

/** Parámetros de la petición inválidos: ventana de fechas, formato o id de usuario. */
public class InvalidCalendarRequestException extends CalendarIntegrationException {

    public InvalidCalendarRequestException(String message) {
        super(message);
    }
}
