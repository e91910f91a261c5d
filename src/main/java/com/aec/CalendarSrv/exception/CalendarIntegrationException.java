package com.aec.CalendarSrv.exception;

/**
 * Excepción base de la integración con Google Calendar.
 * El controller advice traduce cada subclase a una respuesta HTTP.
 */
public class CalendarIntegrationException extends RuntimeException {

    public CalendarIntegrationException(String message) {
        super(message);
    }

    public CalendarIntegrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
