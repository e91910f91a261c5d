package com.aec.CalendarSrv.exception;

/**
 * Falla transitoria hablando con Google (red, timeout, 5xx). Se puede reintentar;
 * las credenciales guardadas no se tocan.
 */
public class ProviderUnavailableException extends CalendarIntegrationException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
