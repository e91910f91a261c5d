package com.aec.CalendarSrv.exception;

/**
 * No se pudo completar el callback de autorización: el usuario negó el consentimiento,
 * Google rechazó el código o la respuesta no trajo tokens o email.
 */
public class OAuthCallbackException extends CalendarIntegrationException {

    private final String reason;

    public OAuthCallbackException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public OAuthCallbackException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /** Código corto, apto para ir en el query string de una redirección. */
    public String getReason() {
        return reason;
    }
}
