package com.aec.CalendarSrv.exception;

/**
 * El usuario no tiene una credencial utilizable y debe repetir el consentimiento OAuth.
 * Ocurre cuando no hay registro, cuando el registro no pasó la verificación de integridad
 * o cuando Google revocó el refresh token.
 */
public class CalendarLinkRequiredException extends CalendarIntegrationException {

    private final long userId;

    public CalendarLinkRequiredException(long userId, String reason) {
        super(reason);
        this.userId = userId;
    }

    public long getUserId() {
        return userId;
    }
}
