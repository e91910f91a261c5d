package com.aec.CalendarSrv.exception;

/** Google respondió {@code invalid_grant}: el refresh token ya no sirve. */
public class OAuthGrantRevokedException extends CalendarIntegrationException {

    public OAuthGrantRevokedException(String message, Throwable cause) {
        super(message, cause);
    }
}
