package com.aec.CalendarSrv.exception;

/** Falta client id, secret, redirect uri o la clave de cifrado: la integración está deshabilitada. */
public class CalendarNotConfiguredException extends CalendarIntegrationException {

    public CalendarNotConfiguredException() {
        super("La integración con Google Calendar no está configurada");
    }
}
