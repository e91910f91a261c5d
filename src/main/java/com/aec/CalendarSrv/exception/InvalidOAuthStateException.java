package com.aec.CalendarSrv.exception;

public class InvalidOAuthStateException extends CalendarIntegrationException {

    public InvalidOAuthStateException() {
        super("El parámetro state es inválido o expiró");
    }
}
