package com.aec.CalendarSrv.exception;

public class CalendarFetchException extends CalendarIntegrationException {

    public CalendarFetchException(String providerMessage, Throwable cause) {
        super(providerMessage, cause);
    }
}
