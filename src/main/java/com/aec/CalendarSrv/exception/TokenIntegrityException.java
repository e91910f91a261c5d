package com.aec.CalendarSrv.exception;

/** El tag de autenticación no verificó: ciphertext alterado, clave o IV incorrectos. */
public class TokenIntegrityException extends CalendarIntegrationException {

    public TokenIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
