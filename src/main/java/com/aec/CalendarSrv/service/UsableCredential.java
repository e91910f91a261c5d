package com.aec.CalendarSrv.service;

import java.time.Instant;

/** Access token listo para usar. No se guarda más allá de la llamada que lo pidió. */
public record UsableCredential(String accessToken, Instant expiresAt) {

    @Override
    public String toString() {
        return "UsableCredential{expiresAt=" + expiresAt + "}";
    }
}
