package com.aec.CalendarSrv.service;

import java.time.Instant;

/** Contenido decodificado del parámetro {@code state} del flujo OAuth. */
public record OAuthState(long userId, Instant issuedAt) {
}
