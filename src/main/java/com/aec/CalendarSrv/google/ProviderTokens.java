package com.aec.CalendarSrv.google;

import java.time.Instant;

/**
 * Respuesta del endpoint de tokens. {@code refreshToken} es null cuando Google no rota
 * el refresh token.
 */
public record ProviderTokens(String accessToken, String refreshToken, Instant expiresAt, String scope) {
}
