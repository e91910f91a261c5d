package com.aec.CalendarSrv.google;

import java.util.List;

/**
 * Endpoints OAuth de Google que consume la integración.
 *
 * <p>Errores: {@code OAuthCallbackException} si Google rechaza el código,
 * {@code OAuthGrantRevokedException} si rechaza el refresh token, y
 * {@code ProviderUnavailableException} ante fallas de red o 5xx.
 */
public interface OAuthProviderClient {

    List<String> requestedScopes();

    String buildAuthorizationUrl(String state);

    ProviderTokens exchangeCode(String code);

    ProviderTokens refresh(String refreshToken);

    /** Email de la cuenta de Google dueña del token, o null si Google no lo informa. */
    String fetchAccountEmail(String accessToken);

    void revoke(String token);
}
