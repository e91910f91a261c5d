package com.aec.CalendarSrv.google;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.exception.OAuthCallbackException;
import com.aec.CalendarSrv.exception.OAuthGrantRevokedException;
import com.aec.CalendarSrv.exception.ProviderUnavailableException;
import com.google.api.client.auth.oauth2.TokenErrorResponse;
import com.google.api.client.auth.oauth2.TokenResponseException;
import com.google.api.client.googleapis.auth.oauth2.GoogleAuthorizationCodeFlow;
import com.google.api.client.googleapis.auth.oauth2.GoogleClientSecrets;
import com.google.api.client.googleapis.auth.oauth2.GoogleRefreshTokenRequest;
import com.google.api.client.googleapis.auth.oauth2.GoogleTokenResponse;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.GenericUrl;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.UrlEncodedContent;
import com.google.api.client.json.JsonFactory;
import com.google.api.services.calendar.CalendarScopes;
import com.google.api.services.oauth2.Oauth2;
import com.google.api.services.oauth2.Oauth2Scopes;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class GoogleOAuthProviderClient implements OAuthProviderClient {

    static final List<String> SCOPES = List.of(
            CalendarScopes.CALENDAR_READONLY,
            CalendarScopes.CALENDAR_EVENTS_READONLY,
            Oauth2Scopes.USERINFO_EMAIL);

    private static final String AUTH_URI = "https://accounts.google.com/o/oauth2/auth";
    private static final String TOKEN_URI = "https://oauth2.googleapis.com/token";
    private static final String REVOKE_URI = "https://oauth2.googleapis.com/revoke";
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final GoogleCalendarProperties props;
    private final HttpTransport httpTransport;
    private final JsonFactory jsonFactory;
    private final HttpRequestInitializer timeouts;
    private final Clock clock;

    public GoogleOAuthProviderClient(GoogleCalendarProperties props, HttpTransport httpTransport,
                                     JsonFactory jsonFactory, HttpRequestInitializer timeouts, Clock clock) {
        this.props = props;
        this.httpTransport = httpTransport;
        this.jsonFactory = jsonFactory;
        this.timeouts = timeouts;
        this.clock = clock;
    }

    private GoogleClientSecrets clientSecrets() {
        GoogleClientSecrets.Details web = new GoogleClientSecrets.Details()
                .setClientId(props.getClientId())
                .setClientSecret(props.getClientSecret())
                .setRedirectUris(List.of(props.getRedirectUri()))
                .setAuthUri(AUTH_URI)
                .setTokenUri(TOKEN_URI);
        return new GoogleClientSecrets().setWeb(web);
    }

    private GoogleAuthorizationCodeFlow buildFlow() {
        return new GoogleAuthorizationCodeFlow.Builder(httpTransport, jsonFactory, clientSecrets(), SCOPES)
                .setAccessType("offline")
                .setRequestInitializer(timeouts)
                .build();
    }

    @Override
    public List<String> requestedScopes() {
        return SCOPES;
    }

    @Override
    public String buildAuthorizationUrl(String state) {
        return buildFlow().newAuthorizationUrl()
                .setRedirectUri(props.getRedirectUri())
                .setAccessType("offline")
                .setState(state)
                // Forzar el consentimiento para que Google siempre entregue refresh token
                .set("prompt", "consent")
                .build();
    }

    @Override
    public ProviderTokens exchangeCode(String code) {
        try {
            GoogleTokenResponse response = buildFlow().newTokenRequest(code)
                    .setRedirectUri(props.getRedirectUri())
                    .execute();
            return toTokens(response);
        } catch (TokenResponseException e) {
            if (isClientError(e)) {
                throw new OAuthCallbackException("code_rejected",
                        "Google rechazó el código de autorización: " + describe(e), e);
            }
            throw new ProviderUnavailableException("Google no respondió al canje del código", e);
        } catch (IOException e) {
            throw new ProviderUnavailableException("Error de red canjeando el código de autorización", e);
        }
    }

    @Override
    public ProviderTokens refresh(String refreshToken) {
        try {
            GoogleTokenResponse response = new GoogleRefreshTokenRequest(
                    httpTransport, jsonFactory,
                    refreshToken, props.getClientId(), props.getClientSecret())
                    .setRequestInitializer(timeouts)
                    .execute();
            return toTokens(response);
        } catch (TokenResponseException e) {
            TokenErrorResponse details = e.getDetails();
            if (details != null && "invalid_grant".equals(details.getError())) {
                throw new OAuthGrantRevokedException("Google revocó el refresh token: " + describe(e), e);
            }
            // invalid_client y similares son errores de configuración nuestra, no del usuario
            throw new ProviderUnavailableException("Refresh rechazado por Google: " + describe(e), e);
        } catch (IOException e) {
            throw new ProviderUnavailableException("Error de red renovando el access token", e);
        }
    }

    @Override
    public String fetchAccountEmail(String accessToken) {
        Oauth2 oauth2 = new Oauth2.Builder(httpTransport, jsonFactory, request -> {
            timeouts.initialize(request);
            request.getHeaders().setAuthorization("Bearer " + accessToken);
        }).setApplicationName(props.getApplicationName()).build();
        try {
            return oauth2.userinfo().get().execute().getEmail();
        } catch (GoogleJsonResponseException e) {
            if (e.getStatusCode() < 500) {
                throw new OAuthCallbackException("email_unavailable",
                        "No se pudo obtener el email de la cuenta de Google: " + e.getStatusMessage(), e);
            }
            throw new ProviderUnavailableException("Google no respondió al consultar el email", e);
        } catch (IOException e) {
            throw new ProviderUnavailableException("Error de red consultando el email de la cuenta", e);
        }
    }

    @Override
    public void revoke(String token) {
        try {
            httpTransport.createRequestFactory(timeouts)
                    .buildPostRequest(new GenericUrl(REVOKE_URI), new UrlEncodedContent(Map.of("token", token)))
                    .execute()
                    .disconnect();
            log.debug("Token revocado en Google");
        } catch (IOException e) {
            throw new ProviderUnavailableException("No se pudo revocar el token en Google", e);
        }
    }

    private ProviderTokens toTokens(GoogleTokenResponse response) {
        Long expiresIn = response.getExpiresInSeconds();
        Instant expiresAt = clock.instant().plusSeconds(expiresIn != null ? expiresIn : DEFAULT_EXPIRES_IN_SECONDS);
        return new ProviderTokens(response.getAccessToken(), response.getRefreshToken(), expiresAt,
                response.getScope());
    }

    private static boolean isClientError(HttpResponseException e) {
        return e.getStatusCode() >= 400 && e.getStatusCode() < 500;
    }

    private static String describe(TokenResponseException e) {
        TokenErrorResponse details = e.getDetails();
        if (details == null) {
            return e.getStatusCode() + " " + e.getStatusMessage();
        }
        return details.getError()
                + (details.getErrorDescription() != null ? " (" + details.getErrorDescription() + ")" : "");
    }
}
