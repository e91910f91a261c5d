package com.aec.CalendarSrv.service;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.dto.CalendarStatusDto;
import com.aec.CalendarSrv.dto.LinkResultDto;
import com.aec.CalendarSrv.exception.CalendarLinkRequiredException;
import com.aec.CalendarSrv.exception.CalendarNotConfiguredException;
import com.aec.CalendarSrv.exception.InvalidOAuthStateException;
import com.aec.CalendarSrv.exception.OAuthCallbackException;
import com.aec.CalendarSrv.google.OAuthProviderClient;
import com.aec.CalendarSrv.google.ProviderTokens;
import com.aec.CalendarSrv.util.LogSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Vinculación y desvinculación de la cuenta de Google Calendar de un usuario.
 *
 * <p>Ciclo: sin vincular -> autorización pendiente (state emitido) -> vinculado
 * (con renovaciones del access token) -> sin vincular.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalendarLinkService {

    private final GoogleCalendarProperties props;
    private final OAuthStateCodec stateCodec;
    private final OAuthProviderClient oauth;
    private final CalendarCredentialStore store;
    private final CalendarCredentialProvider credentials;

    /** URL de consentimiento de Google, con acceso offline y el state firmado por tiempo. */
    public String beginLink(long userId) {
        requireConfigured();
        String url = oauth.buildAuthorizationUrl(stateCodec.createState(userId));
        log.info("Vinculación de calendario iniciada para usuario {}", userId);
        return url;
    }

    public LinkResultDto completeLink(String code, String state) {
        return completeLink(code, state, null);
    }

    /**
     * Completa el callback. El state se valida antes que nada: si no es válido no se
     * llama a Google ni se escribe en la base.
     *
     * @param providerError valor del parámetro {@code error} que Google agrega cuando el
     *                      usuario niega el consentimiento; puede ser null
     */
    public LinkResultDto completeLink(String code, String state, String providerError) {
        requireConfigured();
        OAuthState parsed = stateCodec.parseState(state).orElseThrow(InvalidOAuthStateException::new);
        long userId = parsed.userId();

        if (providerError != null && !providerError.isBlank()) {
            log.warn("Google devolvió error en el callback para usuario {}: {}", userId, providerError);
            throw new OAuthCallbackException("access_denied", "El usuario no autorizó el acceso: " + providerError);
        }
        if (code == null || code.isBlank()) {
            throw new OAuthCallbackException("missing_code", "Falta el código de autorización");
        }

        ProviderTokens tokens = oauth.exchangeCode(code);
        if (isBlank(tokens.accessToken()) || isBlank(tokens.refreshToken())) {
            // Sin refresh token no hay acceso offline; pasa si se omitió prompt=consent
            throw new OAuthCallbackException("missing_tokens", "Google no devolvió access y refresh token");
        }
        String email = oauth.fetchAccountEmail(tokens.accessToken());
        if (isBlank(email)) {
            throw new OAuthCallbackException("missing_email", "Google no devolvió el email de la cuenta");
        }
        String scope = isBlank(tokens.scope()) ? String.join(" ", oauth.requestedScopes()) : tokens.scope();

        store.upsert(userId, tokens.accessToken(), tokens.refreshToken(), scope, tokens.expiresAt(), email);
        log.info("Google Calendar vinculado para usuario {} ({})", userId, LogSanitizer.maskEmail(email));
        return new LinkResultDto(userId, true, email);
    }

    /** Revoca en Google si se puede y borra la credencial local en cualquier caso. */
    public void unlink(long userId) {
        if (props.isConfigured()) {
            try {
                oauth.revoke(credentials.getUsableCredential(userId).accessToken());
            } catch (CalendarLinkRequiredException e) {
                log.debug("Usuario {} sin credencial utilizable, nada que revocar", userId);
            } catch (RuntimeException e) {
                log.warn("No se pudo revocar el token de usuario {}: {}", userId, e.getMessage());
            }
        }
        store.delete(userId);
        log.info("Google Calendar desvinculado para usuario {}", userId);
    }

    public CalendarStatusDto status(long userId) {
        if (!props.isConfigured()) {
            return new CalendarStatusDto(false, false, null);
        }
        return store.read(userId)
                .map(cred -> new CalendarStatusDto(true, true, cred.getGoogleEmail()))
                .orElseGet(() -> new CalendarStatusDto(true, false, null));
    }

    private void requireConfigured() {
        if (!props.isConfigured()) {
            throw new CalendarNotConfiguredException();
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
