package com.aec.CalendarSrv.service;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.crypto.TokenCipher;
import com.aec.CalendarSrv.exception.CalendarLinkRequiredException;
import com.aec.CalendarSrv.exception.CalendarNotConfiguredException;
import com.aec.CalendarSrv.exception.OAuthGrantRevokedException;
import com.aec.CalendarSrv.exception.ProviderUnavailableException;
import com.aec.CalendarSrv.exception.TokenIntegrityException;
import com.aec.CalendarSrv.google.OAuthProviderClient;
import com.aec.CalendarSrv.google.ProviderTokens;
import com.aec.CalendarSrv.model.CalendarCredential;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Entrega un access token válido para el usuario, renovándolo cuando venció.
 *
 * <p>El refresh es single-flight por usuario: quien llega segundo espera el lock, relee la fila
 * y reutiliza el token que acaba de renovar el primero, sin otra llamada a Google. Con
 * proveedores que rotan el refresh token, dos refresh en paralelo dejarían a uno con un
 * token inválido.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalendarCredentialProvider {

    private final CalendarCredentialStore store;
    private final TokenCipher cipher;
    private final OAuthProviderClient oauth;
    private final UserLockRegistry locks;
    private final GoogleCalendarProperties props;
    private final Clock clock;

    public UsableCredential getUsableCredential(long userId) {
        if (!props.isConfigured()) {
            throw new CalendarNotConfiguredException();
        }
        OpenedCredential opened = openOrDiscard(userId, store.read(userId).orElseThrow(() -> notLinked(userId)));
        if (isFresh(opened.row())) {
            return new UsableCredential(opened.accessToken(), opened.row().getTokenExpiresAt());
        }
        return locks.withLock(userId, () -> refreshLocked(userId));
    }

    private UsableCredential refreshLocked(long userId) {
        OpenedCredential tokens = openOrDiscard(userId, store.read(userId).orElseThrow(() -> notLinked(userId)));
        if (isFresh(tokens.row())) {
            log.debug("Token ya renovado por otra petición para usuario {}", userId);
            return new UsableCredential(tokens.accessToken(), tokens.row().getTokenExpiresAt());
        }

        log.info("Access token expirado para usuario {}, renovando...", userId);
        ProviderTokens refreshed;
        try {
            refreshed = oauth.refresh(tokens.refreshToken());
        } catch (OAuthGrantRevokedException e) {
            log.warn("Refresh token rechazado para usuario {}: se elimina la credencial", userId);
            store.delete(userId);
            throw new CalendarLinkRequiredException(userId, "Google revocó el acceso; vuelva a vincular el calendario");
        }
        if (isBlank(refreshed.accessToken())) {
            throw new ProviderUnavailableException("Google no devolvió access token al renovar");
        }

        // Si Google no rotó el refresh token se vuelve a cifrar el anterior con el IV nuevo
        String refreshToken = isBlank(refreshed.refreshToken()) ? tokens.refreshToken() : refreshed.refreshToken();
        CalendarCredential saved = store.replaceTokens(userId, refreshed.accessToken(), refreshToken,
                        refreshed.expiresAt())
                .orElseThrow(() -> notLinked(userId));
        log.info("Access token renovado para usuario {}, expira {}", userId, saved.getTokenExpiresAt());
        return new UsableCredential(refreshed.accessToken(), saved.getTokenExpiresAt());
    }

    /**
     * Una fila que no descifra se considera corrupta: se borra y se pide volver a vincular.
     * El borrado es condicional; si la fila cambió desde la lectura se prueba una vez con la nueva.
     */
    private OpenedCredential openOrDiscard(long userId, CalendarCredential cred) {
        try {
            return open(cred);
        } catch (TokenIntegrityException e) {
            log.error("Credencial de calendario corrupta para usuario {}: {}", userId, e.getMessage());
            if (!store.deleteIfUnchanged(cred)) {
                CalendarCredential current = store.read(userId).orElseThrow(() -> notLinked(userId));
                try {
                    return open(current);
                } catch (TokenIntegrityException again) {
                    log.error("Credencial releída también corrupta para usuario {}: {}", userId, again.getMessage());
                    store.deleteIfUnchanged(current);
                }
            }
            throw new CalendarLinkRequiredException(userId,
                    "La credencial guardada no es válida; vuelva a vincular el calendario");
        }
    }

    private OpenedCredential open(CalendarCredential cred) {
        byte[] iv = TokenCipher.decodeIv(cred.getTokenIv());
        return new OpenedCredential(cred,
                cipher.decrypt(cred.getAccessToken(), iv),
                cipher.decrypt(cred.getRefreshToken(), iv));
    }

    private boolean isFresh(CalendarCredential cred) {
        return cred.getTokenExpiresAt().isAfter(clock.instant().plus(props.getRefreshSkew()));
    }

    private static CalendarLinkRequiredException notLinked(long userId) {
        return new CalendarLinkRequiredException(userId, "Google Calendar no está vinculado");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record OpenedCredential(CalendarCredential row, String accessToken, String refreshToken) {
        @Override
        public String toString() {
            return "OpenedCredential[userId=" + row.getUserId() + ", tokens=***]";
        }
    }
}
