package com.aec.CalendarSrv.service;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.crypto.TokenCipher;
import com.aec.CalendarSrv.exception.CalendarLinkRequiredException;
import com.aec.CalendarSrv.exception.CalendarNotConfiguredException;
import com.aec.CalendarSrv.exception.OAuthGrantRevokedException;
import com.aec.CalendarSrv.exception.ProviderUnavailableException;
import com.aec.CalendarSrv.google.OAuthProviderClient;
import com.aec.CalendarSrv.google.ProviderTokens;
import com.aec.CalendarSrv.model.CalendarCredential;
import com.aec.CalendarSrv.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CalendarCredentialProviderTest {

    private static final long USER = 42L;
    private static final Instant NOW = Instant.parse("2024-05-01T08:00:00Z");
    private static final String KEY = "000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f";

    @Mock
    private CalendarCredentialStore store;
    @Mock
    private OAuthProviderClient oauth;

    private GoogleCalendarProperties props;
    private TokenCipher cipher;
    private MutableClock clock;
    private CalendarCredentialProvider provider;

    @BeforeEach
    void setUp() {
        props = new GoogleCalendarProperties();
        props.setClientId("client");
        props.setClientSecret("secret");
        props.setRedirectUri("http://localhost/api/google/auth/callback");
        props.setTokenEncryptionKey(KEY);
        cipher = new TokenCipher(props);
        clock = new MutableClock(NOW);
        provider = new CalendarCredentialProvider(store, cipher, oauth, new UserLockRegistry(props), props, clock);
    }

    @Test
    void freshTokenIsReturnedWithoutCallingGoogle() {
        when(store.read(USER)).thenReturn(Optional.of(credential("access-1", "refresh-1", NOW.plusSeconds(3600))));

        UsableCredential usable = provider.getUsableCredential(USER);

        assertThat(usable.accessToken()).isEqualTo("access-1");
        verifyNoInteractions(oauth);
    }

    @Test
    void tokenInsideSkewWindowIsRefreshed() {
        when(store.read(USER)).thenReturn(Optional.of(credential("access-1", "refresh-1", NOW.plusSeconds(30))));
        when(oauth.refresh("refresh-1"))
                .thenReturn(new ProviderTokens("access-2", null, NOW.plusSeconds(3600), null));
        when(store.replaceTokens(eq(USER), anyString(), anyString(), any()))
                .thenAnswer(inv -> Optional.of(credential(inv.getArgument(1), inv.getArgument(2), inv.getArgument(3))));

        UsableCredential usable = provider.getUsableCredential(USER);

        assertThat(usable.accessToken()).isEqualTo("access-2");
        assertThat(usable.expiresAt()).isEqualTo(NOW.plusSeconds(3600));
        // Google no rotó: se conserva el refresh token anterior
        verify(store).replaceTokens(USER, "access-2", "refresh-1", NOW.plusSeconds(3600));
    }

    @Test
    void rotatedRefreshTokenIsPersisted() {
        when(store.read(USER)).thenReturn(Optional.of(credential("access-1", "refresh-1", NOW.minusSeconds(10))));
        when(oauth.refresh("refresh-1"))
                .thenReturn(new ProviderTokens("access-2", "refresh-2", NOW.plusSeconds(3600), null));
        when(store.replaceTokens(eq(USER), anyString(), anyString(), any()))
                .thenAnswer(inv -> Optional.of(credential(inv.getArgument(1), inv.getArgument(2), inv.getArgument(3))));

        provider.getUsableCredential(USER);

        verify(store).replaceTokens(USER, "access-2", "refresh-2", NOW.plusSeconds(3600));
    }

    @Test
    void revokedGrantDeletesRecordAndRequiresRelink() {
        when(store.read(USER)).thenReturn(Optional.of(credential("access-1", "refresh-1", NOW.minusSeconds(10))));
        when(oauth.refresh("refresh-1"))
                .thenThrow(new OAuthGrantRevokedException("invalid_grant", null));

        assertThatThrownBy(() -> provider.getUsableCredential(USER))
                .isInstanceOf(CalendarLinkRequiredException.class);
        verify(store).delete(USER);
        verify(store, never()).replaceTokens(anyLong(), anyString(), anyString(), any());
    }

    @Test
    void transientFailureLeavesRecordUntouched() {
        when(store.read(USER)).thenReturn(Optional.of(credential("access-1", "refresh-1", NOW.minusSeconds(10))));
        when(oauth.refresh("refresh-1"))
                .thenThrow(new ProviderUnavailableException("timeout"));

        assertThatThrownBy(() -> provider.getUsableCredential(USER))
                .isInstanceOf(ProviderUnavailableException.class);
        verify(store, never()).delete(anyLong());
        verify(store, never()).replaceTokens(anyLong(), anyString(), anyString(), any());
    }

    @Test
    void corruptRecordIsDeletedWithoutCallingGoogle() {
        CalendarCredential tampered = tampered(credential("access-1", "refresh-1", NOW.plusSeconds(3600)));
        when(store.read(USER)).thenReturn(Optional.of(tampered));
        when(store.deleteIfUnchanged(tampered)).thenReturn(true);

        assertThatThrownBy(() -> provider.getUsableCredential(USER))
                .isInstanceOf(CalendarLinkRequiredException.class);
        verify(store).deleteIfUnchanged(tampered);
        verify(store, never()).delete(anyLong());
        verifyNoInteractions(oauth);
    }

    @Test
    void corruptReadReplacedByRelinkUsesTheNewRecord() {
        CalendarCredential tampered = tampered(credential("access-1", "refresh-1", NOW.plusSeconds(3600)));
        CalendarCredential relinked = credential("access-new", "refresh-new", NOW.plusSeconds(3600));
        when(store.read(USER)).thenReturn(Optional.of(tampered), Optional.of(relinked));
        when(store.deleteIfUnchanged(tampered)).thenReturn(false);

        assertThat(provider.getUsableCredential(USER).accessToken()).isEqualTo("access-new");
        verify(store, never()).delete(anyLong());
        verifyNoInteractions(oauth);
    }

    @Test
    void missingRecordRequiresLink() {
        when(store.read(USER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> provider.getUsableCredential(USER))
                .isInstanceOf(CalendarLinkRequiredException.class)
                .satisfies(e -> assertThat(((CalendarLinkRequiredException) e).getUserId()).isEqualTo(USER));
    }

    @Test
    void recordDeletedDuringRefreshIsNotResurrected() {
        when(store.read(USER)).thenReturn(Optional.of(credential("access-1", "refresh-1", NOW.minusSeconds(10))));
        when(oauth.refresh("refresh-1"))
                .thenReturn(new ProviderTokens("access-2", null, NOW.plusSeconds(3600), null));
        when(store.replaceTokens(eq(USER), anyString(), anyString(), any())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> provider.getUsableCredential(USER))
                .isInstanceOf(CalendarLinkRequiredException.class);
    }

    @Test
    void blankAccessTokenFromGoogleIsTransient() {
        when(store.read(USER)).thenReturn(Optional.of(credential("access-1", "refresh-1", NOW.minusSeconds(10))));
        when(oauth.refresh("refresh-1")).thenReturn(new ProviderTokens("", null, NOW.plusSeconds(3600), null));

        assertThatThrownBy(() -> provider.getUsableCredential(USER))
                .isInstanceOf(ProviderUnavailableException.class);
        verify(store, never()).delete(anyLong());
    }

    @Test
    void expiryIsReevaluatedAsTimePasses() {
        when(store.read(USER)).thenReturn(Optional.of(credential("access-1", "refresh-1", NOW.plusSeconds(3600))));
        provider.getUsableCredential(USER);
        verifyNoInteractions(oauth);

        clock.advance(Duration.ofMinutes(59).plusSeconds(30));
        when(oauth.refresh("refresh-1"))
                .thenReturn(new ProviderTokens("access-2", null, clock.instant().plusSeconds(3600), null));
        when(store.replaceTokens(eq(USER), anyString(), anyString(), any()))
                .thenAnswer(inv -> Optional.of(credential(inv.getArgument(1), inv.getArgument(2), inv.getArgument(3))));

        assertThat(provider.getUsableCredential(USER).accessToken()).isEqualTo("access-2");
    }

    @Test
    void notConfiguredFailsBeforeReading() {
        props.setClientId("");

        assertThatThrownBy(() -> provider.getUsableCredential(USER))
                .isInstanceOf(CalendarNotConfiguredException.class);
        verifyNoInteractions(store, oauth);
    }

    private CalendarCredential credential(String access, String refresh, Instant expiresAt) {
        CalendarCredential cred = new CalendarCredential(USER, NOW);
        cred.setGoogleEmail("user@example.com");
        cred.setScope("scope");
        byte[] iv = cipher.newIv();
        cred.writeTokens(cipher.encrypt(access, iv), cipher.encrypt(refresh, iv), TokenCipher.encodeIv(iv),
                expiresAt, NOW);
        return cred;
    }

    private static CalendarCredential tampered(CalendarCredential good) {
        CalendarCredential tampered = new CalendarCredential(USER, NOW);
        tampered.setGoogleEmail("user@example.com");
        String access = good.getAccessToken();
        tampered.writeTokens((access.charAt(0) == '0' ? "1" : "0") + access.substring(1),
                good.getRefreshToken(), good.getTokenIv(), good.getTokenExpiresAt(), NOW);
        return tampered;
    }
}
