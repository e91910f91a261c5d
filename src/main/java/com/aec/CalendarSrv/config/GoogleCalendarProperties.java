package com.aec.CalendarSrv.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuración del enlace con Google Calendar. Las cuatro credenciales (client id, client secret,
 * redirect uri y clave de cifrado) deben estar presentes para habilitar la integración.
 */
@Component
@ConfigurationProperties(prefix = "google.calendar")
public class GoogleCalendarProperties {
    private String clientId;
    private String clientSecret;
    private String redirectUri; // https://<host>/api/google/auth/callback
    /** 32 bytes en hexadecimal (64 caracteres). */
    private String tokenEncryptionKey;
    /** A dónde vuelve el navegador después del callback. Opcional; sin ella se responde JSON. */
    private String postLinkRedirect;
    private String applicationName = "AEC-CalendarService";

    private Duration stateTtl = Duration.ofMinutes(10);
    private Duration refreshSkew = Duration.ofSeconds(60);
    private Duration refreshLockTimeout = Duration.ofSeconds(30);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(20);

    public boolean isConfigured() {
        return notBlank(clientId) && notBlank(clientSecret)
                && notBlank(redirectUri) && notBlank(tokenEncryptionKey);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    public String getClientId() { return clientId; }
    public void setClientId(String clientId) { this.clientId = clientId; }
    public String getClientSecret() { return clientSecret; }
    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }
    public String getRedirectUri() { return redirectUri; }
    public void setRedirectUri(String redirectUri) { this.redirectUri = redirectUri; }
    public String getTokenEncryptionKey() { return tokenEncryptionKey; }
    public void setTokenEncryptionKey(String tokenEncryptionKey) { this.tokenEncryptionKey = tokenEncryptionKey; }
    public String getPostLinkRedirect() { return postLinkRedirect; }
    public void setPostLinkRedirect(String postLinkRedirect) { this.postLinkRedirect = postLinkRedirect; }
    public String getApplicationName() { return applicationName; }
    public void setApplicationName(String applicationName) { this.applicationName = applicationName; }
    public Duration getStateTtl() { return stateTtl; }
    public void setStateTtl(Duration stateTtl) { this.stateTtl = stateTtl; }
    public Duration getRefreshSkew() { return refreshSkew; }
    public void setRefreshSkew(Duration refreshSkew) { this.refreshSkew = refreshSkew; }
    public Duration getRefreshLockTimeout() { return refreshLockTimeout; }
    public void setRefreshLockTimeout(Duration refreshLockTimeout) { this.refreshLockTimeout = refreshLockTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
}
