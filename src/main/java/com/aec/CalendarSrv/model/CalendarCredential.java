package com.aec.CalendarSrv.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Credencial de Google Calendar de un usuario. Existe una fila sólo mientras el usuario
 * tiene el calendario vinculado.
 */
@Entity
@Table(name = "user_google_calendar")
@Getter @NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CalendarCredential {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    // Sólo para mostrar en la UI
    @Column(name = "google_email", nullable = false)
    private String googleEmail;

    // hex(ciphertext):hex(tag), nunca en texto plano
    @Column(name = "access_token", nullable = false, length = 4096)
    private String accessToken;

    @Column(name = "refresh_token", nullable = false, length = 4096)
    private String refreshToken;

    // IV compartido por los dos ciphertexts de la fila
    @Column(name = "token_iv", nullable = false, length = 64)
    private String tokenIv;

    @Setter
    @Column(name = "scope", nullable = false, length = 1024)
    private String scope; // Ámbitos concedidos, separados por espacio

    @Column(name = "token_expires_at", nullable = false)
    private Instant tokenExpiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public CalendarCredential(Long userId, Instant createdAt) {
        this.userId = userId;
        this.createdAt = createdAt;
    }

    public void setGoogleEmail(String googleEmail) {
        this.googleEmail = googleEmail;
    }

    /**
     * Única forma de cambiar los tokens: IV, ambos ciphertexts y expiración se escriben juntos,
     * así nunca queda una fila con un ciphertext de un IV viejo y otro de uno nuevo.
     */
    public void writeTokens(String encryptedAccessToken, String encryptedRefreshToken,
                            String ivHex, Instant expiresAt, Instant now) {
        this.accessToken = encryptedAccessToken;
        this.refreshToken = encryptedRefreshToken;
        this.tokenIv = ivHex;
        this.tokenExpiresAt = expiresAt;
        this.updatedAt = now;
    }

    @Override
    public String toString() {
        // sin tokens
        return "CalendarCredential{userId=" + userId + ", tokenExpiresAt=" + tokenExpiresAt
                + ", updatedAt=" + updatedAt + "}";
    }
}
