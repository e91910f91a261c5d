package com.aec.CalendarSrv.service;

import com.aec.CalendarSrv.Repository.CalendarCredentialRepository;
import com.aec.CalendarSrv.crypto.TokenCipher;
import com.aec.CalendarSrv.model.CalendarCredential;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Persistencia de la credencial cifrada de cada usuario (una fila por usuario).
 *
 * <p>Toda escritura corre dentro del lock del usuario y en su propia transacción: el lock se
 * suelta después del commit, así otro hilo nunca lee una fila a medio escribir.
 */
@Service
@Slf4j
public class CalendarCredentialStore {

    private final CalendarCredentialRepository repo;
    private final TokenCipher cipher;
    private final UserLockRegistry locks;
    private final TransactionTemplate tx;
    private final TransactionTemplate readTx;
    private final Clock clock;

    public CalendarCredentialStore(CalendarCredentialRepository repo, TokenCipher cipher, UserLockRegistry locks,
                                   PlatformTransactionManager txManager, Clock clock) {
        this.repo = repo;
        this.cipher = cipher;
        this.locks = locks;
        this.tx = new TransactionTemplate(txManager);
        this.readTx = new TransactionTemplate(txManager);
        this.readTx.setReadOnly(true);
        this.clock = clock;
    }

    /** Crea o reemplaza la credencial del usuario cifrando ambos tokens con un IV nuevo. */
    public CalendarCredential upsert(long userId, String accessToken, String refreshToken, String scope,
                                     Instant expiresAt, String googleEmail) {
        requireText(accessToken, "accessToken");
        requireText(refreshToken, "refreshToken");
        requireText(googleEmail, "googleEmail");
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt no puede ser null");
        }

        return locks.withLock(userId, () -> tx.execute(status -> {
            Instant now = clock.instant();
            CalendarCredential cred = repo.findByUserId(userId)
                    .orElseGet(() -> new CalendarCredential(userId, now));
            cred.setGoogleEmail(googleEmail);
            cred.setScope(scope != null ? scope : "");
            seal(cred, accessToken, refreshToken, expiresAt, now);
            return repo.saveAndFlush(cred);
        }));
    }

    /**
     * Reescritura usada por el refresh. Si la fila desapareció (unlink concurrente) no la
     * vuelve a crear y devuelve vacío.
     */
    public Optional<CalendarCredential> replaceTokens(long userId, String accessToken, String refreshToken,
                                                      Instant expiresAt) {
        requireText(accessToken, "accessToken");
        requireText(refreshToken, "refreshToken");
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt no puede ser null");
        }

        return locks.withLock(userId, () -> tx.execute(status -> repo.findByUserId(userId)
                .map(cred -> {
                    seal(cred, accessToken, refreshToken, expiresAt, clock.instant());
                    return repo.saveAndFlush(cred);
                })));
    }

    public Optional<CalendarCredential> read(long userId) {
        return readTx.execute(status -> repo.findByUserId(userId));
    }

    /** Idempotente: borrar algo que no existe no es error. */
    public boolean delete(long userId) {
        Integer removed = locks.withLock(userId, () -> tx.execute(status -> repo.deleteByUserId(userId)));
        boolean deleted = removed != null && removed > 0;
        if (deleted) {
            log.info("Credencial de calendario eliminada para usuario {}", userId);
        }
        return deleted;
    }

    /**
     * Borra la fila solo si sigue siendo la que se leyó (mismo IV y misma fecha de escritura).
     * Si otro hilo la reescribió entretanto, por ejemplo al volver a vincular, no toca nada.
     */
    public boolean deleteIfUnchanged(CalendarCredential stale) {
        long userId = stale.getUserId();
        Boolean removed = locks.withLock(userId, () -> tx.execute(status -> repo.findByUserId(userId)
                .filter(current -> Objects.equals(current.getTokenIv(), stale.getTokenIv())
                        && Objects.equals(current.getUpdatedAt(), stale.getUpdatedAt()))
                .map(current -> {
                    repo.delete(current);
                    repo.flush();
                    return true;
                })
                .orElse(false)));
        boolean deleted = Boolean.TRUE.equals(removed);
        if (deleted) {
            log.info("Credencial de calendario eliminada para usuario {}", userId);
        } else {
            log.info("La credencial de usuario {} cambió desde la lectura; no se elimina", userId);
        }
        return deleted;
    }

    private void seal(CalendarCredential cred, String accessToken, String refreshToken,
                      Instant expiresAt, Instant now) {
        // TODO: un IV por ciphertext (columna token_iv_refresh); compartir el nonce GCM entre dos tokens es reutilización de nonce
        byte[] iv = cipher.newIv();
        cred.writeTokens(
                cipher.encrypt(accessToken, iv),
                cipher.encrypt(refreshToken, iv),
                TokenCipher.encodeIv(iv),
                expiresAt,
                now);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " no puede estar vacío");
        }
    }
}
