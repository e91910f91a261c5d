package com.aec.CalendarSrv.crypto;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.exception.CalendarNotConfiguredException;
import com.aec.CalendarSrv.exception.TokenIntegrityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * Cifrado AES-256-GCM de los tokens OAuth guardados en BD.
 *
 * <p>El ciphertext se guarda como {@code hex(ciphertext):hex(tag)}. El IV lo pasa quien llama,
 * así los dos tokens de un registro comparten el IV generado para esa escritura.
 * La clave se lee una sola vez al crear el bean; una clave mal formada detiene la aplicación.
 */
@Component
@Slf4j
public class TokenCipher {

    public static final int IV_LENGTH_BYTES = 16;
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int TAG_LENGTH_BITS = 128;
    private static final int TAG_LENGTH_BYTES = TAG_LENGTH_BITS / 8;
    private static final int KEY_HEX_LENGTH = 64;
    private static final HexFormat HEX = HexFormat.of();

    private final SecureRandom secureRandom = new SecureRandom();
    private final SecretKey secretKey;

    public TokenCipher(GoogleCalendarProperties props) {
        this.secretKey = parseKey(props.getTokenEncryptionKey());
        if (secretKey == null) {
            log.warn("google.calendar.token-encryption-key no configurada: integración de calendario deshabilitada");
        }
    }

    static SecretKey parseKey(String hexKey) {
        if (hexKey == null || hexKey.isBlank()) {
            return null;
        }
        String trimmed = hexKey.trim();
        if (trimmed.length() != KEY_HEX_LENGTH) {
            throw new IllegalStateException(
                    "google.calendar.token-encryption-key debe tener " + KEY_HEX_LENGTH + " caracteres hex (32 bytes)");
        }
        try {
            return new SecretKeySpec(HEX.parseHex(trimmed), "AES");
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("google.calendar.token-encryption-key no es hexadecimal válido", e);
        }
    }

    /** IV aleatorio nuevo, nunca derivado de datos del usuario. */
    public byte[] newIv() {
        byte[] iv = new byte[IV_LENGTH_BYTES];
        secureRandom.nextBytes(iv);
        return iv;
    }

    public static String encodeIv(byte[] iv) {
        return HEX.formatHex(iv);
    }

    /** Un IV guardado que no se puede leer se trata igual que un ciphertext alterado. */
    public static byte[] decodeIv(String ivHex) {
        try {
            byte[] iv = ivHex == null ? null : HEX.parseHex(ivHex);
            if (iv == null || iv.length != IV_LENGTH_BYTES) {
                throw new TokenIntegrityException("IV guardado inválido", null);
            }
            return iv;
        } catch (IllegalArgumentException e) {
            throw new TokenIntegrityException("IV guardado inválido", e);
        }
    }

    public String encrypt(String plaintext, byte[] iv) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext no puede ser null");
        }
        Cipher cipher = initCipher(Cipher.ENCRYPT_MODE, iv);
        try {
            byte[] out = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            int split = out.length - TAG_LENGTH_BYTES;
            return HEX.formatHex(out, 0, split) + ":" + HEX.formatHex(out, split, out.length);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("No se pudo cifrar el token OAuth", e);
        }
    }

    public String decrypt(String ciphertextWithTag, byte[] iv) {
        byte[] sealed = unpack(ciphertextWithTag);
        Cipher cipher = initCipher(Cipher.DECRYPT_MODE, iv);
        try {
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            throw new TokenIntegrityException("El tag de autenticación no coincide", e);
        } catch (GeneralSecurityException e) {
            throw new TokenIntegrityException("No se pudo descifrar el token", e);
        }
    }

    private byte[] unpack(String ciphertextWithTag) {
        if (ciphertextWithTag == null) {
            throw new TokenIntegrityException("Falta el ciphertext", null);
        }
        int sep = ciphertextWithTag.indexOf(':');
        if (sep < 0 || sep != ciphertextWithTag.lastIndexOf(':')) {
            throw new TokenIntegrityException("Ciphertext mal formado", null);
        }
        try {
            byte[] body = HEX.parseHex(ciphertextWithTag.substring(0, sep));
            byte[] tag = HEX.parseHex(ciphertextWithTag.substring(sep + 1));
            if (tag.length != TAG_LENGTH_BYTES) {
                throw new TokenIntegrityException("Tag de autenticación mal formado", null);
            }
            byte[] sealed = Arrays.copyOf(body, body.length + tag.length);
            System.arraycopy(tag, 0, sealed, body.length, tag.length);
            return sealed;
        } catch (IllegalArgumentException e) {
            throw new TokenIntegrityException("Ciphertext mal formado", e);
        }
    }

    private Cipher initCipher(int mode, byte[] iv) {
        if (secretKey == null) {
            throw new CalendarNotConfiguredException();
        }
        if (iv == null || iv.length != IV_LENGTH_BYTES) {
            throw new IllegalArgumentException("El IV debe tener exactamente " + IV_LENGTH_BYTES + " bytes");
        }
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(mode, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            return cipher;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM no disponible", e);
        }
    }
}
