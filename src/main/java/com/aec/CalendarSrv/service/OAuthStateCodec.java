package com.aec.CalendarSrv.service;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parámetro {@code state} del flujo OAuth: {@code {"userId":..,"timestamp":..}} en base64url.
 *
 * <p>No lleva secretos, por eso no se cifra. Liga el callback al usuario que inició el flujo
 * y vence a los pocos minutos; no es de un solo uso.
 */
@Component
@Slf4j
public class OAuthStateCodec {

    // Tolerancia para relojes de otras instancias levemente adelantados
    private static final Duration MAX_FUTURE_SKEW = Duration.ofMinutes(1);

    private final ObjectMapper mapper;
    private final Clock clock;
    private final Duration ttl;

    public OAuthStateCodec(ObjectMapper mapper, Clock clock, GoogleCalendarProperties props) {
        this.mapper = mapper;
        this.clock = clock;
        this.ttl = props.getStateTtl();
    }

    public String createState(long userId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("userId", userId);
        payload.put("timestamp", clock.millis());
        try {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(mapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("No se pudo serializar el state OAuth", e);
        }
    }

    /** Vacío si el state está mal formado, vencido o emitido en el futuro. */
    public Optional<OAuthState> parseState(String state) {
        if (state == null || state.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = mapper.readTree(decode(state.trim()));
        } catch (IllegalArgumentException | IOException e) {
            log.warn("State OAuth ilegible: {}", e.getMessage());
            return Optional.empty();
        }
        if (node == null || !isLong(node.path("userId")) || !isLong(node.path("timestamp"))) {
            log.warn("State OAuth sin userId/timestamp válidos");
            return Optional.empty();
        }
        long userId = node.get("userId").asLong();
        Instant issuedAt = Instant.ofEpochMilli(node.get("timestamp").asLong());
        Instant now = clock.instant();
        if (userId <= 0) {
            log.warn("State OAuth con userId inválido");
            return Optional.empty();
        }
        if (issuedAt.plus(ttl).isBefore(now)) {
            log.warn("State OAuth expirado para usuario {}", userId);
            return Optional.empty();
        }
        if (issuedAt.isAfter(now.plus(MAX_FUTURE_SKEW))) {
            log.warn("State OAuth con timestamp en el futuro para usuario {}", userId);
            return Optional.empty();
        }
        return Optional.of(new OAuthState(userId, issuedAt));
    }

    private static boolean isLong(JsonNode value) {
        return value.isIntegralNumber() && value.canConvertToLong();
    }

    private static byte[] decode(String state) {
        // Acepta también base64 estándar (states emitidos por versiones anteriores)
        if (state.indexOf('+') >= 0 || state.indexOf('/') >= 0 || state.endsWith("=")) {
            return Base64.getDecoder().decode(state);
        }
        return Base64.getUrlDecoder().decode(state);
    }
}
