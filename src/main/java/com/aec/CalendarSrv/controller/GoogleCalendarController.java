package com.aec.CalendarSrv.controller;

import com.aec.CalendarSrv.config.GoogleCalendarProperties;
import com.aec.CalendarSrv.dto.CalendarEventDto;
import com.aec.CalendarSrv.dto.CalendarStatusDto;
import com.aec.CalendarSrv.dto.LinkResultDto;
import com.aec.CalendarSrv.exception.CalendarIntegrationException;
import com.aec.CalendarSrv.exception.CalendarNotConfiguredException;
import com.aec.CalendarSrv.exception.InvalidCalendarRequestException;
import com.aec.CalendarSrv.exception.InvalidOAuthStateException;
import com.aec.CalendarSrv.exception.OAuthCallbackException;
import com.aec.CalendarSrv.service.CalendarLinkService;
import com.aec.CalendarSrv.service.GoogleCalendarReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/google")
@RequiredArgsConstructor
@Slf4j
public class GoogleCalendarController {

    private final CalendarLinkService links;
    private final GoogleCalendarReader reader;
    private final GoogleCalendarProperties props;

    @GetMapping("/auth/url")
    public ResponseEntity<Map<String, String>> authUrl(@AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(Map.of("url", links.beginLink(userId(jwt))));
    }

    /**
     * Destino de la redirección de Google. Con {@code post-link-redirect} configurado el navegador
     * vuelve al frontend con {@code calendar=linked} o {@code calendar=error&reason=...};
     * sin él se responde JSON y los errores pasan por el {@link GlobalExceptionHandler}.
     */
    @GetMapping("/auth/callback")
    public ResponseEntity<?> callback(@RequestParam(value = "code", required = false) String code,
                                      @RequestParam(value = "state", required = false) String state,
                                      @RequestParam(value = "error", required = false) String error) {
        String redirect = props.getPostLinkRedirect();
        if (redirect == null || redirect.isBlank()) {
            LinkResultDto result = links.completeLink(code, state, error);
            return ResponseEntity.ok(result);
        }

        UriComponentsBuilder target = UriComponentsBuilder.fromUriString(redirect);
        try {
            links.completeLink(code, state, error);
            target.queryParam("calendar", "linked");
        } catch (CalendarIntegrationException e) {
            log.warn("Vinculación fallida, redirigiendo al frontend: {}", e.getMessage());
            target.queryParam("calendar", "error").queryParam("reason", reasonOf(e));
        }
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, target.build().encode().toUriString())
                .build();
    }

    @GetMapping("/status")
    public CalendarStatusDto status(@AuthenticationPrincipal Jwt jwt) {
        return links.status(userId(jwt));
    }

    @GetMapping("/events")
    public List<CalendarEventDto> events(@AuthenticationPrincipal Jwt jwt,
                                         @RequestParam("timeMin") String timeMin,
                                         @RequestParam("timeMax") String timeMax,
                                         @RequestParam(value = "maxResults", required = false) Integer maxResults) {
        return reader.listEvents(userId(jwt), parseInstant("timeMin", timeMin), parseInstant("timeMax", timeMax),
                maxResults);
    }

    @PostMapping("/unlink")
    public ResponseEntity<Void> unlink(@AuthenticationPrincipal Jwt jwt) {
        links.unlink(userId(jwt));
        return ResponseEntity.noContent().build();
    }

    private static long userId(Jwt jwt) {
        try {
            return Long.parseLong(jwt.getSubject());
        } catch (NumberFormatException e) {
            throw new InvalidCalendarRequestException("El subject del token no es un id de usuario válido");
        }
    }

    // Acepta 2024-05-01T10:00:00Z y también con offset, 2024-05-01T10:00:00-05:00
    private static Instant parseInstant(String name, String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidCalendarRequestException(name + " debe ser una fecha ISO-8601 con zona: " + value);
        }
    }

    private static String reasonOf(CalendarIntegrationException e) {
        if (e instanceof OAuthCallbackException callback) {
            return callback.getReason();
        }
        if (e instanceof InvalidOAuthStateException) {
            return "invalid_state";
        }
        if (e instanceof CalendarNotConfiguredException) {
            return "not_configured";
        }
        return "provider_unavailable";
    }
}
