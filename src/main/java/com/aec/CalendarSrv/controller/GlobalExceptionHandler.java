package com.aec.CalendarSrv.controller;

import com.aec.CalendarSrv.exception.CalendarFetchException;
import com.aec.CalendarSrv.exception.CalendarLinkRequiredException;
import com.aec.CalendarSrv.exception.CalendarNotConfiguredException;
import com.aec.CalendarSrv.exception.InvalidCalendarRequestException;
import com.aec.CalendarSrv.exception.InvalidOAuthStateException;
import com.aec.CalendarSrv.exception.OAuthCallbackException;
import com.aec.CalendarSrv.exception.ProviderUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponseException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.time.Instant;

/**
 * Traduce las excepciones de la integración a respuestas HTTP con cuerpo {@link ApiError}.
 * En los 5xx no se devuelven detalles internos.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(CalendarNotConfiguredException.class)
    ResponseEntity<ApiError> handleNotConfigured(CalendarNotConfiguredException ex) {
        log.warn("Petición a Google Calendar sin configuración");
        return error(HttpStatus.SERVICE_UNAVAILABLE, "CALENDAR_NOT_CONFIGURED",
                "Google Calendar no está disponible", "La integración no está configurada en el servidor");
    }

    @ExceptionHandler(CalendarLinkRequiredException.class)
    ResponseEntity<ApiError> handleLinkRequired(CalendarLinkRequiredException ex) {
        log.info("Usuario {} debe vincular Google Calendar: {}", ex.getUserId(), ex.getMessage());
        return error(HttpStatus.UNAUTHORIZED, "LINK_REQUIRED",
                "Debe vincular su cuenta de Google Calendar", ex.getMessage());
    }

    @ExceptionHandler(InvalidOAuthStateException.class)
    ResponseEntity<ApiError> handleInvalidState(InvalidOAuthStateException ex) {
        log.warn("Callback OAuth con state inválido");
        return error(HttpStatus.BAD_REQUEST, "INVALID_OAUTH_STATE",
                "Solicitud de vinculación inválida o expirada", ex.getMessage());
    }

    @ExceptionHandler(OAuthCallbackException.class)
    ResponseEntity<ApiError> handleCallback(OAuthCallbackException ex) {
        log.warn("Callback OAuth fallido ({}): {}", ex.getReason(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "OAUTH_CALLBACK_FAILED",
                "No se pudo vincular Google Calendar", ex.getReason());
    }

    /** Transitorio: se puede reintentar. */
    @ExceptionHandler(ProviderUnavailableException.class)
    ResponseEntity<ApiError> handleProviderUnavailable(ProviderUnavailableException ex) {
        log.error("Google no disponible: {}", ex.getMessage(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, "PROVIDER_UNAVAILABLE",
                "Google no está disponible temporalmente", "Reintente en unos segundos");
    }

    @ExceptionHandler(CalendarFetchException.class)
    ResponseEntity<ApiError> handleFetch(CalendarFetchException ex) {
        log.error("Error leyendo eventos de Google Calendar: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "CALENDAR_FETCH_FAILED",
                "No se pudieron obtener los eventos del calendario", ex.getMessage());
    }

    // Solo errores de la petición; un IllegalArgumentException interno termina en 500
    @ExceptionHandler({InvalidCalendarRequestException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        log.warn("Parámetros inválidos: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "BAD_REQUEST", "Parámetros inválidos", ex.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    ResponseEntity<ApiError> handleMethodNotSupported(HttpRequestMethodNotSupportedException ex) {
        return error(HttpStatus.METHOD_NOT_ALLOWED, "METHOD_NOT_ALLOWED", "Método no permitido", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<ApiError> handleNotFound(NoResourceFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NOT_FOUND", "Recurso no encontrado", ex.getResourcePath());
    }

    // Demás errores con estado propio de Spring
    @ExceptionHandler(ErrorResponseException.class)
    ResponseEntity<ApiError> handleErrorResponse(ErrorResponseException ex) {
        HttpStatusCode status = ex.getStatusCode();
        return ResponseEntity.status(status)
                .body(new ApiError("HTTP_" + status.value(), ex.getBody().getTitle(), ex.getBody().getDetail(),
                        clock.instant()));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        log.error("Error inesperado", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                "Ocurrió un error inesperado", "Contacte a soporte indicando el request id");
    }

    private ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, clock.instant()));
    }

    public record ApiError(
            String errorCode,
            String message,
            String details,
            Instant timestamp
    ) {}
}
