package com.github.dimitryivaniuta.metergateway.web;

import com.github.dimitryivaniuta.metergateway.gateway.auth.GatewayAuthenticationException;
import com.github.dimitryivaniuta.metergateway.gateway.cache.InvalidCacheKeyException;
import com.github.dimitryivaniuta.metergateway.gateway.error.ErrorCode;
import com.github.dimitryivaniuta.metergateway.gateway.error.ErrorEnvelope;
import com.github.dimitryivaniuta.metergateway.gateway.error.GatewayException;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalLoginException;
import com.github.dimitryivaniuta.metergateway.gateway.portal.PortalUnavailableException;
import com.github.dimitryivaniuta.metergateway.gateway.ratelimit.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.util.stream.Collectors;

/**
 * Renders every rejection as {@link ErrorEnvelope}. Internal failures never leak their message.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GatewayExceptionHandler {

    private static final String BEARER_CHALLENGE = "Bearer";

    private final Clock clock;

    @ExceptionHandler(GatewayAuthenticationException.class)
    public ResponseEntity<ErrorEnvelope> handleAuthentication(GatewayAuthenticationException ex, HttpServletRequest req) {
        log.debug("Rejected {} {}: {}", req.getMethod(), req.getRequestURI(), ex.getReason());
        return unauthorized(ex);
    }

    @ExceptionHandler(PortalLoginException.class)
    public ResponseEntity<ErrorEnvelope> handlePortalLogin(PortalLoginException ex) {
        return unauthorized(ex);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorEnvelope> handleRateLimit(RateLimitExceededException ex) {
        HttpHeaders h = RateLimitHeaders.of(ex.getDecision());
        h.set(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()));
        return new ResponseEntity<>(envelope(ex.getMessage(), ex.getErrorCode()), h, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(PortalUnavailableException.class)
    public ResponseEntity<ErrorEnvelope> handlePortalUnavailable(PortalUnavailableException ex) {
        log.warn("Utility portal unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(envelope(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorEnvelope> handleValidation(BindException ex) {
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(GatewayExceptionHandler::describe)
                .collect(Collectors.joining("; "));
        return badRequest(detail.isBlank() ? "Validation failed" : detail);
    }

    // other IllegalArgumentExceptions are internal and fall through to handleGeneric
    @ExceptionHandler({
            InvalidCacheKeyException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorEnvelope> handleBadArgument(Exception ex) {
        return badRequest(ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorEnvelope> handleUnreadable(HttpMessageNotReadableException ex) {
        return badRequest("Request body is missing or not valid JSON");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorEnvelope> handleNoResource(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(envelope(ex.getMessage(), ErrorCode.NOT_FOUND));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorEnvelope> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(envelope("Internal server error", ErrorCode.INTERNAL_ERROR));
    }

    private ResponseEntity<ErrorEnvelope> unauthorized(GatewayException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE)
                .body(envelope(ex.getMessage(), ex.getErrorCode()));
    }

    private ResponseEntity<ErrorEnvelope> badRequest(String detail) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(envelope(detail, ErrorCode.VALIDATION_ERROR));
    }

    private ErrorEnvelope envelope(String detail, ErrorCode code) {
        return new ErrorEnvelope(detail, code, clock.instant());
    }

    private static String describe(FieldError e) {
        return e.getField() + ": " + e.getDefaultMessage();
    }
}
