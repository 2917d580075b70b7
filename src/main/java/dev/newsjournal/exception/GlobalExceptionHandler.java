package dev.newsjournal.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps failures that happen around the journal (bad requests, unknown sessions, unexpected errors)
 * to {@link ErrorResponse} bodies. Journal rule violations never reach this class: the journal service
 * returns them as regular results.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private static final Locale MESSAGE_LOCALE = Locale.ENGLISH;

    private final MessageSource messageSource;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.NOT_FOUND,
                msg("error.not_found"), msg(ex.getMessage())));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? fieldError.getDefaultMessage()
                                : msg("error.invalid_value"),
                        (existing, ignored) -> existing
                ));

        log.warn("Validation failed: {}", errors);
        ErrorResponse response = build(exchange, HttpStatus.BAD_REQUEST,
                msg("error.validation_failed"), msg("error.invalid_request_data"));
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(
            jakarta.validation.ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.put(field, violation.getMessage());
        });

        log.warn("Constraint violations: {}", errors);
        ErrorResponse response = build(exchange, HttpStatus.BAD_REQUEST,
                msg("error.validation_failed"), msg("error.invalid_request_params"));
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.BAD_REQUEST,
                msg("error.bad_request"),
                ex.getReason() != null ? ex.getReason() : msg("error.invalid_request")));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatusException(
            ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        String errorKey = statusToKey(status);
        String message = ex.getReason() != null ? msg(ex.getReason()) : msg(errorKey);
        return Mono.just(ResponseEntity.status(status)
                .body(build(exchange, status, msg(errorKey), message)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        return Mono.just(build(exchange, HttpStatus.INTERNAL_SERVER_ERROR,
                msg("error.internal_server_error"), msg("error.unexpected_error")));
    }

    private ErrorResponse build(ServerWebExchange exchange, HttpStatus status, String error, String message) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build();
    }

    private String msg(String code) {
        String key = code != null ? code : "error.invalid_request";
        return messageSource.getMessage(key, null, key, MESSAGE_LOCALE);
    }

    private String statusToKey(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "error.not_found";
            case BAD_REQUEST -> "error.bad_request";
            case SERVICE_UNAVAILABLE -> "error.service_unavailable";
            default -> "error.internal_server_error";
        };
    }
}
