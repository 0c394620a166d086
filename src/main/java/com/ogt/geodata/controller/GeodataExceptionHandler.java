package com.ogt.geodata.controller;

import com.ogt.geodata.dto.ErrorResponseDTO;
import com.ogt.geodata.exception.ErrorKind;
import com.ogt.geodata.exception.GeodataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CompletionException;

/**
 * Traduce los errores del pipeline al sobre {@code {error, kind}}.
 */
@Slf4j
@RestControllerAdvice
public class GeodataExceptionHandler {

    @ExceptionHandler(GeodataException.class)
    public ResponseEntity<ErrorResponseDTO> handleGeodata(GeodataException e) {
        HttpStatus status = statusOf(e.getKind());
        if (status.is5xxServerError()) {
            log.error("❌ {}: {}", e.getKind(), e.getMessage(), e);
        } else {
            log.debug("{}: {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponseDTO(e.getMessage(), e.getKind().name()));
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ErrorResponseDTO> handleCompletion(CompletionException e) {
        if (e.getCause() instanceof GeodataException ge) {
            return handleGeodata(ge);
        }
        log.error("❌ Fallo en el pool de geoprocesamiento", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ErrorKind.PROCESSING_FAILURE,
                e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDTO> handleValidation(MethodArgumentNotValidException e) {
        FieldError field = e.getBindingResult().getFieldError();
        String message = field != null ? field.getDefaultMessage() : "Petición inválida";
        return error(HttpStatus.BAD_REQUEST, ErrorKind.MISSING_PARAMETER, message);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponseDTO> handleMissingParam(MissingServletRequestParameterException e) {
        return error(HttpStatus.BAD_REQUEST, ErrorKind.MISSING_PARAMETER,
                "El parámetro `" + e.getParameterName() + "` es obligatorio.");
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDTO> handleUnreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_PARAMETER, "Cuerpo JSON inválido: " + e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ErrorResponseDTO> handleRejected(TaskRejectedException e) {
        log.warn("⚠️ Pool de geoprocesamiento saturado: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ErrorKind.PROCESSING_FAILURE,
                "El servicio está saturado, inténtelo de nuevo más tarde.");
    }

    static HttpStatus statusOf(ErrorKind kind) {
        if (kind.isUsageError()) {
            return HttpStatus.BAD_REQUEST;
        }
        return switch (kind) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case EMPTY_RESULT -> HttpStatus.UNPROCESSABLE_ENTITY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static ResponseEntity<ErrorResponseDTO> error(HttpStatus status, ErrorKind kind, String message) {
        return ResponseEntity.status(status).body(new ErrorResponseDTO(message, kind.name()));
    }
}
