package com.dirgen.orchestrator.api;

import com.dirgen.orchestrator.api.dto.ApiError;
import com.dirgen.orchestrator.llm.ProvidersExhaustedException;
import com.dirgen.orchestrator.model.ProtocolException;
import com.dirgen.orchestrator.repository.RunNotFoundException;
import com.dirgen.orchestrator.service.InvalidStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

/**
 * Maps the error taxonomy onto HTTP statuses with an {error, message} body.
 *
 *   ProtocolException           → 400  (malformed request, nothing changed)
 *   RunNotFoundException        → 404
 *   InvalidStateException       → 409  (nothing changed)
 *   ProvidersExhaustedException → 502
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ProtocolException.class)
    public ResponseEntity<ApiError> protocol(ProtocolException e) {
        log.warn("Rejected malformed request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "protocol_error", e.getMessage());
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class
    })
    public ResponseEntity<ApiError> unreadable(Exception e) {
        log.warn("Rejected unreadable request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, "protocol_error", e.getMessage());
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<ApiError> notFound(RunNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(InvalidStateException.class)
    public ResponseEntity<ApiError> invalidState(InvalidStateException e) {
        log.warn("Rejected request in wrong state: {}", e.getMessage());
        return error(HttpStatus.CONFLICT, "invalid_state", e.getMessage());
    }

    @ExceptionHandler(ProvidersExhaustedException.class)
    public ResponseEntity<ApiError> exhausted(ProvidersExhaustedException e) {
        return error(HttpStatus.BAD_GATEWAY, "providers_exhausted", e.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> unexpected(Exception e) {
        // Spring's own web exceptions (404 no handler, 405, ResponseStatusException...) keep their status.
        if (e instanceof ErrorResponse framework) {
            HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
            String message = e instanceof ResponseStatusException rse ? rse.getReason() : e.getMessage();
            return error(status, status.name().toLowerCase(), message);
        }
        log.error("Unhandled error: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", e.getMessage());
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ApiError(code, message));
    }
}
