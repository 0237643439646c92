package com.tracegate.dispatch.api;

import com.tracegate.core.error.AlreadyExistsException;
import com.tracegate.core.error.DuplicateAssociationException;
import com.tracegate.core.error.NotFoundException;
import com.tracegate.core.error.ValidationRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps domain exceptions to JSON error responses:
 * <ul>
 *   <li>{@link NotFoundException} to 404</li>
 *   <li>{@link DuplicateAssociationException} and {@link AlreadyExistsException} to 409</li>
 *   <li>{@link ValidationRejectedException} to 422</li>
 *   <li>{@link IllegalArgumentException} and unreadable bodies to 400</li>
 * </ul>
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(DuplicateAssociationException.class)
    public ResponseEntity<Map<String, Object>> handleDuplicate(DuplicateAssociationException ex) {
        return respond(HttpStatus.CONFLICT, "duplicate_association", ex.getMessage());
    }

    @ExceptionHandler(AlreadyExistsException.class)
    public ResponseEntity<Map<String, Object>> handleAlreadyExists(AlreadyExistsException ex) {
        return respond(HttpStatus.CONFLICT, "already_exists", ex.getMessage());
    }

    @ExceptionHandler(ValidationRejectedException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(ValidationRejectedException ex) {
        ResponseEntity<Map<String, Object>> response =
                respond(HttpStatus.UNPROCESSABLE_ENTITY, "validation_rejected", ex.getMessage());
        if (ex.getTestLayer() != null && response.getBody() != null) {
            response.getBody().put("test_layer", ex.getTestLayer().code());
        }
        return response;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Malformed request body: " + cause.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String code, String message) {
        log.debug("Request failed with {}: {}", status.value(), message);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        return ResponseEntity.status(status).body(body);
    }
}
