package org.salesintel.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.salesintel.models.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MappingValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MappingValidationException e, HttpServletRequest request) {
        log.info("Mapping entry rejected: {}", e.getErrors());
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Error", "Mapping entry is invalid",
                e.getErrors(), request);
    }

    @ExceptionHandler(EditorStateException.class)
    public ResponseEntity<ErrorResponse> handleEditorState(EditorStateException e, HttpServletRequest request) {
        log.info("Editor state violation: {}", e.getMessage());
        return buildResponse(HttpStatus.CONFLICT, "Editor State Conflict", e.getMessage(), List.of(), request);
    }

    @ExceptionHandler(EditorSessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(EditorSessionNotFoundException e, HttpServletRequest request) {
        log.warn("Session Not Found: {}", e.getMessage());
        return buildResponse(HttpStatus.NOT_FOUND, "Not Found", e.getMessage(), List.of(), request);
    }

    @ExceptionHandler(MappingPersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(MappingPersistenceException e, HttpServletRequest request) {
        log.error("Mapping persistence failed: {}", e.getMessage());
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "Persistence Error",
                "Mappings could not be saved; your edits are kept, try again", List.of(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadInput(IllegalArgumentException e, HttpServletRequest request) {
        log.warn("Invalid Input: {}", e.getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", e.getMessage(), List.of(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e, HttpServletRequest request) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error",
                "Invalid value '" + e.getValue() + "' for " + e.getName(), List.of(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException e, HttpServletRequest request) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .toList();
        log.warn("Validation Error: {}", details);
        return buildResponse(HttpStatus.BAD_REQUEST, "Validation Error", "Request body is invalid", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest request) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return buildResponse(HttpStatus.BAD_REQUEST, "Input Error", "Malformed request body",
                List.of(e.getMostSpecificCause().getMessage()), request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        return buildResponse(status, status.getReasonPhrase(), e.getReason(), List.of(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneralError(Exception e, HttpServletRequest request) {
        log.error("Internal Server Error: ", e);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred",
                List.of(), request);
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String error, String message,
                                                        List<String> details, HttpServletRequest request) {
        ErrorResponse response = new ErrorResponse(
                Instant.now(),
                status.value(),
                error,
                message,
                request.getRequestURI(),
                details);
        return ResponseEntity.status(status).body(response);
    }
}
