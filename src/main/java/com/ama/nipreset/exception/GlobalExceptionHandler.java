package com.ama.nipreset.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import com.ama.nipreset.model.dto.ApiMessages;
import com.ama.nipreset.model.dto.MessageResponseDTO;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps failures to fixed user messages. Technical detail only goes to the log.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({
        MethodArgumentNotValidException.class,
        HandlerMethodValidationException.class,
        HttpMessageNotReadableException.class,
        HttpMediaTypeNotSupportedException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<MessageResponseDTO> handleInvalidInput(Exception e) {
        log.debug("Rejected invalid input: {}", e.getClass().getSimpleName());
        return respond(HttpStatus.BAD_REQUEST, ApiMessages.INVALID_INPUT);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<MessageResponseDTO> handleNoResource(NoResourceFoundException e) {
        return respond(HttpStatus.NOT_FOUND, ApiMessages.REQUEST_FAILED);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<MessageResponseDTO> handleMethodNotSupported(HttpRequestMethodNotSupportedException e) {
        return respond(HttpStatus.METHOD_NOT_ALLOWED, ApiMessages.REQUEST_FAILED);
    }

    @ExceptionHandler(DirectoryMismatchException.class)
    public ResponseEntity<MessageResponseDTO> handleDirectoryMismatch(DirectoryMismatchException e) {
        log.info("Directory mismatch: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, ApiMessages.WRONG_DATA);
    }

    @ExceptionHandler(ResetRateLimitedException.class)
    public ResponseEntity<MessageResponseDTO> handleRateLimited(ResetRateLimitedException e) {
        log.info(e.getMessage());
        return respond(HttpStatus.TOO_MANY_REQUESTS, ApiMessages.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(InvalidResetTokenException.class)
    public ResponseEntity<MessageResponseDTO> handleInvalidToken(InvalidResetTokenException e) {
        return respond(HttpStatus.FORBIDDEN, ApiMessages.INVALID_LINK);
    }

    @ExceptionHandler(DependencyUnavailableException.class)
    public ResponseEntity<MessageResponseDTO> handleDependencyUnavailable(DependencyUnavailableException e) {
        log.error("Dependency unavailable: {}", e.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ApiMessages.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler({TokenIssuanceException.class, ResetLinkDeliveryException.class})
    public ResponseEntity<MessageResponseDTO> handleRequestFailed(RuntimeException e) {
        log.error("Reset request failed: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ApiMessages.REQUEST_FAILED);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<MessageResponseDTO> handleGenericException(Exception e) {
        log.error("Unexpected error: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ApiMessages.REQUEST_FAILED);
    }

    private static ResponseEntity<MessageResponseDTO> respond(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(MessageResponseDTO.of(message));
    }
}
