package com.example.sgkdocumentreader.controller;

import com.example.sgkdocumentreader.exception.ArtifactNotFoundException;
import com.example.sgkdocumentreader.exception.ExtractionFailureException;
import com.example.sgkdocumentreader.exception.InvalidWorkflowTransitionException;
import com.example.sgkdocumentreader.exception.PatientNotFoundException;
import com.example.sgkdocumentreader.exception.PersistenceException;
import com.example.sgkdocumentreader.exception.PipelineCancelledException;
import com.example.sgkdocumentreader.exception.RunInProgressException;
import com.example.sgkdocumentreader.exception.RunNotFoundException;
import com.example.sgkdocumentreader.exception.SgkDocumentException;
import com.example.sgkdocumentreader.exception.StorageQuotaExceededException;
import com.example.sgkdocumentreader.exception.ValidationException;
import com.example.sgkdocumentreader.model.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.stream.Collectors;

@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, exception, request);
    }

    @ExceptionHandler(ExtractionFailureException.class)
    public ResponseEntity<ErrorResponse> handleExtractionFailure(ExtractionFailureException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_GATEWAY, exception, request);
    }

    @ExceptionHandler(StorageQuotaExceededException.class)
    public ResponseEntity<ErrorResponse> handleQuota(StorageQuotaExceededException exception, HttpServletRequest request) {
        return respond(HttpStatus.INSUFFICIENT_STORAGE, exception, request);
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistence(PersistenceException exception, HttpServletRequest request) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, exception, request);
    }

    @ExceptionHandler({PipelineCancelledException.class, RunInProgressException.class,
            InvalidWorkflowTransitionException.class})
    public ResponseEntity<ErrorResponse> handleConflict(SgkDocumentException exception, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, exception, request);
    }

    @ExceptionHandler({ArtifactNotFoundException.class, PatientNotFoundException.class, RunNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(SgkDocumentException exception, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, exception, request);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "The file is larger than the allowed upload size", request);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Missing file part '" + exception.getRequestPartName() + "'", request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException exception, HttpServletRequest request) {
        String message = exception.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, message, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Malformed request body", request);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException exception, HttpServletRequest request) {
        HttpStatus status = HttpStatus.valueOf(exception.getStatusCode().value());
        return respond(status, exception.getReason(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, exception.getMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, SgkDocumentException exception,
                                                         HttpServletRequest request) {
        return respond(status, exception.getUserMessage(), request);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String message, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(), message,
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
