package com.example.invoice.interfaces.api.error;

import com.example.invoice.domain.model.UploadOutcome;
import com.example.invoice.infrastructure.exception.InfrastructureException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;

/**
 * Centralized API-layer exception handler for failures raised outside the upload pipeline.
 * Server-side failures are answered with a generic message; details stay in the log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Maps container-level multipart size rejections to a 413 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleMaxUploadSize(MaxUploadSizeExceededException ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.PAYLOAD_TOO_LARGE, UploadOutcome.FILE_TOO_LARGE.name(),
                UploadOutcome.FILE_TOO_LARGE.defaultMessage());
    }

    /**
     * Maps malformed multipart bodies to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> handleMultipart(MultipartException ex, HttpServletRequest request) {
        log.info("Malformed multipart request on {}: {}", request.getRequestURI(), ex.getMessage());
        return buildResponse(request, HttpStatus.BAD_REQUEST, "INVALID_MULTIPART_REQUEST",
                "The request body is not a valid multipart upload");
    }

    /**
     * Maps unparsable request parameters (for example a non-boolean {@code simulateTimeout}) to a 400 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return buildResponse(request, HttpStatus.BAD_REQUEST, "INVALID_REQUEST_PARAMETER",
                "Invalid value for parameter '" + ex.getName() + "'");
    }

    /**
     * Maps infrastructure exceptions to a 500 response.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(InfrastructureException.class)
    public ResponseEntity<ErrorResponse> handleInfrastructure(InfrastructureException ex, HttpServletRequest request) {
        log.error("Infrastructure failure on {}", request.getRequestURI(), ex);
        return internalError(request);
    }

    /**
     * Fallback for unexpected exceptions.
     *
     * @param ex      thrown exception
     * @param request incoming HTTP request
     * @return response entity with serialized error payload
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected failure on {}", request.getRequestURI(), ex);
        return internalError(request);
    }

    private ResponseEntity<ErrorResponse> internalError(HttpServletRequest request) {
        return buildResponse(request, HttpStatus.INTERNAL_SERVER_ERROR, UploadOutcome.INTERNAL_ERROR.name(),
                UploadOutcome.INTERNAL_ERROR.defaultMessage());
    }

    /**
     * Central helper that creates a consistent {@link ErrorResponse} envelope.
     *
     * @param request   incoming HTTP request
     * @param status    HTTP status code to return
     * @param errorCode application-specific error code
     * @param message   message safe to show to the client
     * @return response entity containing the serialized error
     */
    private ResponseEntity<ErrorResponse> buildResponse(HttpServletRequest request,
                                                       HttpStatus status,
                                                       String errorCode,
                                                       String message) {
        ErrorResponse response = ErrorResponse.of(status.value(), errorCode, message, request.getRequestURI());
        return ResponseEntity.status(status).body(response);
    }
}
