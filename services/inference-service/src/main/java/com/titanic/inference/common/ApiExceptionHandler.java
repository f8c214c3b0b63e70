package com.titanic.inference.common;

import com.titanic.inference.features.TransformException;
import com.titanic.inference.model.ModelUnavailableException;
import com.titanic.inference.security.AuthenticationException;
import com.titanic.inference.validation.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex) {
        logger.debug("validation rejected request_id={} fields={}",
            RequestContextHolder.currentRequestId(), ex.getFieldErrors().keySet());
        ErrorResponse response = ErrorResponse.of("validation_error", ex.getMessage())
            .withFieldErrors(ex.getFieldErrors());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> handleAuthentication(AuthenticationException ex) {
        logger.debug("authentication rejected request_id={} reason={}",
            RequestContextHolder.currentRequestId(), ex.getReason().wire());
        ErrorResponse response = ErrorResponse.of("authentication_error", ex.getMessage())
            .withReason(ex.getReason().wire());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
            .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
            .body(response);
    }

    @ExceptionHandler(ModelUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleModelUnavailable(ModelUnavailableException ex, HttpServletRequest request) {
        logger.error(
            "model_unavailable request_id={} trace_id={} method={} path={} model={}",
            RequestContextHolder.currentRequestId(),
            RequestContextHolder.currentTraceId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex.getModelKey(),
            ex
        );
        ErrorResponse response = ErrorResponse.of("model_unavailable", "Prediction models are temporarily unavailable");
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
    }

    @ExceptionHandler(TransformException.class)
    public ResponseEntity<ErrorResponse> handleTransform(TransformException ex, HttpServletRequest request) {
        logger.error(
            "transform_error request_id={} trace_id={} method={} path={}",
            RequestContextHolder.currentRequestId(),
            RequestContextHolder.currentTraceId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        ErrorResponse response = ErrorResponse.of("transform_error", "Input could not be converted to model features");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleInvalidJson(HttpMessageNotReadableException ex) {
        ErrorResponse response = ErrorResponse.of("bad_request", "Request body is not valid JSON");
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        ErrorResponse response = ErrorResponse.of("bad_request", "Request body must be application/json");
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE).body(response);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethod(HttpRequestMethodNotSupportedException ex) {
        ErrorResponse response = ErrorResponse.of("method_not_allowed", ex.getMessage());
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(response);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        logger.debug("parameter rejected request_id={} name={}", RequestContextHolder.currentRequestId(), ex.getName());
        ErrorResponse response = ErrorResponse.of("bad_request", "Invalid value for parameter: " + ex.getName());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        ErrorResponse response = ErrorResponse.of("bad_request", "Missing parameter: " + ex.getParameterName());
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(Exception ex) {
        ErrorResponse response = ErrorResponse.of("not_found", "Resource not found");
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        logger.error(
            "unexpected_exception request_id={} trace_id={} method={} path={}",
            RequestContextHolder.currentRequestId(),
            RequestContextHolder.currentTraceId(),
            request == null ? null : request.getMethod(),
            request == null ? null : request.getRequestURI(),
            ex
        );
        ErrorResponse response = ErrorResponse.of("internal_error", "An internal error occurred");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
}
