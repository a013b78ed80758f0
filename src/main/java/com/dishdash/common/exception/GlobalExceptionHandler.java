package com.dishdash.common.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.net.URI;
import java.util.stream.Collectors;

/**
 * Renders every failure as an RFC 7807 {@link ProblemDetail}.
 *
 * <pre>
 *   {
 *     "type": "https://dishdash.app/errors/conflict",
 *     "status": 409,
 *     "detail": "Order already picked up by another courier",
 *     "errorCode": "CONFLICT",
 *     "retryable": false
 *   }
 * </pre>
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ProblemDetail> handleBusinessException(BusinessException e) {
        ErrorCode errorCode = e.getErrorCode();
        if (errorCode.isRetryable()) {
            log.warn("Retryable failure: code={}, detail={}", errorCode, e.getMessage());
        }
        return problem(errorCode, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return problem(ErrorCode.INVALID_INPUT, detail);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ProblemDetail> handleMissingHeader(MissingRequestHeaderException e) {
        return problem(ErrorCode.INVALID_INPUT, "Missing header: " + e.getHeaderName());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgument(IllegalArgumentException e) {
        return problem(ErrorCode.INVALID_INPUT, e.getMessage());
    }

    private ResponseEntity<ProblemDetail> problem(ErrorCode errorCode, String detail) {
        HttpStatus status = errorCode.getStatus();
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create("https://dishdash.app/errors/" + errorCode.name().toLowerCase()));
        problem.setProperty("errorCode", errorCode.name());
        problem.setProperty("retryable", errorCode.isRetryable());
        return ResponseEntity.status(status).body(problem);
    }
}
