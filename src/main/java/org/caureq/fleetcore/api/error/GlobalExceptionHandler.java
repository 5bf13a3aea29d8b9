package org.caureq.fleetcore.api.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.caureq.fleetcore.remote.ConnectivityException;
import org.caureq.fleetcore.service.DuplicateServerException;
import org.caureq.fleetcore.service.InvalidTransitionException;
import org.caureq.fleetcore.service.NotFoundException;
import org.caureq.fleetcore.service.TargetBusyException;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, String cid, Map<String,Object> details) {
        return new ApiError(false, Instant.now(), code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        Map<String,Object> fields = new LinkedHashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fe.getField(), fe.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Validation error", cid(req), Map.of("field_errors", fields))
        );
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleUnreadable(Exception ex, HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Malformed request", cid(req), Map.of())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex,
                                                     HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.NOT_FOUND, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(DuplicateServerException.class)
    public ResponseEntity<ApiError> handleDuplicate(DuplicateServerException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.DUPLICATE_SERVER, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(TargetBusyException.class)
    public ResponseEntity<ApiError> handleBusy(TargetBusyException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.TARGET_BUSY, ex.getMessage(), cid(req), Map.of("server_id", ex.getServerId()))
        );
    }

    @ExceptionHandler(InvalidTransitionException.class)
    public ResponseEntity<ApiError> handleTransition(InvalidTransitionException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.INVALID_TRANSITION, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(ConnectivityException.class)
    public ResponseEntity<ApiError> handleConnectivity(ConnectivityException ex, HttpServletRequest req) {
        var code = switch (ex.kind()) {
            case UNREACHABLE -> ErrorCode.UNREACHABLE;
            case AUTH_FAILED -> ErrorCode.AUTH_FAILED;
            case TIMEOUT -> ErrorCode.TIMEOUT;
            case PROTOCOL -> ErrorCode.PROTOCOL;
        };
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(
                build(code, ex.getMessage(), cid(req), Map.of("host", String.valueOf(ex.host())))
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        if (ex instanceof ErrorResponse er && er.getStatusCode().is4xxClientError()) {
            return ResponseEntity.status(er.getStatusCode()).body(
                    build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(req), Map.of())
            );
        }
        log.error("Unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(req), Map.of())
        );
    }
}
