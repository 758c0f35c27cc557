package com.zzf.codesync.api;

import com.zzf.codesync.model.ErrorResponse;
import com.zzf.codesync.model.SyncErrorCode;
import com.zzf.codesync.model.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public final class GlobalExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SyncException.class)
    public ResponseEntity<ErrorResponse> handleSyncException(SyncException e) {
        HttpStatus status = statusFor(e.getErrorCode());
        if (status.is5xxServerError()) {
            logger.error("api.error code={} msg={}", e.getErrorCode(), e.getMessage(), e);
        } else {
            logger.warn("api.reject code={} msg={}", e.getErrorCode(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(new ErrorResponse(e.getErrorCode().name(), e.getMessage()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(new ErrorResponse(SyncErrorCode.INVALID_REQUEST.name(), e.getClass().getSimpleName() + ": " + e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknownException(Exception e) {
        String msg = e.getMessage();
        if (msg == null || msg.trim().isEmpty()) {
            msg = e.getClass().getSimpleName();
        } else {
            msg = e.getClass().getSimpleName() + ": " + msg;
        }
        logger.error("api.error code=INTERNAL msg={}", msg, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .header("Content-Type", "application/json;charset=UTF-8")
                .body(new ErrorResponse(SyncErrorCode.INTERNAL.name(), msg));
    }

    static HttpStatus statusFor(SyncErrorCode code) {
        switch (code) {
            case UNKNOWN_SESSION:
                return HttpStatus.CONFLICT;
            case TRANSIENT_NETWORK:
            case EMBEDDING_PROVIDER:
                return HttpStatus.SERVICE_UNAVAILABLE;
            case ENCRYPTION:
            case INTERNAL:
                return HttpStatus.INTERNAL_SERVER_ERROR;
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }
}
