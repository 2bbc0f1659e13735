package com.vidnyan.cleanup.adapter.in.web;

import com.vidnyan.cleanup.application.error.AnalysisFailedException;
import com.vidnyan.cleanup.application.error.CleanupException;
import com.vidnyan.cleanup.application.error.ReportUnavailableException;
import com.vidnyan.cleanup.application.error.StoreConnectivityException;
import com.vidnyan.cleanup.domain.finding.AgentFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps analysis errors to HTTP responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), List.of()));
    }

    @ExceptionHandler(StoreConnectivityException.class)
    public ResponseEntity<ErrorResponse> storeUnavailable(StoreConnectivityException e) {
        log.error("Store '{}' unavailable during {}", e.getStore(), e.getOperation(), e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ErrorResponse(e.getMessage(), List.of()));
    }

    @ExceptionHandler(AnalysisFailedException.class)
    public ResponseEntity<ErrorResponse> analysisFailed(AnalysisFailedException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(e.getMessage(), e.getFailures()));
    }

    @ExceptionHandler(ReportUnavailableException.class)
    public ResponseEntity<ErrorResponse> reportUnavailable(ReportUnavailableException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(e.getMessage(), e.getFailures()));
    }

    @ExceptionHandler(CleanupException.class)
    public ResponseEntity<ErrorResponse> cleanupError(CleanupException e) {
        log.error("Request failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(e.getMessage(), List.of()));
    }

    public record ErrorResponse(
        String error,
        List<AgentFailure> details
    ) {}
}
