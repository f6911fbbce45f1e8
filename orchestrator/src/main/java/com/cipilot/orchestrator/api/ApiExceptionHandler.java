package com.cipilot.orchestrator.api;

import com.cipilot.orchestrator.analyzer.RepositoryNotFoundException;
import com.cipilot.orchestrator.api.dto.ErrorResponse;
import com.cipilot.orchestrator.service.CommitFailedException;
import com.cipilot.orchestrator.service.WorkflowAbortedException;
import com.cipilot.orchestrator.service.WorkflowNotFoundException;
import com.cipilot.orchestrator.store.StoreException;
import com.cipilot.orchestrator.vcs.VcsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

/**
 * Maps the user-visible workflow failures to JSON error bodies.
 * Everything else falls through to Spring's default handling.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CommitFailedException.class)
    public ResponseEntity<ErrorResponse> handleCommitFailed(CommitFailedException ex) {
        log.warn("Commit failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStore(StoreException ex) {
        log.warn("Template store unavailable: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler(VcsException.class)
    public ResponseEntity<ErrorResponse> handleVcs(VcsException ex) {
        log.warn("GitLab call failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex);
    }

    @ExceptionHandler({RepositoryNotFoundException.class, WorkflowNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
        return respond(HttpStatus.NOT_FOUND, ex);
    }

    @ExceptionHandler(WorkflowAbortedException.class)
    public ResponseEntity<ErrorResponse> handleAborted(WorkflowAbortedException ex) {
        return respond(HttpStatus.CONFLICT, ex);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, ex);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, RuntimeException ex) {
        return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), status.getReasonPhrase(), ex.getMessage(), Instant.now()));
    }
}
