package com.shiptivity.board.infrastructure.api.controller;

import com.shiptivity.board.core.exception.InvalidIdException;
import com.shiptivity.board.core.exception.InvalidLaneException;
import com.shiptivity.board.core.exception.InvalidPriorityException;
import com.shiptivity.board.core.exception.RankInvariantViolationException;
import com.shiptivity.board.core.exception.StoreException;
import com.shiptivity.board.infrastructure.api.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for REST API.
 * Maps domain exceptions to an error code, a short message and a longer explanation.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(InvalidIdException.class)
    public ResponseEntity<ErrorResponse> handleInvalidId(InvalidIdException ex) {
        log.debug("Rejected id: {}", ex.getReason());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_ID", ex.getMessage(), ex.getReason().getExplanation()));
    }

    @ExceptionHandler(InvalidLaneException.class)
    public ResponseEntity<ErrorResponse> handleInvalidLane(InvalidLaneException ex) {
        log.debug("Rejected status '{}'", ex.getRejectedValue());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_STATUS", ex.getMessage(), InvalidLaneException.EXPLANATION));
    }

    @ExceptionHandler(InvalidPriorityException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPriority(InvalidPriorityException ex) {
        log.debug("Rejected priority '{}'", ex.getRejectedValue());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_PRIORITY", ex.getMessage(), InvalidPriorityException.EXPLANATION));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse("INVALID_REQUEST", "Invalid request body.",
                        "Body must be a JSON object with optional status and priority."));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(StoreException ex) {
        log.error("Store failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("STORE_ERROR", "Could not access client records.", ex.getMessage()));
    }

    @ExceptionHandler(RankInvariantViolationException.class)
    public ResponseEntity<ErrorResponse> handleInvariantViolation(RankInvariantViolationException ex) {
        log.error("Ranking invariant violated, request aborted", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("RANK_INVARIANT_VIOLATION", "Could not rerank clients.", ex.getMessage()));
    }
}
