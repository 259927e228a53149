package com.shiptivity.board.infrastructure.api.dto;

/**
 * Response DTO for error responses.
 */
public record ErrorResponse(
        String errorCode,
        String message,
        String longMessage
) {}
