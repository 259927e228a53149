package com.shiptivity.board.infrastructure.api.dto;

/**
 * Response DTO for plain informational messages.
 */
public record MessageResponse(
        String message
) {}
