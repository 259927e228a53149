package com.shiptivity.board.infrastructure.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Request DTO for moving a client. Both fields are optional.
 * Priority is kept as a raw JSON node so that non-integer values reach validation
 * instead of failing deserialization.
 */
public record UpdateClientRequest(
        String status,
        JsonNode priority
) {
    /**
     * @return the priority as text, or null when absent or JSON null
     */
    public String rawPriority() {
        if (priority == null || priority.isNull()) {
            return null;
        }
        return priority.isValueNode() ? priority.asText() : priority.toString();
    }
}
