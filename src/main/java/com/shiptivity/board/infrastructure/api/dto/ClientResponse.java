package com.shiptivity.board.infrastructure.api.dto;

import com.shiptivity.board.core.model.Client;

/**
 * Response DTO for a single client. Lane and rank travel as {@code status} and {@code priority}.
 */
public record ClientResponse(
        long id,
        String name,
        String description,
        String status,
        int priority
) {
    public static ClientResponse from(Client client) {
        return new ClientResponse(
                client.getId(),
                client.getName(),
                client.getDescription(),
                client.getLane().getValue(),
                client.getRank()
        );
    }
}
