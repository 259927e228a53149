package com.shiptivity.board.infrastructure.api.controller;

import com.shiptivity.board.application.service.ClientService;
import com.shiptivity.board.core.model.Client;
import com.shiptivity.board.infrastructure.api.dto.ClientResponse;
import com.shiptivity.board.infrastructure.api.dto.UpdateClientRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST controller for client board operations.
 */
@RestController
@RequestMapping("/api/v1/clients")
public class ClientController {

    private final ClientService clientService;

    public ClientController(ClientService clientService) {
        this.clientService = clientService;
    }

    @GetMapping
    public ResponseEntity<List<ClientResponse>> listClients(
            @RequestParam(required = false) String status
    ) {
        return ResponseEntity.ok(toResponses(clientService.listClients(status)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ClientResponse> getClient(@PathVariable String id) {
        return ResponseEntity.ok(ClientResponse.from(clientService.getClient(id)));
    }

    /**
     * Moves a client to a new lane and/or priority and returns the whole board.
     */
    @PutMapping("/{id}")
    public ResponseEntity<List<ClientResponse>> updateClient(
            @PathVariable String id,
            @RequestBody(required = false) UpdateClientRequest request
    ) {
        String status = request == null ? null : request.status();
        String priority = request == null ? null : request.rawPriority();

        List<Client> board = clientService.updateClient(id, status, priority);
        return ResponseEntity.ok(toResponses(board));
    }

    private List<ClientResponse> toResponses(List<Client> clients) {
        return clients.stream()
                .map(ClientResponse::from)
                .toList();
    }
}
