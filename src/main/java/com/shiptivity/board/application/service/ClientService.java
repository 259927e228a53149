package com.shiptivity.board.application.service;

import com.shiptivity.board.application.port.ClientPort;
import com.shiptivity.board.core.model.Client;
import com.shiptivity.board.core.model.Lane;
import com.shiptivity.board.core.ranking.RerankingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service for client board operations.
 */
@Service
public class ClientService {

    private static final Logger log = LoggerFactory.getLogger(ClientService.class);

    private final ClientPort clientPort;
    private final ClientValidator validator;
    private final RerankingEngine rerankingEngine;

    public ClientService(ClientPort clientPort, ClientValidator validator, RerankingEngine rerankingEngine) {
        this.clientPort = clientPort;
        this.validator = validator;
        this.rerankingEngine = rerankingEngine;
    }

    /**
     * Lists clients, optionally restricted to one lane.
     *
     * @param rawStatus the lane filter as received, or null for every lane
     * @return all clients ordered by id, or the lane's clients ordered by rank
     */
    @Transactional(readOnly = true)
    public List<Client> listClients(String rawStatus) {
        Lane lane = validator.validateLane(rawStatus);
        if (lane == null) {
            return clientPort.findAll();
        }
        return clientPort.findByLane(lane);
    }

    /**
     * Gets a single client.
     *
     * @param rawId the id as received
     * @return the client
     */
    @Transactional(readOnly = true)
    public Client getClient(String rawId) {
        long id = validator.validateId(rawId);
        return clientPort.findById(id);
    }

    /**
     * Moves a client to a new lane and/or rank.
     * Validates input, reranks the whole board and writes the result in one transaction.
     *
     * @param rawId       the id as received
     * @param rawStatus   the destination lane as received, or null to keep the current lane
     * @param rawPriority the destination rank as received, or null for the default placement
     * @return the full board after the move, ordered by id
     */
    @Transactional
    public List<Client> updateClient(String rawId, String rawStatus, String rawPriority) {
        long id = validator.validateId(rawId);
        Lane lane = validator.validateLane(rawStatus);
        Integer priority = validator.validatePriority(rawPriority);

        List<Client> current = clientPort.findAll();
        List<Client> next = rerankingEngine.rerank(current, id, lane, priority);

        if (next == current) {
            log.debug("Client {} already at requested placement, nothing to write", id);
            return current;
        }

        clientPort.saveAll(next);

        Client before = current.stream().filter(c -> c.getId() == id).findFirst().orElseThrow();
        Client after = next.stream().filter(c -> c.getId() == id).findFirst().orElseThrow();
        log.info("Moved client {} from {}#{} to {}#{}", id,
                before.getLane().getValue(), before.getRank(),
                after.getLane().getValue(), after.getRank());
        return next;
    }

    /**
     * Replaces the board with the fixed seed set.
     *
     * @return the seeded clients ordered by id
     */
    @Transactional
    public List<Client> resetBoard() {
        List<Client> seed = BoardSeed.clients();
        clientPort.replaceAll(seed);
        log.info("Board reset with {} seed clients", seed.size());
        return seed;
    }
}
