package com.shiptivity.board.infrastructure.persistence.adapter;

import com.shiptivity.board.application.port.ClientPort;
import com.shiptivity.board.core.exception.StoreException;
import com.shiptivity.board.core.model.Client;
import com.shiptivity.board.core.model.Lane;
import com.shiptivity.board.infrastructure.persistence.dao.ClientDao;
import com.shiptivity.board.infrastructure.persistence.repository.ClientJpaRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Database operation implementations, interacts with JPA repository.
 * Adapter implementing ClientPort using Spring Data JPA.
 * Maps between JPA DAOs and core domain entities and translates data access failures into {@link StoreException}.
 */
@Component
public class ClientAdapter implements ClientPort {

    private static final Logger log = LoggerFactory.getLogger(ClientAdapter.class);

    private final ClientJpaRepository jpaRepository;

    public ClientAdapter(ClientJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    @Override
    public List<Client> findAll() {
        try {
            return jpaRepository.findAllByOrderByIdAsc()
                    .stream()
                    .map(this::toCoreEntity)
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read clients", e);
        }
    }

    @Override
    public List<Client> findByLane(Lane lane) {
        try {
            return jpaRepository.findByStatusOrderByPriorityAsc(lane.getValue())
                    .stream()
                    .map(this::toCoreEntity)
                    .toList();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read clients in lane " + lane.getValue(), e);
        }
    }

    @Override
    public Client findById(long id) {
        try {
            return jpaRepository.findById(id)
                    .map(this::toCoreEntity)
                    .orElse(null);
        } catch (DataAccessException e) {
            throw new StoreException("Failed to read client " + id, e);
        }
    }

    @Override
    public void saveAll(List<Client> clients) {
        for (Client client : clients) {
            int updated;
            try {
                updated = jpaRepository.updatePlacement(
                        client.getId(), client.getLane().getValue(), client.getRank());
            } catch (DataAccessException e) {
                throw new StoreException("Failed to write placement of client " + client.getId(), e);
            }
            if (updated != 1) {
                throw new StoreException("Client " + client.getId() + " vanished during write", null);
            }
        }
        log.debug("Wrote placement of {} clients", clients.size());
    }

    @Override
    public void replaceAll(List<Client> clients) {
        try {
            jpaRepository.deleteAllInBatch();
            jpaRepository.saveAll(clients.stream().map(this::toDao).toList());
        } catch (DataAccessException e) {
            throw new StoreException("Failed to replace board contents", e);
        }
    }

    private Client toCoreEntity(ClientDao dao) {
        Lane lane = Lane.fromValue(dao.getStatus())
                .orElseThrow(() -> new StoreException(
                        "Client " + dao.getId() + " has unknown status " + dao.getStatus(), null));
        return new Client(
                dao.getId(),
                dao.getName(),
                dao.getDescription(),
                lane,
                dao.getPriority()
        );
    }

    private ClientDao toDao(Client client) {
        return new ClientDao(
                client.getId(),
                client.getName(),
                client.getDescription(),
                client.getLane().getValue(),
                client.getRank()
        );
    }
}
