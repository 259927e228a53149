package com.shiptivity.board.application.port;

import com.shiptivity.board.core.model.Client;
import com.shiptivity.board.core.model.Lane;

import java.util.List;

/**
 * Record store for clients. Database plugs into here for the actual implementation.
 * This abstraction keeps the application layer independent of the persistence implementation.
 */
public interface ClientPort {

    /**
     * Finds every client on the board.
     *
     * @return all clients ordered by id
     */
    List<Client> findAll();

    /**
     * Finds the clients of one lane.
     *
     * @param lane the lane
     * @return the lane's clients ordered by rank
     */
    List<Client> findByLane(Lane lane);

    /**
     * Finds a client by its id.
     *
     * @param id the client id
     * @return the client, or null if not found
     */
    Client findById(long id);

    /**
     * Writes the lane and rank of every given client.
     * Callers run this inside a transaction so the whole set commits or none of it does.
     *
     * @param clients the clients to write
     * @throws com.shiptivity.board.core.exception.StoreException if the write fails
     */
    void saveAll(List<Client> clients);

    /**
     * Deletes every stored client and inserts the given set.
     *
     * @param clients the new board contents
     */
    void replaceAll(List<Client> clients);
}
