package com.shiptivity.board.core.ranking;

import com.shiptivity.board.core.exception.RankInvariantViolationException;
import com.shiptivity.board.core.model.Client;
import com.shiptivity.board.core.model.Lane;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Computes the next board state when one client changes lane and/or rank.
 * <p>
 * Pure function over immutable {@link Client} values: the input list is never modified and
 * the result is a new list in the same order as the input. Only the moved client and the
 * neighbors whose ranks shift differ from the input. Callers persist the returned list as a whole.
 */
public class RerankingEngine {

    /**
     * Moves a client and re-derives the ranks of every affected client.
     *
     * @param clients       the full current board, densely ranked per lane
     * @param targetId      the id of the client being moved
     * @param requestedLane the destination lane, or null to stay in the current lane
     * @param requestedRank the destination rank (1-based), or null for the bottom of a new lane;
     *                      ranks past the bottom are clamped to it
     * @return the full board after the move, or the input itself when the move is a no-op
     * @throws RankInvariantViolationException if the target is not on the board, the requested rank
     *                                         is below 1, or the result is not densely ranked
     */
    public List<Client> rerank(List<Client> clients, long targetId, Lane requestedLane, Integer requestedRank) {
        Objects.requireNonNull(clients, "clients must not be null");

        Map<Long, Client> byId = clients.stream()
                .collect(Collectors.toMap(Client::getId, Function.identity()));
        Client target = byId.get(targetId);
        if (target == null) {
            throw new RankInvariantViolationException("Client " + targetId + " is not on the board");
        }
        if (requestedRank != null && requestedRank < 1) {
            throw new RankInvariantViolationException("Requested rank must be positive, was " + requestedRank);
        }

        Lane originalLane = target.getLane();
        int originalRank = target.getRank();
        Lane destLane = requestedLane != null ? requestedLane : originalLane;
        boolean sameLane = destLane == originalLane;

        if (sameLane && requestedRank == null) {
            return clients;
        }

        int destRank = resolveDestRank(clients, destLane, sameLane, requestedRank);

        if (sameLane && destRank == originalRank) {
            return clients;
        }

        List<Client> next = new ArrayList<>(clients.size());
        for (Client client : clients) {
            if (client.getId() == targetId) {
                next.add(client.withPlacement(destLane, destRank));
            } else if (sameLane) {
                next.add(shiftWithinLane(client, destLane, originalRank, destRank));
            } else {
                next.add(shiftAcrossLanes(client, originalLane, originalRank, destLane, destRank));
            }
        }

        DenseRanking.verify(next);
        return List.copyOf(next);
    }

    private int resolveDestRank(List<Client> clients, Lane destLane, boolean sameLane, Integer requestedRank) {
        int laneSize = (int) clients.stream()
                .filter(client -> client.getLane() == destLane)
                .count();
        // a client joining the lane may take the slot past the current bottom
        int maxRank = sameLane ? laneSize : laneSize + 1;
        if (requestedRank == null) {
            return maxRank;
        }
        return Math.min(requestedRank, maxRank);
    }

    private Client shiftWithinLane(Client client, Lane lane, int originalRank, int destRank) {
        if (client.getLane() != lane) {
            return client;
        }
        int rank = client.getRank();
        if (destRank <= rank && rank < originalRank) {
            return client.withRank(rank + 1);
        }
        if (originalRank < rank && rank <= destRank) {
            return client.withRank(rank - 1);
        }
        return client;
    }

    private Client shiftAcrossLanes(Client client, Lane originalLane, int originalRank, Lane destLane, int destRank) {
        if (client.getLane() == originalLane && client.getRank() >= originalRank) {
            return client.withRank(client.getRank() - 1);
        }
        if (client.getLane() == destLane && client.getRank() >= destRank) {
            return client.withRank(client.getRank() + 1);
        }
        return client;
    }
}
