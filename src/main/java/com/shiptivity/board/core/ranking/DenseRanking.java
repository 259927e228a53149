package com.shiptivity.board.core.ranking;

import com.shiptivity.board.core.exception.RankInvariantViolationException;
import com.shiptivity.board.core.model.Client;
import com.shiptivity.board.core.model.Lane;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks that every lane's ranks form the contiguous run {@code 1..n}.
 */
public final class DenseRanking {

    private DenseRanking() {
    }

    /**
     * @throws RankInvariantViolationException naming the first lane whose ranks are not {@code 1..n}
     */
    public static void verify(List<Client> clients) {
        firstViolation(clients).ifPresent(message -> {
            throw new RankInvariantViolationException(message);
        });
    }

    public static boolean isDense(List<Client> clients) {
        return firstViolation(clients).isEmpty();
    }

    private static Optional<String> firstViolation(List<Client> clients) {
        Map<Lane, List<Integer>> ranksByLane = clients.stream()
                .collect(Collectors.groupingBy(
                        Client::getLane,
                        () -> new EnumMap<>(Lane.class),
                        Collectors.mapping(Client::getRank, Collectors.toList())));

        for (Map.Entry<Lane, List<Integer>> entry : ranksByLane.entrySet()) {
            List<Integer> sorted = entry.getValue().stream().sorted().toList();
            for (int i = 0; i < sorted.size(); i++) {
                if (sorted.get(i) != i + 1) {
                    return Optional.of("Lane " + entry.getKey().getValue()
                            + " is not densely ranked: " + sorted);
                }
            }
        }
        return Optional.empty();
    }
}
