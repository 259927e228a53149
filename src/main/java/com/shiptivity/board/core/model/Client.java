package com.shiptivity.board.core.model;

import java.util.Objects;

/**
 * Domain entity representing a client card on the board.
 * Pure domain object with no framework dependencies. Instances are immutable;
 * a placement change produces a new instance through {@link #withPlacement(Lane, int)}.
 */
public final class Client {

    private final long id;
    private final String name;
    private final String description;
    private final Lane lane;
    private final int rank;

    public Client(long id, String name, String description, Lane lane, int rank) {
        this.id = id;
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.description = description;
        this.lane = Objects.requireNonNull(lane, "lane must not be null");
        this.rank = rank;
    }

    public long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Lane getLane() {
        return lane;
    }

    public int getRank() {
        return rank;
    }

    public Client withPlacement(Lane newLane, int newRank) {
        return new Client(id, name, description, newLane, newRank);
    }

    public Client withRank(int newRank) {
        return withPlacement(lane, newRank);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Client that = (Client) o;
        return id == that.id
                && rank == that.rank
                && lane == that.lane
                && name.equals(that.name)
                && Objects.equals(description, that.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, lane, rank);
    }

    @Override
    public String toString() {
        return "Client{id=" + id + ", lane=" + lane.getValue() + ", rank=" + rank + "}";
    }
}
