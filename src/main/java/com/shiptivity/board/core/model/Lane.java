package com.shiptivity.board.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Workflow lane a client belongs to. Each lane keeps its own dense 1-based ranking.
 */
public enum Lane {
    BACKLOG("backlog"),
    IN_PROGRESS("in-progress"),
    COMPLETE("complete");

    private final String value;

    Lane(String value) {
        this.value = value;
    }

    /**
     * Wire and column value, e.g. {@code "in-progress"}.
     */
    public String getValue() {
        return value;
    }

    /**
     * Resolves a lane from its wire value. Matching is case-sensitive.
     *
     * @param value the wire value
     * @return the lane, or empty if the value names no lane
     */
    public static Optional<Lane> fromValue(String value) {
        return Arrays.stream(values())
                .filter(lane -> lane.value.equals(value))
                .findFirst();
    }
}
