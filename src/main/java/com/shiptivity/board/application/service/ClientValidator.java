package com.shiptivity.board.application.service;

import com.shiptivity.board.application.port.ClientPort;
import com.shiptivity.board.core.exception.InvalidIdException;
import com.shiptivity.board.core.exception.InvalidLaneException;
import com.shiptivity.board.core.exception.InvalidPriorityException;
import com.shiptivity.board.core.model.Lane;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigInteger;

/**
 * Checks raw request input before it reaches the reranking engine.
 */
@Component
public class ClientValidator {

    private static final BigInteger MAX_PRIORITY = BigInteger.valueOf(Integer.MAX_VALUE);

    private final ClientPort clientPort;

    public ClientValidator(ClientPort clientPort) {
        this.clientPort = clientPort;
    }

    /**
     * Parses the id and checks that a client with that id exists.
     *
     * @param rawId the id as received
     * @return the parsed id
     * @throws InvalidIdException if the id is not an integer or names no client
     */
    public long validateId(String rawId) {
        long id;
        try {
            id = Long.parseLong(rawId == null ? "" : rawId.trim());
        } catch (NumberFormatException e) {
            throw new InvalidIdException(InvalidIdException.Reason.NOT_AN_INTEGER);
        }
        if (clientPort.findById(id) == null) {
            throw new InvalidIdException(InvalidIdException.Reason.NOT_FOUND);
        }
        return id;
    }

    /**
     * Parses an optional priority.
     *
     * @param rawPriority the priority as received, possibly null or blank
     * @return the priority capped at {@link Integer#MAX_VALUE}, or null when none was requested
     * @throws InvalidPriorityException if present and not a positive integer
     */
    public Integer validatePriority(String rawPriority) {
        if (!StringUtils.hasText(rawPriority)) {
            return null;
        }
        BigInteger priority;
        try {
            priority = new BigInteger(rawPriority.trim());
        } catch (NumberFormatException e) {
            throw new InvalidPriorityException(rawPriority);
        }
        if (priority.signum() < 1) {
            throw new InvalidPriorityException(rawPriority);
        }
        // anything past int range is far below the bottom of any lane; the engine clamps it
        return priority.min(MAX_PRIORITY).intValueExact();
    }

    /**
     * Resolves an optional lane from its wire value.
     *
     * @param rawLane the status as received, possibly null or blank
     * @return the lane, or null when none was requested
     * @throws InvalidLaneException if present and not one of the three lanes
     */
    public Lane validateLane(String rawLane) {
        if (!StringUtils.hasText(rawLane)) {
            return null;
        }
        return Lane.fromValue(rawLane)
                .orElseThrow(() -> new InvalidLaneException(rawLane));
    }
}
