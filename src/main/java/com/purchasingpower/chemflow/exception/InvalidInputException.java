package com.purchasingpower.chemflow.exception;

import lombok.Getter;

import java.util.List;

/**
 * The entry population handed to the engine violates an integrity rule
 * (malformed or conflicting ids). Fatal to the run; raised before any mutation.
 */
@Getter
public class InvalidInputException extends RuntimeException {

    private final List<String> entryIds;

    public InvalidInputException(String message, List<String> entryIds) {
        super(message);
        this.entryIds = List.copyOf(entryIds);
    }

    public InvalidInputException(String message, String entryId) {
        this(message, entryId == null ? List.of() : List.of(entryId));
    }
}
