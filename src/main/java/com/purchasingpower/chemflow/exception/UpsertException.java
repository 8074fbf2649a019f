package com.purchasingpower.chemflow.exception;

import com.purchasingpower.chemflow.core.EdgeKey;
import lombok.Getter;

/**
 * The graph store rejected or failed a single edge mutation.
 */
@Getter
public class UpsertException extends RuntimeException {

    private final EdgeKey edge;

    public UpsertException(EdgeKey edge, String message, Throwable cause) {
        super(message, cause);
        this.edge = edge;
    }

    public UpsertException(EdgeKey edge, String message) {
        super(message);
        this.edge = edge;
    }
}
