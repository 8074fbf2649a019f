package com.purchasingpower.chemflow.core;

import java.util.Comparator;

/**
 * Identity of a persisted edge. At most one edge exists per key.
 */
public record EdgeKey(String fromId, String toId, RelationshipKind kind) implements Comparable<EdgeKey> {

    private static final Comparator<EdgeKey> ORDER = Comparator
            .comparing(EdgeKey::fromId)
            .thenComparing(EdgeKey::toId)
            .thenComparing(EdgeKey::kind);

    @Override
    public int compareTo(EdgeKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return fromId + " -[" + kind + "]-> " + toId;
    }
}
