package com.purchasingpower.chemflow.model;

/**
 * External collaborators whose calls are logged through ExternalCallLogger.
 *
 * @see com.purchasingpower.chemflow.util.ExternalCallLogger
 */
public enum ServiceType {
    GRAPH_STORE("🟢", "GraphStore"),
    ENTRY_SOURCE("🔷", "EntrySource");

    private final String emoji;
    private final String name;

    ServiceType(String emoji, String name) {
        this.emoji = emoji;
        this.name = name;
    }

    public String getEmoji() {
        return emoji;
    }

    public String getName() {
        return name;
    }
}
