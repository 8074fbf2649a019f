package com.purchasingpower.chemflow.report;

import com.purchasingpower.chemflow.core.EdgeKey;

/**
 * An edge the graph store did not accept, with the store's reason.
 */
public record FailedEdge(EdgeKey edge, String reason) {
}
