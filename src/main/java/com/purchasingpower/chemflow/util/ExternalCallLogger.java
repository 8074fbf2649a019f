package com.purchasingpower.chemflow.util;

import com.purchasingpower.chemflow.model.CallContext;
import com.purchasingpower.chemflow.model.ServiceType;
import org.slf4j.Logger;

/**
 * Unified logging for calls to the graph store and entry sources.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
