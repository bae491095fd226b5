package com.flagship.etl_agent.observability;

import java.util.UUID;

/**
 * Decides which correlation ID a unit of work runs under.
 *
 * An inbound ID is trusted as-is, whatever its format, so that a trace started by
 * an upstream service continues here. Only a missing or empty ID is replaced.
 */
public final class CorrelationIdResolver {

    private CorrelationIdResolver() {
        // Utility class
    }

    /**
     * Returns the inbound ID verbatim when present, otherwise a newly generated one.
     */
    public static String resolve(String inboundId) {
        if (inboundId == null || inboundId.isEmpty()) {
            return generate();
        }
        return inboundId;
    }

    /**
     * Generates a new correlation ID.
     */
    public static String generate() {
        return UUID.randomUUID().toString();
    }

    /**
     * The ID of the current unit of work, or a new one when nothing is in scope.
     */
    public static String currentOrGenerate() {
        return CorrelationContext.current().orElseGet(CorrelationIdResolver::generate);
    }
}
