package com.fleetops.agent.security;

/**
 * Output of {@link CotRedactor}. Only {@code summary} is safe to store or stream.
 */
public record RedactionResult(String summary, int redactionCount, int originalLength, int summaryLength) {

    public static RedactionResult empty() {
        return new RedactionResult("", 0, 0, 0);
    }

    public boolean wasRedacted() {
        return redactionCount > 0;
    }
}
