package com.apisite.checker.probe.model;

import java.time.Duration;

/**
 * Outcome of probing one endpoint.
 *
 * <p>{@code url} is the candidate that validated, or the configured base URL when none did.
 * {@code statusCode} is the last HTTP status seen, or {@link #NO_RESPONSE} if no response was
 * ever obtained. {@code reasonCode} is {@code null} for valid results.
 */
public record ProbeResult(
    String identifier,
    String url,
    boolean valid,
    int statusCode,
    String message,
    String reasonCode,
    int attempts,
    Duration duration
) {
    public static final int NO_RESPONSE = -1;
    public static final String VALID_MESSAGE = "valid";

    public static ProbeResult valid(String identifier, String url, int statusCode, int attempts, Duration duration) {
        return new ProbeResult(identifier, url, true, statusCode, VALID_MESSAGE, null, attempts, duration);
    }

    public static ProbeResult invalid(
        String identifier,
        String baseUrl,
        int statusCode,
        String message,
        String reasonCode,
        int attempts,
        Duration duration
    ) {
        return new ProbeResult(identifier, baseUrl, false, statusCode, message, reasonCode, attempts, duration);
    }

    public boolean hasResponse() {
        return statusCode != NO_RESPONSE;
    }
}
