package ru.tigran.freigenthub.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of examining one drained message in a worker pass.
 *
 * - OK: a recommendation_response was sent to {@code sentTo}
 * - IGNORED: payload type is not a recommendation_request, nothing sent
 * - ERROR: profile missing or unreadable, a recommendation_error was sent back
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingOutcome(
        String requestMessageId,
        Status status,
        String reason,   // IGNORED / ERROR only
        String sentTo    // OK only
) {
    public enum Status {
        OK, IGNORED, ERROR
    }

    public static ProcessingOutcome ok(String requestMessageId, String sentTo) {
        return new ProcessingOutcome(requestMessageId, Status.OK, null, sentTo);
    }

    public static ProcessingOutcome ignored(String requestMessageId, String reason) {
        return new ProcessingOutcome(requestMessageId, Status.IGNORED, reason, null);
    }

    public static ProcessingOutcome error(String requestMessageId, String reason) {
        return new ProcessingOutcome(requestMessageId, Status.ERROR, reason, null);
    }
}
