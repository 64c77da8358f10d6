package io.ticketflow.runtime;

import io.ticketflow.model.TicketStatus;

/**
 * Result of one ticket passing through the scheduler.
 */
public record TicketOutcome(String ticketId, TicketStatus status, String message, String logPath, long durationMs) {
    public boolean completed() {
        return status == TicketStatus.COMPLETED;
    }
}
