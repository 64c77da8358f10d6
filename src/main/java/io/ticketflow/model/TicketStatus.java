package io.ticketflow.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TicketStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String dirName;

    TicketStatus(String dirName) {
        this.dirName = dirName;
    }

    @JsonValue
    public String dirName() {
        return dirName;
    }

    /**
     * Encodes the lifecycle: pending to in_progress, in_progress to completed or failed,
     * and failed back to pending on retry. Completed is terminal.
     */
    public boolean canTransitionTo(TicketStatus target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == COMPLETED || target == FAILED;
            case FAILED -> target == PENDING;
            case COMPLETED -> false;
        };
    }

    @JsonCreator
    public static TicketStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Ticket status is required");
        }
        String value = raw.trim();
        for (TicketStatus status : values()) {
            if (status.name().equalsIgnoreCase(value) || status.dirName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown ticket status: " + raw);
    }

    @Override
    public String toString() {
        return dirName;
    }
}
