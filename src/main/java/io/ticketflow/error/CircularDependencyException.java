package io.ticketflow.error;

import java.util.List;

public final class CircularDependencyException extends TicketFlowException {
    private final List<String> ticketIds;

    public CircularDependencyException(List<String> ticketIds) {
        super("dependency", "circular dependency among tickets " + ticketIds, Severity.RECOVERABLE);
        this.ticketIds = List.copyOf(ticketIds);
    }

    public List<String> ticketIds() {
        return ticketIds;
    }
}
