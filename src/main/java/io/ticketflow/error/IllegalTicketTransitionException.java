package io.ticketflow.error;

import io.ticketflow.model.TicketStatus;

public final class IllegalTicketTransitionException extends TicketFlowException {
    private final String ticketId;
    private final TicketStatus from;
    private final TicketStatus to;

    public IllegalTicketTransitionException(String ticketId, TicketStatus from, TicketStatus to) {
        super("transition", "ticket " + ticketId + " cannot move from " + from + " to " + to, Severity.FATAL);
        this.ticketId = ticketId;
        this.from = from;
        this.to = to;
    }

    public String ticketId() {
        return ticketId;
    }

    public TicketStatus from() {
        return from;
    }

    public TicketStatus to() {
        return to;
    }
}
