package io.ticketflow.error;

public final class TicketNotFoundException extends TicketFlowException {
    private final String ticketId;

    public TicketNotFoundException(String ticketId) {
        super("store", "ticket not found: " + ticketId, Severity.RECOVERABLE);
        this.ticketId = ticketId;
    }

    public String ticketId() {
        return ticketId;
    }
}
