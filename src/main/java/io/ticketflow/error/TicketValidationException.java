package io.ticketflow.error;

public final class TicketValidationException extends TicketFlowException {
    public TicketValidationException(String message) {
        super("validate", message, Severity.FATAL);
    }
}
