package io.ticketflow.error;

public final class AgentUnavailableException extends TicketFlowException {
    public AgentUnavailableException(String command) {
        super("agent", "agent command not available: " + command, Severity.FATAL);
    }
}
