package io.ticketflow.error;

public final class UnknownDependencyException extends TicketFlowException {
    private final String ticketId;
    private final String dependencyId;

    public UnknownDependencyException(String ticketId, String dependencyId) {
        super("dependency", "ticket " + ticketId + " has unknown dependency: " + dependencyId, Severity.RECOVERABLE);
        this.ticketId = ticketId;
        this.dependencyId = dependencyId;
    }

    public String ticketId() {
        return ticketId;
    }

    public String dependencyId() {
        return dependencyId;
    }
}
