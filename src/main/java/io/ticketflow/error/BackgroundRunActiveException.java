package io.ticketflow.error;

public final class BackgroundRunActiveException extends TicketFlowException {
    private final long pid;

    public BackgroundRunActiveException(long pid) {
        super("work", "background work is already running (pid " + pid + ")", Severity.FATAL);
        this.pid = pid;
    }

    public long pid() {
        return pid;
    }
}
