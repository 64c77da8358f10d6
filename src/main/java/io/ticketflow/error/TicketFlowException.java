package io.ticketflow.error;

/**
 * Base of every failure raised by ticketflow.
 *
 * <p>Each exception carries the operation that failed and a {@link Severity}. Recoverable
 * failures are reported and the batch continues; fatal failures abort the current command.
 */
public class TicketFlowException extends RuntimeException {
    public enum Severity {
        RECOVERABLE,
        FATAL
    }

    private final String operation;
    private final Severity severity;

    public TicketFlowException(String operation, String message, Severity severity) {
        this(operation, message, severity, null);
    }

    public TicketFlowException(String operation, String message, Severity severity, Throwable cause) {
        super(operation + ": " + message, cause);
        this.operation = operation;
        this.severity = severity == null ? Severity.FATAL : severity;
    }

    public String operation() {
        return operation;
    }

    public Severity severity() {
        return severity;
    }

    public boolean isRecoverable() {
        return severity == Severity.RECOVERABLE;
    }
}
