package io.ticketflow.error;

public final class ConfigException extends TicketFlowException {
    public ConfigException(String message) {
        super("config", message, Severity.FATAL);
    }

    public ConfigException(String message, Throwable cause) {
        super("config", message, Severity.FATAL, cause);
    }
}
