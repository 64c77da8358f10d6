package io.ticketflow.error;

import java.io.IOException;

public final class StoreIOException extends TicketFlowException {
    public StoreIOException(String message, IOException cause) {
        super("store", message, Severity.FATAL, cause);
    }
}
