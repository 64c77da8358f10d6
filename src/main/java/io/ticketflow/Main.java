package io.ticketflow;

import io.ticketflow.cli.TicketFlowCommand;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = TicketFlowCommand.newCommandLine().execute(args);
        System.exit(code);
    }
}
