package io.ticketflow.cli;

import io.ticketflow.error.TicketFlowException;
import io.ticketflow.util.Jsons;
import io.ticketflow.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.IExecutionExceptionHandler;
import picocli.CommandLine.ParseResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prints failures as a JSON object on stdout and maps them to the CLI exit codes.
 */
final class CliExceptionHandler implements IExecutionExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(CliExceptionHandler.class);

    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, ParseResult parseResult) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", Texts.nullToEmpty(ex.getMessage()));
        if (ex instanceof TicketFlowException tfe) {
            body.put("operation", tfe.operation());
            body.put("recoverable", tfe.isRecoverable());
        } else {
            body.put("type", ex.getClass().getSimpleName());
            log.debug("command {} failed", commandLine.getCommandName(), ex);
        }
        System.out.println(Jsons.toJson(body));
        return ExitCodes.forException(ex);
    }
}
