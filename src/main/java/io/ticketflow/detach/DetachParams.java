package io.ticketflow.detach;

import java.nio.file.Path;
import java.util.List;

/**
 * Prepared argv for the background child and the log file it will write to.
 */
public record DetachParams(List<String> command, Path logPath) {
    public DetachParams {
        command = List.copyOf(command);
    }
}
