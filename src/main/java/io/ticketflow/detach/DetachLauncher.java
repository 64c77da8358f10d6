package io.ticketflow.detach;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * Starts a process that outlives the launching CLI and is detached from its terminal.
 */
public interface DetachLauncher {
    /**
     * @return pid of the started process
     */
    long launch(List<String> command) throws IOException;

    static DetachLauncher forCurrentPlatform() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return new WindowsDetachLauncher();
        }
        return new PosixDetachLauncher();
    }
}
