package io.ticketflow.detach;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the child in a new session via {@code setsid} when the binary exists, so a hangup of
 * the launching terminal does not reach it.
 */
public final class PosixDetachLauncher implements DetachLauncher {
    private static final Logger log = LoggerFactory.getLogger(PosixDetachLauncher.class);
    private static final List<Path> SETSID_CANDIDATES = List.of(
            Paths.get("/usr/bin/setsid"),
            Paths.get("/bin/setsid"),
            Paths.get("/usr/local/bin/setsid")
    );
    private static final File DEV_NULL = new File("/dev/null");

    @Override
    public long launch(List<String> command) throws IOException {
        List<String> argv = new ArrayList<>();
        Path setsid = findSetsid();
        if (setsid != null) {
            argv.add(setsid.toString());
        } else {
            log.debug("setsid not found, child stays in the current session");
        }
        argv.addAll(command);
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectInput(ProcessBuilder.Redirect.from(DEV_NULL));
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        return pb.start().pid();
    }

    static Path findSetsid() {
        for (Path candidate : SETSID_CANDIDATES) {
            if (Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
