package io.ticketflow.detach;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code cmd /c start "" /b} leaves the child running without a console after the CLI exits.
 * The returned pid is the launcher's; the child writes its own pid file.
 */
public final class WindowsDetachLauncher implements DetachLauncher {
    @Override
    public long launch(List<String> command) throws IOException {
        List<String> argv = new ArrayList<>(List.of("cmd", "/c", "start", "\"\"", "/b"));
        argv.addAll(command);
        ProcessBuilder pb = new ProcessBuilder(argv);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process = pb.start();
        process.getOutputStream().close();
        return process.pid();
    }
}
