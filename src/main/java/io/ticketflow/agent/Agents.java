package io.ticketflow.agent;

import io.ticketflow.config.TicketFlowConfig;
import io.ticketflow.error.AgentUnavailableException;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class Agents {
    private Agents() {
    }

    /**
     * Dry-run configs get a {@link DryRunAgent}; otherwise the configured command must resolve
     * to an executable, or {@link AgentUnavailableException} is thrown.
     */
    public static Agent create(TicketFlowConfig config) {
        if (config.dryRun()) {
            return new DryRunAgent();
        }
        String command = config.agentCommand();
        if (!isAvailable(command)) {
            throw new AgentUnavailableException(command);
        }
        List<String> argv = new ArrayList<>();
        argv.add(command);
        argv.addAll(config.agentArgs());
        return new ScriptAgent("script", argv, config.projectRoot(), config.logsDir());
    }

    public static boolean isAvailable(String command) {
        if (command == null || command.isBlank()) {
            return false;
        }
        Path direct = Paths.get(command);
        if (direct.isAbsolute() || command.contains(File.separator)) {
            return Files.isExecutable(direct);
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return false;
        }
        boolean windows = System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("win");
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir).resolve(command);
            if (Files.isExecutable(candidate)) {
                return true;
            }
            if (windows && (Files.isExecutable(Paths.get(dir).resolve(command + ".exe"))
                    || Files.isExecutable(Paths.get(dir).resolve(command + ".cmd")))) {
                return true;
            }
        }
        return false;
    }
}
