package io.ticketflow.config;

import io.ticketflow.error.ConfigException;
import io.ticketflow.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Immutable configuration value built once by the CLI and handed to the store, resolver,
 * scheduler, and detach manager.
 */
public final class TicketFlowConfig {
    public static final String SETTINGS_FILE = "ticketflow.json";
    public static final String ENV_PREFIX = "TICKETFLOW_";
    public static final String DEFAULT_TICKETS_DIR = ".tickets";
    public static final String DEFAULT_LOGS_DIR = ".agent-logs";
    public static final String DEFAULT_PID_FILE = ".work.pid";
    public static final String DEFAULT_AGENT_COMMAND = "agent";
    public static final List<String> DEFAULT_AGENT_ARGS = List.of("-p");
    public static final int DEFAULT_MAX_PARALLEL = 3;
    public static final int DEFAULT_MAX_ITERATIONS = 20;
    public static final int DEFAULT_AGENT_TIMEOUT_SECONDS = 600;
    public static final int DEFAULT_MAX_OUTPUT_CHARS = 1000;

    private static final DateTimeFormatter LOG_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
            .withZone(ZoneOffset.UTC);

    private final Path projectRoot;
    private final Path ticketsDir;
    private final Path logsDir;
    private final Path detachLogDir;
    private final Path pidFile;
    private final int maxParallel;
    private final int maxIterations;
    private final String agentCommand;
    private final List<String> agentArgs;
    private final int agentTimeoutSeconds;
    private final int maxOutputChars;
    private final boolean dryRun;

    public TicketFlowConfig(
            Path projectRoot,
            Path ticketsDir,
            Path logsDir,
            Path detachLogDir,
            Path pidFile,
            int maxParallel,
            int maxIterations,
            String agentCommand,
            List<String> agentArgs,
            int agentTimeoutSeconds,
            int maxOutputChars,
            boolean dryRun
    ) {
        this.projectRoot = projectRoot.toAbsolutePath().normalize();
        this.ticketsDir = resolve(this.projectRoot, ticketsDir, DEFAULT_TICKETS_DIR);
        this.logsDir = resolve(this.projectRoot, logsDir, DEFAULT_LOGS_DIR);
        this.detachLogDir = detachLogDir == null ? null : resolve(this.projectRoot, detachLogDir, DEFAULT_LOGS_DIR);
        this.pidFile = pidFile == null ? null : resolve(this.projectRoot, pidFile, DEFAULT_PID_FILE);
        this.maxParallel = maxParallel;
        this.maxIterations = maxIterations;
        this.agentCommand = agentCommand == null || agentCommand.isBlank() ? DEFAULT_AGENT_COMMAND : agentCommand.trim();
        this.agentArgs = agentArgs == null ? DEFAULT_AGENT_ARGS : List.copyOf(agentArgs);
        this.agentTimeoutSeconds = agentTimeoutSeconds;
        this.maxOutputChars = maxOutputChars;
        this.dryRun = dryRun;
    }

    public static TicketFlowConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank() ? Paths.get(".") : Paths.get(root);
        return new TicketFlowConfig(
                resolved,
                null,
                null,
                null,
                null,
                DEFAULT_MAX_PARALLEL,
                DEFAULT_MAX_ITERATIONS,
                DEFAULT_AGENT_COMMAND,
                DEFAULT_AGENT_ARGS,
                DEFAULT_AGENT_TIMEOUT_SECONDS,
                DEFAULT_MAX_OUTPUT_CHARS,
                false
        );
    }

    /**
     * Defaults, then {@code ticketflow.json} under the project root, then {@code TICKETFLOW_*}
     * environment variables.
     */
    public static TicketFlowConfig load(String root, Map<String, String> env) {
        TicketFlowConfig defaults = fromRoot(root);
        Path settingsPath = defaults.settingsFile();
        TicketFlowSettingsFile file = TicketFlowSettingsFile.EMPTY;
        if (Files.isRegularFile(settingsPath)) {
            try {
                file = Jsons.mapper().readValue(settingsPath.toFile(), TicketFlowSettingsFile.class);
            } catch (IOException e) {
                throw new ConfigException("failed to read " + settingsPath, e);
            }
        }
        TicketFlowSettingsFile merged = file.overlay(TicketFlowSettingsFile.fromEnv(env, ENV_PREFIX));
        return merged.applyTo(defaults);
    }

    public void validate() {
        if (maxParallel < 1) {
            throw new ConfigException("max_parallel must be at least 1");
        }
        if (maxIterations < 1) {
            throw new ConfigException("max_iterations must be at least 1");
        }
        if (agentTimeoutSeconds < 1) {
            throw new ConfigException("agent_timeout_seconds must be at least 1");
        }
    }

    public void writeDefaultSettings() {
        Path target = settingsFile();
        if (Files.exists(target)) {
            return;
        }
        try {
            Files.createDirectories(projectRoot);
            Files.writeString(target, Jsons.toJson(TicketFlowSettingsFile.from(this)));
        } catch (IOException e) {
            throw new ConfigException("failed to write " + target, e);
        }
    }

    public TicketFlowConfig withMaxParallel(int value) {
        return new TicketFlowConfig(projectRoot, ticketsDir, logsDir, detachLogDir, pidFile,
                value, maxIterations, agentCommand, agentArgs, agentTimeoutSeconds, maxOutputChars, dryRun);
    }

    public TicketFlowConfig withMaxIterations(int value) {
        return new TicketFlowConfig(projectRoot, ticketsDir, logsDir, detachLogDir, pidFile,
                maxParallel, value, agentCommand, agentArgs, agentTimeoutSeconds, maxOutputChars, dryRun);
    }

    public TicketFlowConfig withDryRun(boolean value) {
        return new TicketFlowConfig(projectRoot, ticketsDir, logsDir, detachLogDir, pidFile,
                maxParallel, maxIterations, agentCommand, agentArgs, agentTimeoutSeconds, maxOutputChars, value);
    }

    public TicketFlowConfig withAgent(String command, List<String> args, int timeoutSeconds) {
        return new TicketFlowConfig(projectRoot, ticketsDir, logsDir, detachLogDir, pidFile,
                maxParallel, maxIterations, command, args, timeoutSeconds, maxOutputChars, dryRun);
    }

    public TicketFlowConfig withPaths(Path tickets, Path logs, Path detachLogs, Path pid) {
        return new TicketFlowConfig(projectRoot, tickets, logs, detachLogs, pid,
                maxParallel, maxIterations, agentCommand, agentArgs, agentTimeoutSeconds, maxOutputChars, dryRun);
    }

    public Path projectRoot() {
        return projectRoot;
    }

    public Path settingsFile() {
        return projectRoot.resolve(SETTINGS_FILE);
    }

    public Path ticketsDir() {
        return ticketsDir;
    }

    public Path statusDir(String dirName) {
        return ticketsDir.resolve(dirName);
    }

    public Path journalFile() {
        return ticketsDir.resolve(".journal").resolve("work.jsonl");
    }

    public Path logsDir() {
        return logsDir;
    }

    /**
     * Directory for detached-run logs; falls back to the agent logs directory.
     */
    public Path detachLogDir() {
        return detachLogDir == null ? logsDir : detachLogDir;
    }

    public boolean hasDedicatedDetachLogDir() {
        return detachLogDir != null;
    }

    public Path workPidFilePath() {
        return pidFile == null ? ticketsDir.resolve(DEFAULT_PID_FILE) : pidFile;
    }

    public boolean hasExplicitPidFile() {
        return pidFile != null;
    }

    /**
     * An explicit override wins (relative paths resolve against the project root); otherwise
     * {@code work-yyyyMMdd-HHmmss.log} under {@link #detachLogDir()}, stamped in UTC.
     */
    public Path detachLogPath(String override, Instant now) {
        if (override != null && !override.isBlank()) {
            Path candidate = Paths.get(override.trim());
            return candidate.isAbsolute() ? candidate.normalize() : projectRoot.resolve(candidate).normalize();
        }
        Instant stamp = now == null ? Instant.now() : now;
        return detachLogDir().resolve("work-" + LOG_STAMP.format(stamp) + ".log");
    }

    public int maxParallel() {
        return maxParallel;
    }

    public int maxIterations() {
        return maxIterations;
    }

    public String agentCommand() {
        return agentCommand;
    }

    public List<String> agentArgs() {
        return new ArrayList<>(agentArgs);
    }

    public int agentTimeoutSeconds() {
        return agentTimeoutSeconds;
    }

    public int maxOutputChars() {
        return maxOutputChars;
    }

    public boolean dryRun() {
        return dryRun;
    }

    private static Path resolve(Path root, Path value, String fallback) {
        Path raw = value == null ? Paths.get(fallback) : value;
        return raw.isAbsolute() ? raw.normalize() : root.resolve(raw).normalize();
    }
}
