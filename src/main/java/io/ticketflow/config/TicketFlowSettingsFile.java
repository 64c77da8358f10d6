package io.ticketflow.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.ticketflow.error.ConfigException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * On-disk shape of {@code ticketflow.json}. Every field is optional; {@code null} keeps the
 * value from the layer below.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record TicketFlowSettingsFile(
        @JsonProperty("tickets_dir") String ticketsDir,
        @JsonProperty("logs_dir") String logsDir,
        @JsonProperty("work_detach_log_dir") String workDetachLogDir,
        @JsonProperty("work_pid_file") String workPidFile,
        @JsonProperty("max_parallel") Integer maxParallel,
        @JsonProperty("max_iterations") Integer maxIterations,
        @JsonProperty("agent_command") String agentCommand,
        @JsonProperty("agent_args") List<String> agentArgs,
        @JsonProperty("agent_timeout_seconds") Integer agentTimeoutSeconds,
        @JsonProperty("max_output_chars") Integer maxOutputChars,
        @JsonProperty("dry_run") Boolean dryRun
) {
    static final TicketFlowSettingsFile EMPTY = new TicketFlowSettingsFile(
            null, null, null, null, null, null, null, null, null, null, null);

    static TicketFlowSettingsFile fromEnv(Map<String, String> env, String prefix) {
        if (env == null || env.isEmpty()) {
            return EMPTY;
        }
        String args = env.get(prefix + "AGENT_ARGS");
        return new TicketFlowSettingsFile(
                env.get(prefix + "TICKETS_DIR"),
                env.get(prefix + "LOGS_DIR"),
                env.get(prefix + "WORK_DETACH_LOG_DIR"),
                env.get(prefix + "WORK_PID_FILE"),
                parseInt(env, prefix + "MAX_PARALLEL"),
                parseInt(env, prefix + "MAX_ITERATIONS"),
                env.get(prefix + "AGENT_COMMAND"),
                args == null ? null : Arrays.stream(args.trim().split("\\s+")).filter(s -> !s.isBlank()).toList(),
                parseInt(env, prefix + "AGENT_TIMEOUT_SECONDS"),
                parseInt(env, prefix + "MAX_OUTPUT_CHARS"),
                parseBoolean(env, prefix + "DRY_RUN")
        );
    }

    static TicketFlowSettingsFile from(TicketFlowConfig config) {
        Path root = config.projectRoot();
        return new TicketFlowSettingsFile(
                relative(root, config.ticketsDir()),
                relative(root, config.logsDir()),
                config.hasDedicatedDetachLogDir() ? relative(root, config.detachLogDir()) : "",
                config.hasExplicitPidFile() ? relative(root, config.workPidFilePath()) : "",
                config.maxParallel(),
                config.maxIterations(),
                config.agentCommand(),
                config.agentArgs(),
                config.agentTimeoutSeconds(),
                config.maxOutputChars(),
                config.dryRun()
        );
    }

    TicketFlowSettingsFile overlay(TicketFlowSettingsFile top) {
        return new TicketFlowSettingsFile(
                pick(top.ticketsDir, ticketsDir),
                pick(top.logsDir, logsDir),
                pick(top.workDetachLogDir, workDetachLogDir),
                pick(top.workPidFile, workPidFile),
                pick(top.maxParallel, maxParallel),
                pick(top.maxIterations, maxIterations),
                pick(top.agentCommand, agentCommand),
                pick(top.agentArgs, agentArgs),
                pick(top.agentTimeoutSeconds, agentTimeoutSeconds),
                pick(top.maxOutputChars, maxOutputChars),
                pick(top.dryRun, dryRun)
        );
    }

    TicketFlowConfig applyTo(TicketFlowConfig base) {
        return new TicketFlowConfig(
                base.projectRoot(),
                ticketsDir == null || ticketsDir.isBlank() ? base.ticketsDir() : Paths.get(ticketsDir),
                logsDir == null || logsDir.isBlank() ? base.logsDir() : Paths.get(logsDir),
                workDetachLogDir == null || workDetachLogDir.isBlank() ? null : Paths.get(workDetachLogDir),
                workPidFile == null || workPidFile.isBlank() ? null : Paths.get(workPidFile),
                maxParallel == null ? base.maxParallel() : maxParallel,
                maxIterations == null ? base.maxIterations() : maxIterations,
                agentCommand == null ? base.agentCommand() : agentCommand,
                agentArgs == null ? base.agentArgs() : agentArgs,
                agentTimeoutSeconds == null ? base.agentTimeoutSeconds() : agentTimeoutSeconds,
                maxOutputChars == null ? base.maxOutputChars() : maxOutputChars,
                dryRun == null ? base.dryRun() : dryRun
        );
    }

    private static <T> T pick(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    private static String relative(Path root, Path value) {
        return value.startsWith(root) ? root.relativize(value).toString() : value.toString();
    }

    private static Integer parseInt(Map<String, String> env, String key) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigException("invalid integer for " + key + ": " + raw, e);
        }
    }

    private static Boolean parseBoolean(Map<String, String> env, String key) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("true") || normalized.equals("1") || normalized.equals("yes");
    }
}
