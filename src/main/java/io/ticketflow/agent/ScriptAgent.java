package io.ticketflow.agent;

import io.ticketflow.model.Ticket;
import io.ticketflow.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command-line agent once per ticket. The ticket is rendered into a plain
 * prompt passed as the last argument; combined stdout/stderr goes to a per-call log file whose
 * body becomes the ticket output.
 */
public final class ScriptAgent implements Agent {
    private static final Logger log = LoggerFactory.getLogger(ScriptAgent.class);
    private static final int MAX_ERROR_CHARS = 512;
    private static final long POLL_MS = 200L;
    private static final DateTimeFormatter LOG_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS")
            .withZone(ZoneOffset.UTC);

    private final String id;
    private final List<String> command;
    private final Path workingDir;
    private final Path logDir;

    public ScriptAgent(String id, List<String> command, Path workingDir, Path logDir) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script agent id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script agent command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.workingDir = workingDir;
        this.logDir = logDir;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public AgentResult execute(AgentContext context) throws InterruptedException {
        Ticket ticket = context.ticket();
        List<String> argv = new ArrayList<>(command);
        argv.add(buildPrompt(ticket));

        Path logFile;
        long headerBytes;
        try {
            Files.createDirectories(logDir);
            logFile = logDir.resolve(ticket.id() + "-" + LOG_STAMP.format(Instant.now()) + ".log");
            String header = "# ticket " + ticket.id() + System.lineSeparator()
                    + "# command " + String.join(" ", command) + System.lineSeparator()
                    + "# started " + Instant.now() + System.lineSeparator();
            Files.writeString(logFile, header, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            headerBytes = Files.size(logFile);
        } catch (IOException e) {
            return AgentResult.fail("agent log setup failed: " + e.getMessage());
        }

        ProcessBuilder pb = new ProcessBuilder(argv);
        if (workingDir != null) {
            pb.directory(workingDir.toFile());
        }
        pb.redirectErrorStream(true);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        Process process;
        try {
            process = pb.start();
            process.getOutputStream().close();
        } catch (IOException e) {
            return AgentResult.fail("agent spawn failed: " + e.getMessage(), logFile.toString());
        }

        Duration timeout = context.timeout() == null ? Duration.ofMinutes(10) : context.timeout();
        long deadline = System.nanoTime() + timeout.toNanos();
        CancellationToken cancellation = context.cancellation() == null ? CancellationToken.none() : context.cancellation();
        try {
            while (!process.waitFor(POLL_MS, TimeUnit.MILLISECONDS)) {
                if (cancellation.isCancelled()) {
                    kill(process);
                    return AgentResult.fail("agent cancelled: " + cancellation.reason(), logFile.toString());
                }
                if (System.nanoTime() >= deadline) {
                    kill(process);
                    return AgentResult.fail("agent timeout after " + timeout, logFile.toString());
                }
            }
        } catch (InterruptedException e) {
            kill(process);
            throw e;
        }

        String output = readBody(logFile, headerBytes);
        if (process.exitValue() == 0) {
            return AgentResult.ok(output.strip(), logFile.toString());
        }
        return AgentResult.fail("agent exit=" + process.exitValue() + " output=" + Texts.singleLine(output, MAX_ERROR_CHARS),
                logFile.toString());
    }

    String buildPrompt(Ticket ticket) {
        StringBuilder sb = new StringBuilder();
        sb.append("Ticket ").append(ticket.id()).append(": ").append(ticket.title()).append('\n');
        sb.append("Type: ").append(ticket.type()).append('\n');
        if (!Texts.isBlank(ticket.description())) {
            sb.append('\n').append(ticket.description()).append('\n');
        }
        appendList(sb, "Files to create", ticket.filesToCreate());
        appendList(sb, "Files to modify", ticket.filesToModify());
        appendList(sb, "Acceptance criteria", ticket.acceptanceCriteria());
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append('\n').append(heading).append(":\n");
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
    }

    private static String readBody(Path logFile, long headerBytes) {
        try {
            byte[] all = Files.readAllBytes(logFile);
            int from = (int) Math.min(headerBytes, all.length);
            return new String(all, from, all.length - from, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("could not read agent log {}: {}", logFile, e.getMessage());
            return "";
        }
    }

    private static void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            process.waitFor(1, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
