package io.ticketflow.detach;

import io.ticketflow.Main;
import io.ticketflow.agent.CancellationToken;
import io.ticketflow.config.TicketFlowConfig;
import io.ticketflow.error.BackgroundRunActiveException;
import io.ticketflow.error.StoreIOException;
import io.ticketflow.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;

/**
 * Background ("detached") work runs: the parent re-executes the current JVM with
 * {@code work --detach-child}, prints the child pid and exits. The child owns the pid file
 * for as long as it runs so that other commands can refuse to touch the store.
 */
public final class DetachManager {
    public static final String DETACH_CHILD_FLAG = "--detach-child";
    private static final Logger log = LoggerFactory.getLogger(DetachManager.class);
    private static final boolean POSIX = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");

    private final TicketFlowConfig config;
    private final DetachLauncher launcher;
    private final ProcessLiveness liveness;
    private final PidFile pidFile;

    public DetachManager(TicketFlowConfig config, DetachLauncher launcher, ProcessLiveness liveness) {
        this.config = config;
        this.launcher = launcher;
        this.liveness = liveness;
        this.pidFile = new PidFile(config.workPidFilePath());
    }

    public static DetachManager forConfig(TicketFlowConfig config) {
        return new DetachManager(config, DetachLauncher.forCurrentPlatform(), ProcessLiveness.system());
    }

    public PidFile pidFile() {
        return pidFile;
    }

    public DetachParams buildDetachParams(String ticketId, String logFileOverride, Instant now) {
        return buildDetachParams(ticketId, logFileOverride, 0, false, now);
    }

    /**
     * @param parallel forwarded as {@code --parallel} when positive
     */
    public DetachParams buildDetachParams(
            String ticketId,
            String logFileOverride,
            int parallel,
            boolean dryRun,
            Instant now
    ) {
        Path logPath = config.detachLogPath(logFileOverride, now);
        List<String> command = new ArrayList<>();
        command.add(javaExecutable());
        command.add("-cp");
        command.add(System.getProperty("java.class.path", ""));
        command.add(Main.class.getName());
        command.add("--root");
        command.add(config.projectRoot().toString());
        command.add("work");
        if (!Texts.isBlank(ticketId)) {
            command.add(ticketId.trim());
        }
        command.add(DETACH_CHILD_FLAG);
        command.add("--log-file");
        command.add(logPath.toString());
        if (parallel > 0) {
            command.add("--parallel");
            command.add(Integer.toString(parallel));
        }
        if (dryRun) {
            command.add("--dry-run");
        }
        return new DetachParams(command, logPath);
    }

    /**
     * Starts the child and returns without waiting for it.
     */
    public long spawn(DetachParams params) {
        Path logDir = params.logPath().toAbsolutePath().getParent();
        try {
            if (logDir != null) {
                Files.createDirectories(logDir);
            }
            long pid = launcher.launch(params.command());
            log.info("started background work pid={} log={}", pid, params.logPath());
            return pid;
        } catch (IOException e) {
            throw new StoreIOException("failed to start background work", e);
        }
    }

    /**
     * Refuses when a live process owns the pid file. A pid file left by a dead process is
     * removed.
     */
    public void ensureNoBackgroundRun() {
        OptionalLong pid = pidFile.read();
        if (pid.isEmpty()) {
            return;
        }
        if (liveness.isAlive(pid.getAsLong())) {
            throw new BackgroundRunActiveException(pid.getAsLong());
        }
        log.info("removing stale pid file {} (pid {} is gone)", pidFile.path(), pid.getAsLong());
        pidFile.remove();
    }

    public BackgroundStatus backgroundStatus() {
        String pidPath = pidFile.path().toString();
        String logDir = config.detachLogDir().toString();
        OptionalLong pid = pidFile.read();
        if (pid.isEmpty()) {
            return BackgroundStatus.idle(pidPath, logDir);
        }
        if (liveness.isAlive(pid.getAsLong())) {
            return new BackgroundStatus(true, pid.getAsLong(), pidPath, logDir);
        }
        pidFile.remove();
        return BackgroundStatus.idle(pidPath, logDir);
    }

    /**
     * Child side: opens the log, points stdout and stderr at it, writes the pid file and
     * installs a shutdown hook that removes the pid file and cancels {@code token}.
     */
    public ChildSession beginChild(Path logPath, CancellationToken token) {
        PrintStream logStream = redirectOutputToLog(logPath);
        long pid = ProcessHandle.current().pid();
        pidFile.write(pid);
        Thread hook = new Thread(() -> {
            token.cancel("shutdown signal");
            removePidFileQuietly();
        }, "ticketflow-detach-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        log.info("background work running pid={} log={}", pid, logPath);
        return new ChildSession(hook, logStream);
    }

    /**
     * Appends to {@code logPath} (created owner-only) and replaces {@link System#out} and
     * {@link System#err}.
     */
    public static PrintStream redirectOutputToLog(Path logPath) {
        try {
            Path parent = logPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(logPath)) {
                if (POSIX) {
                    Files.createFile(logPath, PosixFilePermissions.asFileAttribute(
                            PosixFilePermissions.fromString("rw-------")));
                } else {
                    Files.createFile(logPath);
                }
            }
            PrintStream stream = new PrintStream(new FileOutputStream(logPath.toFile(), true), true, StandardCharsets.UTF_8);
            System.setOut(stream);
            System.setErr(stream);
            return stream;
        } catch (IOException e) {
            throw new StoreIOException("failed to open work log " + logPath, e);
        }
    }

    static String javaExecutable() {
        return ProcessHandle.current().info().command()
                .orElseGet(() -> Paths.get(System.getProperty("java.home"), "bin", "java").toString());
    }

    private void removePidFileQuietly() {
        try {
            pidFile.remove();
        } catch (StoreIOException e) {
            System.err.println("could not remove pid file: " + e.getMessage());
        }
    }

    /**
     * Closing removes the pid file and the shutdown hook.
     */
    public final class ChildSession implements AutoCloseable {
        private final Thread hook;
        private final PrintStream logStream;

        private ChildSession(Thread hook, PrintStream logStream) {
            this.hook = hook;
            this.logStream = logStream;
        }

        @Override
        public void close() {
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down; hook stays registered");
            }
            removePidFileQuietly();
            logStream.flush();
        }
    }
}
