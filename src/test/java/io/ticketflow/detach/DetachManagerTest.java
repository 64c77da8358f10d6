package io.ticketflow.detach;

import io.ticketflow.Main;
import io.ticketflow.agent.CancellationToken;
import io.ticketflow.config.TicketFlowConfig;
import io.ticketflow.error.BackgroundRunActiveException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

final class DetachManagerTest {
    private static final Instant NOW = Instant.parse("2026-03-04T05:06:07Z");

    @Test
    void stalePidFromExitedProcessIsRemoved() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-detach-stale-");
        try {
            TicketFlowConfig config = TicketFlowConfig.fromRoot(root.toString());
            DetachManager manager = new DetachManager(config, new RecordingLauncher(), ProcessLiveness.system());
            Process exited = new ProcessBuilder(DetachManager.javaExecutable(), "-version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
            Assertions.assertTrue(exited.waitFor(60, TimeUnit.SECONDS));
            manager.pidFile().write(exited.pid());

            manager.ensureNoBackgroundRun();

            Assertions.assertFalse(Files.exists(config.workPidFilePath()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void livePidRefusesSecondRun() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-detach-live-");
        try {
            TicketFlowConfig config = TicketFlowConfig.fromRoot(root.toString());
            DetachManager manager = new DetachManager(config, new RecordingLauncher(), ProcessLiveness.system());
            long self = ProcessHandle.current().pid();
            manager.pidFile().write(self);

            BackgroundRunActiveException error = Assertions.assertThrows(BackgroundRunActiveException.class,
                    manager::ensureNoBackgroundRun);

            Assertions.assertEquals(self, error.pid());
            Assertions.assertTrue(Files.exists(config.workPidFilePath()));
            BackgroundStatus status = manager.backgroundStatus();
            Assertions.assertTrue(status.running());
            Assertions.assertEquals(self, status.pid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void backgroundStatusClearsStaleFile() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-detach-status-");
        try {
            TicketFlowConfig config = TicketFlowConfig.fromRoot(root.toString());
            DetachManager manager = new DetachManager(config, new RecordingLauncher(), pid -> false);
            manager.pidFile().write(99L);

            BackgroundStatus status = manager.backgroundStatus();

            Assertions.assertFalse(status.running());
            Assertions.assertEquals(0L, status.pid());
            Assertions.assertFalse(Files.exists(config.workPidFilePath()));
            Assertions.assertEquals(config.workPidFilePath().toString(), status.pidFile());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void buildsChildCommandLine() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-detach-params-");
        try {
            TicketFlowConfig config = TicketFlowConfig.fromRoot(root.toString());
            DetachManager manager = new DetachManager(config, new RecordingLauncher(), pid -> false);

            DetachParams params = manager.buildDetachParams("T-7", null, 4, true, NOW);

            Path expectedLog = config.logsDir().resolve("work-20260304-050607.log");
            Assertions.assertEquals(expectedLog, params.logPath());
            List<String> command = params.command();
            Assertions.assertEquals("-cp", command.get(1));
            Assertions.assertEquals(Main.class.getName(), command.get(3));
            Assertions.assertEquals(List.of(
                    "--root", config.projectRoot().toString(),
                    "work", "T-7",
                    DetachManager.DETACH_CHILD_FLAG,
                    "--log-file", expectedLog.toString(),
                    "--parallel", "4",
                    "--dry-run"
            ), command.subList(4, command.size()));

            DetachParams all = manager.buildDetachParams(null, "custom/run.log", NOW);
            Assertions.assertEquals(config.projectRoot().resolve("custom/run.log"), all.logPath());
            Assertions.assertFalse(all.command().contains("--parallel"));
            Assertions.assertEquals("work", all.command().get(6));
            Assertions.assertEquals(DetachManager.DETACH_CHILD_FLAG, all.command().get(7));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void dedicatedDetachDirectoryWinsOverLogsDir() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-detach-dir-");
        try {
            TicketFlowConfig config = TicketFlowConfig.fromRoot(root.toString())
                    .withPaths(null, null, Paths.get("bg-logs"), null);
            DetachManager manager = new DetachManager(config, new RecordingLauncher(), pid -> false);

            DetachParams params = manager.buildDetachParams(null, null, NOW);

            Assertions.assertEquals(root.toAbsolutePath().normalize().resolve("bg-logs").resolve("work-20260304-050607.log"),
                    params.logPath());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void spawnCreatesLogDirectoryAndDelegatesToLauncher() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-detach-spawn-");
        try {
            TicketFlowConfig config = TicketFlowConfig.fromRoot(root.toString());
            RecordingLauncher launcher = new RecordingLauncher();
            DetachManager manager = new DetachManager(config, launcher, pid -> false);
            DetachParams params = manager.buildDetachParams(null, null, NOW);

            long pid = manager.spawn(params);

            Assertions.assertEquals(RecordingLauncher.FAKE_PID, pid);
            Assertions.assertEquals(params.command(), launcher.launched.get(0));
            Assertions.assertTrue(Files.isDirectory(params.logPath().getParent()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void childSessionOwnsPidFileUntilClosed() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-detach-child-");
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        try {
            TicketFlowConfig config = TicketFlowConfig.fromRoot(root.toString());
            DetachManager manager = new DetachManager(config, new RecordingLauncher(), ProcessLiveness.system());
            Path logPath = root.resolve("logs").resolve("child.log");

            try (DetachManager.ChildSession ignored = manager.beginChild(logPath, new CancellationToken())) {
                System.out.println("hello from child");
                Assertions.assertEquals(ProcessHandle.current().pid(), manager.pidFile().read().orElseThrow());
            }

            Assertions.assertFalse(Files.exists(config.workPidFilePath()));
            Assertions.assertTrue(Files.readString(logPath).contains("hello from child"));
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
            deleteRecursively(root);
        }
    }

    private static final class RecordingLauncher implements DetachLauncher {
        static final long FAKE_PID = 123_456L;
        final List<List<String>> launched = new ArrayList<>();

        @Override
        public long launch(List<String> command) {
            launched.add(command);
            return FAKE_PID;
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
