package io.ticketflow.cli;

import io.ticketflow.agent.Agent;
import io.ticketflow.agent.Agents;
import io.ticketflow.agent.CancellationToken;
import io.ticketflow.config.TicketFlowConfig;
import io.ticketflow.detach.BackgroundStatus;
import io.ticketflow.detach.DetachManager;
import io.ticketflow.detach.DetachParams;
import io.ticketflow.model.Ticket;
import io.ticketflow.model.TicketStatus;
import io.ticketflow.model.TicketType;
import io.ticketflow.observability.RunJournal;
import io.ticketflow.resolve.DependencyResolver;
import io.ticketflow.resolve.ResolverContext;
import io.ticketflow.runtime.WorkScheduler;
import io.ticketflow.runtime.WorkSummary;
import io.ticketflow.storage.TicketStore;
import io.ticketflow.util.Jsons;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;

@Command(
        name = "ticketflow",
        mixinStandardHelpOptions = true,
        description = "Dependency-aware ticket runner for command-line coding agents",
        subcommands = {
                TicketFlowCommand.InitCommand.class,
                TicketFlowCommand.AddCommand.class,
                TicketFlowCommand.ImportCommand.class,
                TicketFlowCommand.WorkCommand.class,
                TicketFlowCommand.RetryCommand.class,
                TicketFlowCommand.StatusCommand.class,
                TicketFlowCommand.ShowCommand.class,
                TicketFlowCommand.ListCommand.class,
                TicketFlowCommand.BlockedCommand.class,
                TicketFlowCommand.DropCommand.class,
                TicketFlowCommand.CleanCommand.class,
                TicketFlowCommand.JournalTailCommand.class,
                TicketFlowCommand.JournalVerifyCommand.class
        }
)
public final class TicketFlowCommand implements Runnable {
    @Option(names = {"--root"}, description = "Project root directory", defaultValue = ".")
    String root;

    Map<String, String> env = System.getenv();

    public static CommandLine newCommandLine() {
        return newCommandLine(new TicketFlowCommand());
    }

    static CommandLine newCommandLine(TicketFlowCommand command) {
        return new CommandLine(command).setExecutionExceptionHandler(new CliExceptionHandler());
    }

    @Override
    public void run() {
        System.out.println("Use subcommands: init | add | import | work | retry | status | show | list | blocked | drop | clean | journal-tail | journal-verify");
    }

    TicketFlowConfig config() {
        TicketFlowConfig config = TicketFlowConfig.load(root, env);
        config.validate();
        return config;
    }

    TicketStore openStore(TicketFlowConfig config) {
        TicketStore store = new TicketStore(config);
        store.init();
        return store;
    }

    /**
     * Store-mutating commands refuse to run next to a live background work process.
     */
    static void refuseWhileBackgroundRunActive(TicketFlowConfig config) {
        DetachManager.forConfig(config).ensureNoBackgroundRun();
    }

    @Command(name = "init", description = "Create the ticket directories and a default ticketflow.json")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            parent.openStore(config);
            config.writeDefaultSettings();
            System.out.println(Jsons.toJson(new InitOutcome(
                    config.projectRoot().toString(),
                    config.ticketsDir().toString(),
                    config.settingsFile().toString()
            )));
            return ExitCodes.OK;
        }
    }

    @Command(name = "add", description = "Add a pending ticket")
    static final class AddCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Option(names = {"--id"}, required = true, description = "Ticket id")
        String id;

        @Option(names = {"--title"}, required = true, description = "Ticket title")
        String title;

        @Option(names = {"--description"}, defaultValue = "", description = "Ticket description")
        String description;

        @Option(names = {"--priority"}, defaultValue = "5", description = "Priority, lower runs first")
        int priority;

        @Option(names = {"--type"}, defaultValue = "feature",
                description = "feature|test|refactor|docs|bugfix|performance|security")
        String type;

        @Option(names = {"--depends-on"}, split = ",", description = "Comma-separated ticket ids")
        List<String> dependsOn;

        @Option(names = {"--acceptance"}, description = "Acceptance criterion (repeatable)")
        List<String> acceptance;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            refuseWhileBackgroundRunActive(config);
            TicketStore store = parent.openStore(config);
            if (store.exists(id)) {
                System.out.println(Jsons.toJson(Map.of("error", "ticket already exists: " + id)));
                return ExitCodes.ALREADY_EXISTS;
            }
            Ticket ticket = Ticket.create(id, title, description);
            ticket.setPriority(priority);
            ticket.setType(TicketType.fromString(type));
            if (dependsOn != null) {
                ticket.setDependencies(dependsOn.stream().map(String::trim).filter(s -> !s.isEmpty()).toList());
            }
            if (acceptance != null) {
                ticket.setAcceptanceCriteria(acceptance);
            }
            store.save(ticket);
            System.out.println(Jsons.toJson(ticket));
            return ExitCodes.OK;
        }
    }

    @Command(name = "import", description = "Import tickets from a {\"tickets\": [...]} JSON file")
    static final class ImportCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Option(names = {"--file"}, required = true, description = "Ticket list JSON file")
        String file;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            refuseWhileBackgroundRunActive(config);
            TicketStore store = parent.openStore(config);
            Path source = config.projectRoot().resolve(Paths.get(file));
            List<Ticket> tickets = store.loadGeneratedTickets(source);
            for (Ticket ticket : tickets) {
                ticket.applyImportDefaults();
                ticket.validate();
            }

            DependencyResolver resolver = new DependencyResolver(store);
            List<Ticket> known = new ArrayList<>(store.loadAll().tickets());
            Set<String> importedIds = new HashSet<>();
            for (Ticket ticket : tickets) {
                importedIds.add(ticket.id());
            }
            known.removeIf(existing -> importedIds.contains(existing.id()));
            known.addAll(tickets);

            List<String> warnings = new ArrayList<>();
            resolver.findUnknownDependencies(known).forEach((ticketId, missing) ->
                    warnings.add("ticket " + ticketId + " depends on unknown ticket(s) " + missing));
            List<String> cyclic = resolver.findUnorderable(known);
            if (!cyclic.isEmpty()) {
                warnings.add("circular dependency among " + cyclic);
            }

            List<String> saved = new ArrayList<>();
            for (Ticket ticket : tickets) {
                store.save(ticket);
                saved.add(ticket.id());
            }
            System.out.println(Jsons.toJson(new ImportOutcome(saved.size(), saved, warnings)));
            return ExitCodes.OK;
        }
    }

    @Command(name = "work", description = "Process pending tickets (or one ticket) through the agent")
    static final class WorkCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Parameters(index = "0", arity = "0..1", description = "Process only this ticket, ignoring dependencies")
        String ticketId;

        @Option(names = {"--parallel"}, defaultValue = "0", description = "Worker count; 0 uses max_parallel")
        int parallel;

        @Option(names = {"--detach"}, defaultValue = "false", description = "Run in the background and return")
        boolean detach;

        @Option(names = {"--log-file"}, description = "Log file for a detached run")
        String logFile;

        @Option(names = {"--dry-run"}, defaultValue = "false", description = "Skip agent calls")
        boolean dryRun;

        @Option(names = {DetachManager.DETACH_CHILD_FLAG}, hidden = true, defaultValue = "false")
        boolean detachChild;

        @Override
        public Integer call() throws Exception {
            TicketFlowConfig config = parent.config();
            if (parallel > 0) {
                config = config.withMaxParallel(parallel);
            }
            if (dryRun) {
                config = config.withDryRun(true);
            }
            config.validate();
            DetachManager detachManager = DetachManager.forConfig(config);
            if (!detachChild) {
                detachManager.ensureNoBackgroundRun();
            }

            if (detach && !detachChild) {
                DetachParams params = detachManager.buildDetachParams(ticketId, logFile, parallel, dryRun, Instant.now());
                long pid = detachManager.spawn(params);
                System.out.println(Jsons.toJson(new DetachOutcome(pid, params.logPath().toString())));
                return ExitCodes.OK;
            }

            CancellationToken token = new CancellationToken();
            if (detachChild) {
                // Output goes to the log before anything else can fail.
                Path logPath = config.detachLogPath(logFile, Instant.now());
                try (DetachManager.ChildSession ignored = detachManager.beginChild(logPath, token)) {
                    return runWork(config, parent.openStore(config), Agents.create(config), token);
                }
            }
            TicketStore store = parent.openStore(config);
            Agent agent = Agents.create(config);
            Thread hook = new Thread(() -> token.cancel("interrupt signal"), "ticketflow-shutdown-hook");
            Runtime.getRuntime().addShutdownHook(hook);
            try {
                return runWork(config, store, agent, token);
            } finally {
                try {
                    Runtime.getRuntime().removeShutdownHook(hook);
                } catch (IllegalStateException shuttingDown) {
                    System.err.println("shutdown in progress: " + token.reason());
                }
            }
        }

        private int runWork(TicketFlowConfig config, TicketStore store, Agent agent, CancellationToken token) {
            RunJournal journal = new RunJournal(config.journalFile(), UUID.randomUUID().toString());
            WorkScheduler scheduler = new WorkScheduler(config, store, new DependencyResolver(store), agent, journal);
            WorkSummary summary = ticketId == null || ticketId.isBlank()
                    ? scheduler.runAll(config.maxParallel(), token)
                    : scheduler.runSingle(ticketId.trim(), token);
            System.out.println(Jsons.toJson(summary));
            return ExitCodes.OK;
        }
    }

    @Command(name = "retry", description = "Move every failed ticket back to pending")
    static final class RetryCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            refuseWhileBackgroundRunActive(config);
            int moved = parent.openStore(config).moveFailed();
            System.out.println(Jsons.toJson(Map.of("moved", moved)));
            return ExitCodes.OK;
        }
    }

    @Command(name = "status", description = "Ticket counts per status and background work state")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            TicketStore store = parent.openStore(config);
            Map<String, Integer> counts = new LinkedHashMap<>();
            int total = 0;
            for (Map.Entry<TicketStatus, Integer> entry : store.count().entrySet()) {
                counts.put(entry.getKey().dirName(), entry.getValue());
                total += entry.getValue();
            }
            BackgroundStatus background = DetachManager.forConfig(config).backgroundStatus();
            System.out.println(Jsons.toJson(new StatusOutcome(counts, total, background)));
            return ExitCodes.OK;
        }
    }

    @Command(name = "show", description = "Show one ticket")
    static final class ShowCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Parameters(index = "0", description = "Ticket id")
        String ticketId;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            Optional<Ticket> ticket = parent.openStore(config).find(ticketId);
            if (ticket.isEmpty()) {
                System.out.println(Jsons.toJson(Map.of("error", "ticket not found: " + ticketId)));
                return ExitCodes.NOT_FOUND;
            }
            System.out.println(Jsons.toJson(ticket.get()));
            return ExitCodes.OK;
        }
    }

    @Command(name = "list", description = "List tickets, optionally for one status")
    static final class ListCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Option(names = {"--status"}, description = "pending|in_progress|completed|failed")
        String status;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            TicketStore store = parent.openStore(config);
            List<Ticket> tickets = status == null || status.isBlank()
                    ? store.loadAll().tickets()
                    : store.loadByStatus(TicketStatus.fromString(status));
            List<TicketRow> rows = new ArrayList<>(tickets.size());
            for (Ticket ticket : tickets) {
                rows.add(TicketRow.of(ticket));
            }
            System.out.println(Jsons.toJson(rows));
            return ExitCodes.OK;
        }
    }

    @Command(name = "blocked", description = "Pending tickets waiting on incomplete dependencies")
    static final class BlockedCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            DependencyResolver resolver = new DependencyResolver(parent.openStore(config));
            ResolverContext ctx = resolver.snapshot();
            List<BlockedRow> rows = new ArrayList<>();
            for (Ticket ticket : resolver.getBlocked(ctx)) {
                rows.add(new BlockedRow(ticket.id(), ticket.title(), resolver.getMissingDependencies(ticket, ctx)));
            }
            System.out.println(Jsons.toJson(rows));
            return ExitCodes.OK;
        }
    }

    @Command(name = "drop", description = "Delete a ticket")
    static final class DropCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Parameters(index = "0", description = "Ticket id")
        String ticketId;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            refuseWhileBackgroundRunActive(config);
            parent.openStore(config).delete(ticketId);
            System.out.println(Jsons.toJson(Map.of("dropped", ticketId)));
            return ExitCodes.OK;
        }
    }

    @Command(name = "clean", description = "Remove the whole tickets directory")
    static final class CleanCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            refuseWhileBackgroundRunActive(config);
            new TicketStore(config).clean();
            System.out.println(Jsons.toJson(Map.of("cleaned", config.ticketsDir().toString())));
            return ExitCodes.OK;
        }
    }

    @Command(name = "journal-tail", description = "Show the latest work journal rows")
    static final class JournalTailCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Number of rows")
        int limit;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            RunJournal journal = new RunJournal(config.journalFile(), "cli");
            System.out.println(Jsons.toJson(journal.tail(limit)));
            return ExitCodes.OK;
        }
    }

    @Command(name = "journal-verify", description = "Verify the work journal hash chain")
    static final class JournalVerifyCommand implements Callable<Integer> {
        @ParentCommand
        TicketFlowCommand parent;

        @Override
        public Integer call() {
            TicketFlowConfig config = parent.config();
            RunJournal.VerifyOutcome outcome = new RunJournal(config.journalFile(), "cli").verify();
            System.out.println(Jsons.toJson(outcome));
            return outcome.valid() ? ExitCodes.OK : 1;
        }
    }

    record InitOutcome(String root, String ticketsDir, String settingsFile) {
    }

    record ImportOutcome(int imported, List<String> ids, List<String> warnings) {
    }

    record DetachOutcome(long pid, String logFile) {
    }

    record StatusOutcome(Map<String, Integer> counts, int total, BackgroundStatus background) {
    }

    record BlockedRow(String id, String title, List<String> missing) {
    }

    record TicketRow(String id, String title, String status, int priority, List<String> dependencies) {
        static TicketRow of(Ticket ticket) {
            return new TicketRow(ticket.id(), ticket.title(), ticket.status().dirName(), ticket.priority(),
                    ticket.dependencies());
        }
    }
}
