package io.ticketflow.runtime;

import io.ticketflow.agent.Agent;
import io.ticketflow.agent.AgentContext;
import io.ticketflow.agent.AgentResult;
import io.ticketflow.agent.CancellationToken;
import io.ticketflow.config.TicketFlowConfig;
import io.ticketflow.error.StoreIOException;
import io.ticketflow.error.TicketFlowException;
import io.ticketflow.model.Ticket;
import io.ticketflow.model.TicketStatus;
import io.ticketflow.observability.RunJournal;
import io.ticketflow.observability.RunJournal.JournalEvent;
import io.ticketflow.resolve.DependencyResolver;
import io.ticketflow.resolve.ResolverContext;
import io.ticketflow.storage.TicketStore;
import io.ticketflow.util.Texts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives pending tickets through the agent in dependency waves.
 *
 * <p>Each iteration takes a fresh completed-set snapshot, dispatches every processable ticket
 * onto a bounded pool and waits for the whole wave before looking again. Tickets completed in
 * one wave unlock their dependents in the next. Cancellation stops new dispatches; work that
 * already started runs to completion and is persisted.
 */
public final class WorkScheduler {
    private static final Logger log = LoggerFactory.getLogger(WorkScheduler.class);

    private final TicketFlowConfig config;
    private final TicketStore store;
    private final DependencyResolver resolver;
    private final Agent agent;
    private final RunJournal journal;

    public WorkScheduler(
            TicketFlowConfig config,
            TicketStore store,
            DependencyResolver resolver,
            Agent agent,
            RunJournal journal
    ) {
        this.config = config;
        this.store = store;
        this.resolver = resolver;
        this.agent = agent;
        this.journal = journal;
    }

    public WorkSummary runAll(int parallelism, CancellationToken token) {
        int workers = parallelism > 0 ? parallelism : config.maxParallel();
        CancellationToken cancellation = token == null ? CancellationToken.none() : token;
        WorkSummary.Tally tally = new WorkSummary.Tally();
        record("run_start", "", "ok", Map.of("parallelism", workers, "agent", agent.id()));
        log.info("work loop starting: parallelism={} agent={}", workers, agent.id());

        boolean drained = false;
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads());
        Semaphore admission = new Semaphore(workers);
        try {
            while (tally.iterations() < config.maxIterations()) {
                if (cancellation.isCancelled()) {
                    tally.cancelled();
                    break;
                }
                ResolverContext ctx = resolver.snapshot();
                List<Ticket> processable = resolver.getProcessable(ctx);
                if (processable.isEmpty()) {
                    drained = true;
                    reportRemaining(ctx, tally);
                    break;
                }
                tally.iteration();
                log.info("iteration {}: {} processable ticket(s)", tally.iterations(), processable.size());
                runWave(processable, pool, admission, cancellation, tally);
            }
        } finally {
            pool.shutdown();
            awaitPool(pool);
        }

        if (!drained && !cancellation.isCancelled() && store.countByStatus(TicketStatus.PENDING) > 0) {
            tally.capReached();
            log.warn("iteration cap {} reached with pending tickets left", config.maxIterations());
            reportRemaining(resolver.snapshot(), tally);
        }
        if (cancellation.isCancelled()) {
            tally.cancelled();
            if (!drained) {
                reportRemaining(resolver.snapshot(), tally);
            }
        }
        WorkSummary summary = tally.build();
        record("run_end", "", summary.cancelled() ? "cancelled" : "ok", Map.of(
                "completed", summary.completed().size(),
                "failed", summary.failed().size(),
                "skipped", summary.skipped().size(),
                "iterations", summary.iterations()
        ));
        log.info("work loop finished: completed={} failed={} skipped={} iterations={}",
                summary.completed().size(), summary.failed().size(), summary.skipped().size(), summary.iterations());
        return summary;
    }

    /**
     * Processes one ticket regardless of its dependencies. Only pending tickets are eligible.
     */
    public WorkSummary runSingle(String ticketId, CancellationToken token) {
        CancellationToken cancellation = token == null ? CancellationToken.none() : token;
        Ticket ticket = store.load(ticketId);
        WorkSummary.Tally tally = new WorkSummary.Tally();
        if (ticket.status() != TicketStatus.PENDING) {
            log.warn("ticket {} is {} and cannot be processed", ticketId, ticket.status());
            tally.reject(new TicketOutcome(ticketId, ticket.status(), "not pending: " + ticket.status(), "", 0L));
            return tally.build();
        }
        if (cancellation.isCancelled()) {
            tally.cancelled();
            return tally.build();
        }
        tally.iteration();
        tally.add(processTicket(ticket, cancellation));
        return tally.build();
    }

    /**
     * Moves the ticket through in_progress to completed or failed, persisting each step.
     * Agent failures of any kind end up on the ticket; store failures propagate.
     */
    public TicketOutcome processTicket(Ticket ticket, CancellationToken token) {
        long started = System.nanoTime();
        ticket.markInProgress();
        store.save(ticket);
        record("ticket_start", ticket.id(), "ok", Map.of("title", ticket.title()));
        log.info("processing {}", ticket.summary());

        AgentResult result;
        try {
            result = agent.execute(new AgentContext(ticket, token,
                    Duration.ofSeconds(config.agentTimeoutSeconds()), runId()));
            if (result == null) {
                result = AgentResult.fail("agent returned no result");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = AgentResult.fail("interrupted");
        } catch (StoreIOException e) {
            throw e;
        } catch (Exception e) {
            log.warn("agent {} threw on ticket {}", agent.id(), ticket.id(), e);
            result = AgentResult.fail(e.getClass().getSimpleName() + ": " + Texts.nullToEmpty(e.getMessage()));
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        if (result.success()) {
            ticket.markCompleted(Texts.truncate(result.output(), config.maxOutputChars()));
            store.save(ticket);
            record("ticket_completed", ticket.id(), "ok", details(durationMs, result.logPath(), ""));
            log.info("completed {} in {} ms", ticket.id(), durationMs);
            return new TicketOutcome(ticket.id(), TicketStatus.COMPLETED, "", Texts.nullToEmpty(result.logPath()), durationMs);
        }
        ticket.markFailed(result.error(), result.logPath());
        store.save(ticket);
        record("ticket_failed", ticket.id(), "failed", details(durationMs, result.logPath(), ticket.error()));
        log.warn("failed {} in {} ms: {}", ticket.id(), durationMs, Texts.singleLine(ticket.error(), 200));
        return new TicketOutcome(ticket.id(), TicketStatus.FAILED, ticket.error(), ticket.errorLog(), durationMs);
    }

    private void runWave(
            List<Ticket> wave,
            ExecutorService pool,
            Semaphore admission,
            CancellationToken cancellation,
            WorkSummary.Tally tally
    ) {
        List<Future<TicketOutcome>> futures = new ArrayList<>(wave.size());
        for (Ticket ticket : wave) {
            // The permit is taken here so a queued ticket never starts after cancellation.
            boolean admitted = false;
            try {
                admission.acquire();
                admitted = true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel("interrupted");
            }
            if (cancellation.isCancelled()) {
                if (admitted) {
                    admission.release();
                }
                log.info("cancellation requested, not dispatching {}", ticket.id());
                tally.cancelled();
                break;
            }
            try {
                futures.add(pool.submit(() -> {
                    try {
                        return processTicket(ticket, cancellation);
                    } finally {
                        admission.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                admission.release();
                throw e;
            }
        }
        RuntimeException fatal = null;
        for (Future<TicketOutcome> future : futures) {
            try {
                tally.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                cancellation.cancel("interrupted");
                tally.cancelled();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (fatal == null) {
                    fatal = cause instanceof RuntimeException re ? re
                            : new TicketFlowException("work", String.valueOf(cause), TicketFlowException.Severity.FATAL, cause);
                }
            }
        }
        if (fatal != null) {
            throw fatal;
        }
    }

    private void reportRemaining(ResolverContext ctx, WorkSummary.Tally tally) {
        for (Ticket pending : store.loadByStatus(TicketStatus.PENDING)) {
            List<String> missing = resolver.getMissingDependencies(pending, ctx);
            tally.skip(pending.id(), missing);
            if (!missing.isEmpty()) {
                log.info("ticket {} blocked on {}", pending.id(), missing);
            }
        }
    }

    private void record(String action, String ticketId, String result, Map<String, Object> details) {
        if (journal != null) {
            journal.record(JournalEvent.of(action, ticketId, result, details));
        }
    }

    private static Map<String, Object> details(long durationMs, String logPath, String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("duration_ms", durationMs);
        if (!Texts.isBlank(logPath)) {
            details.put("log", logPath);
        }
        if (!Texts.isBlank(error)) {
            details.put("error", Texts.singleLine(error, 200));
        }
        return details;
    }

    private String runId() {
        return journal == null ? UUID.randomUUID().toString() : journal.runId();
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "ticketflow-worker-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void awaitPool(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("worker pool did not terminate within 30s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
