package io.ticketflow.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record WorkSummary(
        List<String> completed,
        List<String> failed,
        List<String> skipped,
        Map<String, List<String>> blocked,
        int iterations,
        boolean cancelled,
        boolean iterationCapReached,
        List<TicketOutcome> outcomes
) {
    public WorkSummary {
        completed = List.copyOf(completed);
        failed = List.copyOf(failed);
        skipped = List.copyOf(skipped);
        blocked = Collections.unmodifiableMap(new LinkedHashMap<>(blocked));
        outcomes = List.copyOf(outcomes);
    }

    public int processed() {
        return completed.size() + failed.size();
    }

    /**
     * Mutable accumulator used while a run is in flight. Outcomes arrive from worker threads.
     */
    static final class Tally {
        private final List<String> completed = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
        private final Map<String, List<String>> blocked = new LinkedHashMap<>();
        private final List<TicketOutcome> outcomes = new ArrayList<>();
        private int iterations;
        private boolean cancelled;
        private boolean iterationCapReached;

        synchronized void add(TicketOutcome outcome) {
            outcomes.add(outcome);
            switch (outcome.status()) {
                case COMPLETED -> completed.add(outcome.ticketId());
                case FAILED -> failed.add(outcome.ticketId());
                default -> skipped.add(outcome.ticketId());
            }
        }

        synchronized void reject(TicketOutcome outcome) {
            outcomes.add(outcome);
            skipped.add(outcome.ticketId());
        }

        synchronized void skip(String ticketId, List<String> missing) {
            skipped.add(ticketId);
            if (missing != null && !missing.isEmpty()) {
                blocked.put(ticketId, List.copyOf(missing));
            }
        }

        synchronized void iteration() {
            iterations++;
        }

        synchronized int iterations() {
            return iterations;
        }

        synchronized void cancelled() {
            cancelled = true;
        }

        synchronized void capReached() {
            iterationCapReached = true;
        }

        synchronized WorkSummary build() {
            return new WorkSummary(completed, failed, skipped, blocked, iterations, cancelled,
                    iterationCapReached, outcomes);
        }
    }
}
