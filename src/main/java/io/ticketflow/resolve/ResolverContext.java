package io.ticketflow.resolve;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time set of completed ticket ids. It may lag behind concurrent completions; the
 * work loop takes a fresh one at the start of every iteration.
 */
public record ResolverContext(Set<String> completedIds, Instant takenAt) {
    public ResolverContext {
        completedIds = Set.copyOf(completedIds);
        takenAt = takenAt == null ? Instant.now() : takenAt;
    }

    public static ResolverContext of(Set<String> completedIds) {
        return new ResolverContext(completedIds, Instant.now());
    }

    public boolean isCompleted(String ticketId) {
        return completedIds.contains(ticketId);
    }
}
