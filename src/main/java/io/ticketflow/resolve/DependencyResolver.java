package io.ticketflow.resolve;

import io.ticketflow.error.CircularDependencyException;
import io.ticketflow.error.UnknownDependencyException;
import io.ticketflow.model.Ticket;
import io.ticketflow.model.TicketStatus;
import io.ticketflow.storage.TicketStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers "can this ticket run now" against a {@link ResolverContext}, and orders ticket sets
 * by their dependency edges.
 *
 * <p>Ordering and cycle detection only honour edges whose source is inside the given set; a
 * dependency on an id outside the set is ignored there. {@link #canProcess} is stricter: every
 * dependency id must be in the completed snapshot.
 */
public final class DependencyResolver {
    private final TicketStore store;

    public DependencyResolver(TicketStore store) {
        this.store = store;
    }

    public ResolverContext snapshot() {
        Set<String> completed = new HashSet<>();
        for (Ticket ticket : store.loadByStatus(TicketStatus.COMPLETED)) {
            completed.add(ticket.id());
        }
        return ResolverContext.of(completed);
    }

    public boolean canProcess(Ticket ticket, ResolverContext ctx) {
        for (String dependency : ticket.dependencies()) {
            if (!ctx.isCompleted(dependency)) {
                return false;
            }
        }
        return true;
    }

    public List<Ticket> getProcessable(ResolverContext ctx) {
        List<Ticket> processable = new ArrayList<>();
        for (Ticket ticket : store.loadByStatus(TicketStatus.PENDING)) {
            if (canProcess(ticket, ctx)) {
                processable.add(ticket);
            }
        }
        return processable;
    }

    public List<Ticket> getBlocked(ResolverContext ctx) {
        List<Ticket> blocked = new ArrayList<>();
        for (Ticket ticket : store.loadByStatus(TicketStatus.PENDING)) {
            if (!canProcess(ticket, ctx)) {
                blocked.add(ticket);
            }
        }
        return blocked;
    }

    public List<String> getMissingDependencies(Ticket ticket, ResolverContext ctx) {
        Set<String> missing = new LinkedHashSet<>();
        for (String dependency : ticket.dependencies()) {
            if (!ctx.isCompleted(dependency)) {
                missing.add(dependency);
            }
        }
        return List.copyOf(missing);
    }

    /**
     * Fails on the first dependency that names a ticket outside {@code tickets}.
     */
    public void validateDependencies(List<Ticket> tickets) {
        Set<String> ids = new HashSet<>();
        for (Ticket ticket : tickets) {
            ids.add(ticket.id());
        }
        for (Ticket ticket : tickets) {
            for (String dependency : ticket.dependencies()) {
                if (!ids.contains(dependency)) {
                    throw new UnknownDependencyException(ticket.id(), dependency);
                }
            }
        }
    }

    /**
     * Every dependency id not present in {@code tickets}, keyed by the ticket that names it.
     */
    public Map<String, List<String>> findUnknownDependencies(List<Ticket> tickets) {
        Set<String> ids = new HashSet<>();
        for (Ticket ticket : tickets) {
            ids.add(ticket.id());
        }
        Map<String, List<String>> unknown = new LinkedHashMap<>();
        for (Ticket ticket : tickets) {
            Set<String> missing = new LinkedHashSet<>();
            for (String dependency : ticket.dependencies()) {
                if (!ids.contains(dependency)) {
                    missing.add(dependency);
                }
            }
            if (!missing.isEmpty()) {
                unknown.put(ticket.id(), List.copyOf(missing));
            }
        }
        return unknown;
    }

    /**
     * Kahn's algorithm over in-set edges. Tickets with equal readiness keep their input order.
     * Members of a cycle, and anything downstream of one, are left out of the result.
     */
    public List<Ticket> sortByDependency(List<Ticket> tickets) {
        Map<String, Ticket> byId = new LinkedHashMap<>();
        for (Ticket ticket : tickets) {
            byId.putIfAbsent(ticket.id(), ticket);
        }
        Map<String, List<String>> dependents = new LinkedHashMap<>();
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : byId.keySet()) {
            dependents.put(id, new ArrayList<>());
            inDegree.put(id, 0);
        }
        for (Ticket ticket : byId.values()) {
            for (String dependency : new LinkedHashSet<>(ticket.dependencies())) {
                if (dependents.containsKey(dependency)) {
                    dependents.get(dependency).add(ticket.id());
                    inDegree.merge(ticket.id(), 1, Integer::sum);
                }
            }
        }

        Deque<String> queue = new ArrayDeque<>();
        for (Map.Entry<String, Integer> entry : inDegree.entrySet()) {
            if (entry.getValue() == 0) {
                queue.add(entry.getKey());
            }
        }
        List<Ticket> sorted = new ArrayList<>(byId.size());
        while (!queue.isEmpty()) {
            String id = queue.poll();
            sorted.add(byId.get(id));
            for (String dependent : dependents.get(id)) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    queue.add(dependent);
                }
            }
        }
        return sorted;
    }

    public boolean hasCircularDependency(List<Ticket> tickets) {
        return sortByDependency(tickets).size() < distinctIds(tickets).size();
    }

    /**
     * Ids that never reach in-degree zero: cycle members plus tickets that depend on them.
     */
    public List<String> findUnorderable(List<Ticket> tickets) {
        Set<String> ordered = new HashSet<>();
        for (Ticket ticket : sortByDependency(tickets)) {
            ordered.add(ticket.id());
        }
        List<String> left = new ArrayList<>();
        for (String id : distinctIds(tickets)) {
            if (!ordered.contains(id)) {
                left.add(id);
            }
        }
        return left;
    }

    public void checkNoCycles(List<Ticket> tickets) {
        List<String> unorderable = findUnorderable(tickets);
        if (!unorderable.isEmpty()) {
            throw new CircularDependencyException(unorderable);
        }
    }

    private static Set<String> distinctIds(List<Ticket> tickets) {
        Set<String> ids = new LinkedHashSet<>();
        for (Ticket ticket : tickets) {
            ids.add(ticket.id());
        }
        return ids;
    }
}
