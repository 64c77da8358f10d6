package io.ticketflow.resolve;

import io.ticketflow.config.TicketFlowConfig;
import io.ticketflow.error.CircularDependencyException;
import io.ticketflow.error.UnknownDependencyException;
import io.ticketflow.model.Ticket;
import io.ticketflow.model.TicketStatus;
import io.ticketflow.storage.TicketStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class DependencyResolverTest {

    @Test
    void chainUnlocksOneTicketAtATime() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-resolver-chain-");
        try {
            TicketStore store = new TicketStore(TicketFlowConfig.fromRoot(root.toString()));
            store.init();
            DependencyResolver resolver = new DependencyResolver(store);
            store.save(ticket("A"));
            store.save(ticket("B", "A"));
            store.save(ticket("C", "B"));

            ResolverContext ctx = resolver.snapshot();
            Assertions.assertEquals(List.of("A"), ids(resolver.getProcessable(ctx)));
            Assertions.assertEquals(List.of("B", "C"), ids(resolver.getBlocked(ctx)));

            complete(store, "A");
            ctx = resolver.snapshot();
            Assertions.assertEquals(List.of("B"), ids(resolver.getProcessable(ctx)));
            Assertions.assertEquals(List.of("B"), resolver.getMissingDependencies(store.load("C"), ctx));

            complete(store, "B");
            Assertions.assertEquals(List.of("C"), ids(resolver.getProcessable(resolver.snapshot())));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void storedCycleNeverBecomesProcessable() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-resolver-stored-cycle-");
        try {
            TicketStore store = new TicketStore(TicketFlowConfig.fromRoot(root.toString()));
            store.init();
            DependencyResolver resolver = new DependencyResolver(store);
            store.save(ticket("A", "C"));
            store.save(ticket("B", "A"));
            store.save(ticket("C", "B"));

            for (int round = 0; round < 3; round++) {
                ResolverContext ctx = resolver.snapshot();
                Assertions.assertEquals(List.of(), resolver.getProcessable(ctx));
                Assertions.assertEquals(List.of("A", "B", "C"), ids(resolver.getBlocked(ctx)));
            }
            Assertions.assertTrue(resolver.hasCircularDependency(store.loadByStatus(TicketStatus.PENDING)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void canProcessRequiresEveryDependencyCompleted() {
        DependencyResolver resolver = new DependencyResolver(null);
        Ticket ticket = ticket("X", "A", "B", "A");
        ResolverContext partial = ResolverContext.of(Set.of("A"));

        Assertions.assertFalse(resolver.canProcess(ticket, partial));
        Assertions.assertEquals(List.of("B"), resolver.getMissingDependencies(ticket, partial));
        Assertions.assertTrue(resolver.canProcess(ticket, ResolverContext.of(Set.of("A", "B"))));
        Assertions.assertTrue(resolver.canProcess(ticket("Y"), ResolverContext.of(Set.of())));
    }

    @Test
    void sortPlacesDependenciesFirstAndKeepsInputOrderOnTies() {
        DependencyResolver resolver = new DependencyResolver(null);
        List<Ticket> input = List.of(ticket("C", "B"), ticket("D"), ticket("B", "A"), ticket("A"), ticket("E", "A", "A"));

        List<String> sorted = ids(resolver.sortByDependency(input));

        Assertions.assertEquals(List.of("D", "A", "B", "E", "C"), sorted);
        Assertions.assertFalse(resolver.hasCircularDependency(input));
        for (Ticket ticket : input) {
            for (String dependency : ticket.dependencies()) {
                Assertions.assertTrue(sorted.indexOf(dependency) < sorted.indexOf(ticket.id()));
            }
        }
    }

    @Test
    void cycleIsDetectedAndMembersReported() {
        DependencyResolver resolver = new DependencyResolver(null);
        List<Ticket> input = List.of(ticket("A", "C"), ticket("B", "A"), ticket("C", "B"), ticket("D"), ticket("E", "A"));

        Assertions.assertTrue(resolver.hasCircularDependency(input));
        Assertions.assertEquals(List.of("D"), ids(resolver.sortByDependency(input)));
        Assertions.assertEquals(List.of("A", "B", "C", "E"), resolver.findUnorderable(input));
        CircularDependencyException error = Assertions.assertThrows(CircularDependencyException.class,
                () -> resolver.checkNoCycles(input));
        Assertions.assertTrue(error.getMessage().contains("A"));
    }

    @Test
    void selfDependencyIsACycle() {
        DependencyResolver resolver = new DependencyResolver(null);

        Assertions.assertTrue(resolver.hasCircularDependency(List.of(ticket("A", "A"))));
    }

    @Test
    void outOfSetDependenciesAreIgnoredBySortButReportedAsUnknown() {
        DependencyResolver resolver = new DependencyResolver(null);
        List<Ticket> input = List.of(ticket("B", "EXTERNAL"), ticket("A"));

        Assertions.assertEquals(List.of("B", "A"), ids(resolver.sortByDependency(input)));
        Assertions.assertFalse(resolver.hasCircularDependency(input));
        Assertions.assertEquals(Map.of("B", List.of("EXTERNAL")), resolver.findUnknownDependencies(input));
        UnknownDependencyException error = Assertions.assertThrows(UnknownDependencyException.class,
                () -> resolver.validateDependencies(input));
        Assertions.assertTrue(error.getMessage().contains("EXTERNAL"));
        Assertions.assertFalse(resolver.canProcess(input.get(0), ResolverContext.of(Set.of("A"))));
    }

    private static Ticket ticket(String id, String... dependencies) {
        Ticket ticket = Ticket.create(id, "Ticket " + id, "");
        ticket.setDependencies(List.of(dependencies));
        return ticket;
    }

    private static void complete(TicketStore store, String id) {
        Ticket ticket = store.load(id);
        ticket.markInProgress();
        ticket.markCompleted("done");
        store.save(ticket);
    }

    private static List<String> ids(List<Ticket> tickets) {
        return tickets.stream().map(Ticket::id).toList();
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
