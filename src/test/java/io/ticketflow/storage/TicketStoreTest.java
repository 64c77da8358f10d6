package io.ticketflow.storage;

import io.ticketflow.config.TicketFlowConfig;
import io.ticketflow.error.TicketNotFoundException;
import io.ticketflow.error.TicketValidationException;
import io.ticketflow.model.Ticket;
import io.ticketflow.model.TicketStatus;
import io.ticketflow.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class TicketStoreTest {

    @Test
    void ticketLivesInExactlyOneStatusDirectoryAfterEveryMove() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-single-");
        try {
            TicketStore store = newStore(root);
            Ticket ticket = Ticket.create("T-1", "Move me", "");
            store.save(ticket);
            assertSingleCopy(store, "T-1", TicketStatus.PENDING);

            ticket.markInProgress();
            store.save(ticket);
            assertSingleCopy(store, "T-1", TicketStatus.IN_PROGRESS);

            ticket.markFailed("boom", "");
            store.save(ticket);
            assertSingleCopy(store, "T-1", TicketStatus.FAILED);

            ticket.resetToPending();
            store.save(ticket);
            ticket.markInProgress();
            store.save(ticket);
            ticket.markCompleted("ok");
            store.save(ticket);
            assertSingleCopy(store, "T-1", TicketStatus.COMPLETED);

            Ticket loaded = store.load("T-1");
            Assertions.assertEquals(ticket, loaded);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void staleCacheEntryFallsBackToScan() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-stale-");
        try {
            TicketStore store = newStore(root);
            Ticket ticket = Ticket.create("T-1", "Cached", "");
            store.save(ticket);
            Assertions.assertEquals(store.ticketPath(TicketStatus.PENDING, "T-1"), store.cachedPath("T-1").orElseThrow());

            // Another process moved the file behind our back.
            Path movedTo = store.ticketPath(TicketStatus.FAILED, "T-1");
            Files.move(store.ticketPath(TicketStatus.PENDING, "T-1"), movedTo);

            Ticket loaded = store.load("T-1");
            Assertions.assertEquals("T-1", loaded.id());
            Assertions.assertEquals(movedTo, store.cachedPath("T-1").orElseThrow());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void duplicateCopiesAreRepairedKeepingNewest() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-dup-");
        try {
            TicketStore store = newStore(root);
            Ticket pending = Ticket.create("T-1", "Dup", "");
            Path oldCopy = store.ticketPath(TicketStatus.PENDING, "T-1");
            Files.writeString(oldCopy, Jsons.toJson(pending));

            pending.markInProgress();
            Path newCopy = store.ticketPath(TicketStatus.IN_PROGRESS, "T-1");
            Files.writeString(newCopy, Jsons.toJson(pending));
            Files.setLastModifiedTime(oldCopy, FileTime.fromMillis(System.currentTimeMillis() - 60_000L));

            TicketStore fresh = newStore(root);
            Ticket loaded = fresh.load("T-1");

            Assertions.assertEquals(TicketStatus.IN_PROGRESS, loaded.status());
            Assertions.assertFalse(Files.exists(oldCopy));
            Assertions.assertTrue(Files.exists(newCopy));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statusListingsPreferTheNewestCopyOfADuplicatedTicket() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-dup-listing-");
        try {
            TicketStore store = newStore(root);
            Ticket ticket = Ticket.create("X", "Crashed mid-move", "");
            ticket.markInProgress();
            ticket.markFailed("boom", "");
            Path staleFailed = store.ticketPath(TicketStatus.FAILED, "X");
            Files.writeString(staleFailed, Jsons.toJson(ticket));
            Files.setLastModifiedTime(staleFailed, FileTime.fromMillis(System.currentTimeMillis() - 60_000L));

            ticket.resetToPending();
            Path freshPending = store.ticketPath(TicketStatus.PENDING, "X");
            Files.writeString(freshPending, Jsons.toJson(ticket));

            TicketStore fresh = newStore(root);
            Assertions.assertEquals(0, fresh.countByStatus(TicketStatus.FAILED));
            Assertions.assertEquals(List.of(), fresh.loadByStatus(TicketStatus.FAILED));
            Assertions.assertEquals(0, fresh.moveFailed());
            Assertions.assertEquals(List.of("X"), fresh.loadByStatus(TicketStatus.PENDING).stream().map(Ticket::id).toList());
            Assertions.assertFalse(Files.exists(staleFailed));
            Assertions.assertTrue(Files.exists(freshPending));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cachedLoadFollowsAMoveMadeByAnotherStoreInstance() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-two-instances-");
        try {
            TicketStore first = newStore(root);
            first.save(Ticket.create("T-1", "Shared", ""));
            Assertions.assertEquals(TicketStatus.PENDING, first.load("T-1").status());

            TicketStore second = newStore(root);
            Ticket moved = second.load("T-1");
            moved.markInProgress();
            second.save(moved);

            Ticket seen = first.load("T-1");
            Assertions.assertEquals(TicketStatus.IN_PROGRESS, seen.status());
            Assertions.assertEquals(first.ticketPath(TicketStatus.IN_PROGRESS, "T-1"), first.cachedPath("T-1").orElseThrow());
            assertSingleCopy(first, "T-1", TicketStatus.IN_PROGRESS);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void loadByStatusOrdersByPriorityAndSkipsCorruptFiles() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-order-");
        try {
            TicketStore store = newStore(root);
            store.save(withPriority("T-c", 3));
            store.save(withPriority("T-a", 1));
            store.save(withPriority("T-b", 3));
            Files.writeString(store.ticketPath(TicketStatus.PENDING, "broken"), "{not json");

            List<Ticket> pending = store.loadByStatus(TicketStatus.PENDING);

            Assertions.assertEquals(List.of("T-a", "T-b", "T-c"), pending.stream().map(Ticket::id).toList());
            Assertions.assertEquals(List.of(), store.loadByStatus(TicketStatus.FAILED));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void moveFailedResetsEveryFailedTicket() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-retry-");
        try {
            TicketStore store = newStore(root);
            for (String id : List.of("T-1", "T-2")) {
                Ticket ticket = Ticket.create(id, "Fails", "");
                ticket.markInProgress();
                ticket.markFailed("nope", "/tmp/" + id + ".log");
                store.save(ticket);
            }
            store.save(Ticket.create("T-3", "Pending", ""));

            int moved = store.moveFailed();

            Assertions.assertEquals(2, moved);
            Map<TicketStatus, Integer> counts = store.count();
            Assertions.assertEquals(3, counts.get(TicketStatus.PENDING));
            Assertions.assertEquals(0, counts.get(TicketStatus.FAILED));
            Ticket retried = store.load("T-1");
            Assertions.assertEquals("", retried.error());
            Assertions.assertEquals("", retried.errorLog());
            Assertions.assertEquals(3, store.total());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void moveToStatusBypassesLifecycleAndCountsFollow() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-move-");
        try {
            TicketStore store = newStore(root);
            store.save(Ticket.create("T-1", "Stuck", ""));
            store.save(Ticket.create("T-2", "Waiting", ""));

            Ticket moved = store.moveToStatus("T-1", TicketStatus.COMPLETED);
            Assertions.assertEquals(TicketStatus.COMPLETED, moved.status());
            assertSingleCopy(store, "T-1", TicketStatus.COMPLETED);

            Map<TicketStatus, Integer> counts = store.count();
            Assertions.assertEquals(1, counts.get(TicketStatus.PENDING));
            Assertions.assertEquals(1, counts.get(TicketStatus.COMPLETED));
            Assertions.assertEquals(0, counts.get(TicketStatus.FAILED));
            Assertions.assertThrows(TicketNotFoundException.class,
                    () -> store.moveToStatus("T-9", TicketStatus.PENDING));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deleteRemovesTicketAndReportsMissing() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-delete-");
        try {
            TicketStore store = newStore(root);
            store.save(Ticket.create("T-1", "Gone soon", ""));

            store.delete("T-1");

            Assertions.assertTrue(store.find("T-1").isEmpty());
            Assertions.assertThrows(TicketNotFoundException.class, () -> store.delete("T-1"));
            Assertions.assertThrows(TicketNotFoundException.class, () -> store.load("T-1"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidTicketIsNeverWritten() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-invalid-");
        try {
            TicketStore store = newStore(root);
            Assertions.assertThrows(TicketValidationException.class, () -> store.save(Ticket.create("T-1", "", "")));
            Assertions.assertThrows(TicketValidationException.class, () -> store.save(Ticket.create("../x", "t", "")));
            Assertions.assertEquals(0, store.total());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void generatedTicketListRoundTripsAndCleanRemovesEverything() throws Exception {
        Path root = Files.createTempDirectory("ticketflow-store-generated-");
        try {
            TicketStore store = newStore(root);
            Path listFile = root.resolve("plan").resolve("tickets.json");
            store.saveGeneratedTickets(listFile, List.of(Ticket.create("T-1", "a", ""), Ticket.create("T-2", "b", "")));

            List<Ticket> loaded = store.loadGeneratedTickets(listFile);
            Assertions.assertEquals(List.of("T-1", "T-2"), loaded.stream().map(Ticket::id).toList());

            store.save(loaded.get(0));
            store.clean();
            Assertions.assertFalse(Files.exists(store.baseDir()));
            Assertions.assertEquals(0, store.total());
        } finally {
            deleteRecursively(root);
        }
    }

    private static TicketStore newStore(Path root) {
        TicketStore store = new TicketStore(TicketFlowConfig.fromRoot(root.toString()));
        store.init();
        return store;
    }

    private static Ticket withPriority(String id, int priority) {
        Ticket ticket = Ticket.create(id, "Ticket " + id, "");
        ticket.setPriority(priority);
        return ticket;
    }

    private static void assertSingleCopy(TicketStore store, String id, TicketStatus expected) {
        for (TicketStatus status : TicketStatus.values()) {
            Assertions.assertEquals(status == expected, Files.exists(store.ticketPath(status, id)),
                    "copy of " + id + " in " + status);
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
