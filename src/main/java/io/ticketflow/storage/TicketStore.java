package io.ticketflow.storage;

import io.ticketflow.config.TicketFlowConfig;
import io.ticketflow.error.StoreIOException;
import io.ticketflow.error.TicketNotFoundException;
import io.ticketflow.error.TicketValidationException;
import io.ticketflow.model.Ticket;
import io.ticketflow.model.TicketList;
import io.ticketflow.model.TicketStatus;
import io.ticketflow.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Stream;

/**
 * File-backed ticket store. Each ticket lives at {@code <ticketsDir>/<status>/<id>.json}.
 *
 * <p>The id-to-path cache is a derived index: a miss or a stale entry always falls back to a
 * scan of every status directory, and the scan result repairs the cache. The lock only guards
 * the cache map; file operations are not serialized, so a single process is expected to be
 * the writer for a given tickets directory.
 */
public final class TicketStore {
    private static final Logger log = LoggerFactory.getLogger(TicketStore.class);
    private static final String SUFFIX = ".json";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final boolean POSIX = FileSystems.getDefault().supportedFileAttributeViews().contains("posix");

    private final TicketFlowConfig config;
    private final Map<String, Path> pathCache = new HashMap<>();
    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();

    public TicketStore(TicketFlowConfig config) {
        this.config = config;
    }

    public Path baseDir() {
        return config.ticketsDir();
    }

    public void init() {
        for (TicketStatus status : TicketStatus.values()) {
            createPrivateDirectories(statusDir(status));
        }
    }

    public void save(Ticket ticket) {
        ticket.validate();
        checkFileSafeId(ticket.id());

        Path target = ticketPath(ticket.status(), ticket.id());
        createPrivateDirectories(target.getParent());
        writeAtomically(target, Jsons.toJson(ticket));

        // The new copy is durable; only now drop older locations.
        Optional<Path> cached = cachedPath(ticket.id());
        if (cached.isPresent() && !cached.get().equals(target)) {
            deleteIfExists(cached.get());
        }
        for (TicketStatus status : TicketStatus.values()) {
            if (status != ticket.status()) {
                deleteIfExists(ticketPath(status, ticket.id()));
            }
        }
        putCache(ticket.id(), target);
    }

    public Ticket load(String id) {
        Optional<Path> cached = cachedPath(id);
        if (cached.isPresent()) {
            if (Files.exists(cached.get())) {
                return read(cached.get());
            }
            log.debug("stale cache entry for ticket {} at {}", id, cached.get());
            evictCache(id);
        }
        Path found = locate(id).orElseThrow(() -> new TicketNotFoundException(id));
        Ticket ticket = read(found);
        putCache(id, found);
        return ticket;
    }

    public Optional<Ticket> find(String id) {
        try {
            return Optional.of(load(id));
        } catch (TicketNotFoundException e) {
            return Optional.empty();
        }
    }

    public boolean exists(String id) {
        return locate(id).isPresent();
    }

    /**
     * Tickets in one status directory ordered by priority (lower first), ties by file name.
     * A missing directory yields an empty list; unreadable records are skipped.
     */
    public List<Ticket> loadByStatus(TicketStatus status) {
        List<Path> files = listCurrentTicketFiles(status);
        List<Ticket> tickets = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                tickets.add(Jsons.mapper().readValue(file.toFile(), Ticket.class));
            } catch (IOException e) {
                log.warn("skipping unreadable ticket file {}: {}", file, e.getMessage());
            }
        }
        tickets.sort(Comparator.comparingInt(Ticket::priority));
        return tickets;
    }

    public TicketList loadAll() {
        List<Ticket> all = new ArrayList<>();
        for (TicketStatus status : TicketStatus.values()) {
            all.addAll(loadByStatus(status));
        }
        return new TicketList(all);
    }

    public void delete(String id) {
        boolean removed = false;
        Optional<Path> cached = cachedPath(id);
        if (cached.isPresent()) {
            removed = deleteIfExists(cached.get());
        }
        for (TicketStatus status : TicketStatus.values()) {
            removed |= deleteIfExists(ticketPath(status, id));
        }
        evictCache(id);
        if (!removed) {
            throw new TicketNotFoundException(id);
        }
    }

    public int countByStatus(TicketStatus status) {
        return listCurrentTicketFiles(status).size();
    }

    public Map<TicketStatus, Integer> count() {
        Map<TicketStatus, Integer> counts = new EnumMap<>(TicketStatus.class);
        for (TicketStatus status : TicketStatus.values()) {
            counts.put(status, countByStatus(status));
        }
        return counts;
    }

    public int total() {
        int total = 0;
        for (int n : count().values()) {
            total += n;
        }
        return total;
    }

    /**
     * Administrative move that bypasses the lifecycle checks.
     */
    public Ticket moveToStatus(String id, TicketStatus status) {
        Ticket ticket = load(id);
        ticket.forceStatus(status);
        save(ticket);
        return ticket;
    }

    /**
     * Every failed ticket goes back to pending with its error details cleared.
     *
     * @return number of tickets moved
     */
    public int moveFailed() {
        int moved = 0;
        for (Ticket ticket : loadByStatus(TicketStatus.FAILED)) {
            ticket.resetToPending();
            save(ticket);
            moved++;
        }
        return moved;
    }

    public void clean() {
        Path root = config.ticketsDir();
        cacheLock.writeLock().lock();
        try {
            pathCache.clear();
        } finally {
            cacheLock.writeLock().unlock();
        }
        if (!Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new StoreIOException("failed to clean " + root, e);
        }
    }

    public void saveGeneratedTickets(Path path, List<Ticket> tickets) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            createPrivateDirectories(parent);
        }
        writeAtomically(path.toAbsolutePath(), Jsons.toJson(new TicketList(tickets)));
    }

    public List<Ticket> loadGeneratedTickets(Path path) {
        try {
            return Jsons.mapper().readValue(path.toFile(), TicketList.class).tickets();
        } catch (IOException e) {
            throw new StoreIOException("failed to read ticket list " + path, e);
        }
    }

    Path statusDir(TicketStatus status) {
        return config.statusDir(status.dirName());
    }

    Path ticketPath(TicketStatus status, String id) {
        return statusDir(status).resolve(id + SUFFIX);
    }

    Optional<Path> cachedPath(String id) {
        cacheLock.readLock().lock();
        try {
            return Optional.ofNullable(pathCache.get(id));
        } finally {
            cacheLock.readLock().unlock();
        }
    }

    /**
     * Scans every status directory. When a crash left more than one copy behind, the most
     * recently written copy wins and the others are removed.
     */
    private Optional<Path> locate(String id) {
        List<Path> copies = new ArrayList<>();
        for (TicketStatus status : TicketStatus.values()) {
            Path candidate = ticketPath(status, id);
            if (Files.exists(candidate)) {
                copies.add(candidate);
            }
        }
        if (copies.isEmpty()) {
            return Optional.empty();
        }
        if (copies.size() == 1) {
            return Optional.of(copies.get(0));
        }
        copies.sort(Comparator.comparing(TicketStore::modifiedTime).reversed());
        Path newest = copies.get(0);
        for (Path stale : copies.subList(1, copies.size())) {
            log.warn("removing duplicate record for ticket {} at {}", id, stale);
            deleteIfExists(stale);
        }
        return Optional.of(newest);
    }

    private Ticket read(Path path) {
        try {
            return Jsons.mapper().readValue(Files.readString(path, StandardCharsets.UTF_8), Ticket.class);
        } catch (IOException e) {
            throw new StoreIOException("failed to read ticket file " + path, e);
        }
    }

    /**
     * Files in one status directory minus copies superseded by a newer record of the same
     * ticket elsewhere. Superseded copies are removed on the way.
     */
    private List<Path> listCurrentTicketFiles(TicketStatus status) {
        List<Path> current = new ArrayList<>();
        for (Path file : listTicketFiles(statusDir(status))) {
            if (!isSuperseded(status, file)) {
                current.add(file);
            }
        }
        return current;
    }

    private boolean isSuperseded(TicketStatus status, Path file) {
        String name = file.getFileName().toString();
        String id = name.substring(0, name.length() - SUFFIX.length());
        FileTime mine = modifiedTime(file);
        for (TicketStatus other : TicketStatus.values()) {
            if (other == status) {
                continue;
            }
            Path candidate = ticketPath(other, id);
            if (Files.exists(candidate) && modifiedTime(candidate).compareTo(mine) > 0) {
                log.warn("removing duplicate record for ticket {} at {}", id, file);
                deleteIfExists(file);
                if (cachedPath(id).filter(file::equals).isPresent()) {
                    evictCache(id);
                }
                return true;
            }
        }
        return false;
    }

    private List<Path> listTicketFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (NoSuchFileException e) {
            return files;
        } catch (IOException e) {
            throw new StoreIOException("failed to read directory " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private void writeAtomically(Path target, String content) {
        Path temp = target.resolveSibling("." + target.getFileName() + TEMP_SUFFIX);
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException atomicFailure) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StoreIOException("failed to write ticket file " + target, e);
        }
    }

    private boolean deleteIfExists(Path path) {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new StoreIOException("failed to remove old ticket file " + path, e);
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("could not remove temp file {}: {}", path, e.getMessage());
        }
    }

    private void createPrivateDirectories(Path dir) {
        try {
            if (Files.isDirectory(dir)) {
                return;
            }
            if (POSIX) {
                Files.createDirectories(dir, PosixFilePermissions.asFileAttribute(
                        PosixFilePermissions.fromString("rwx------")));
            } else {
                Files.createDirectories(dir);
            }
        } catch (IOException e) {
            throw new StoreIOException("failed to create directory " + dir, e);
        }
    }

    private void putCache(String id, Path path) {
        cacheLock.writeLock().lock();
        try {
            pathCache.put(id, path);
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    private void evictCache(String id) {
        cacheLock.writeLock().lock();
        try {
            pathCache.remove(id);
        } finally {
            cacheLock.writeLock().unlock();
        }
    }

    private static FileTime modifiedTime(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            return FileTime.fromMillis(0L);
        }
    }

    private static void checkFileSafeId(String id) {
        if (id.contains("/") || id.contains("\\") || id.equals(".") || id.equals("..")) {
            throw new TicketValidationException("ticket ID is not a valid file name: " + id);
        }
    }
}
