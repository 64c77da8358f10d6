package io.ticketflow.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.ticketflow.error.StoreIOException;
import io.ticketflow.util.Hashing;
import io.ticketflow.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL record of work-loop events. Each row carries the hash of the previous row
 * so that {@link #verify()} can detect edits or truncation in the middle of the file.
 */
public final class RunJournal {
    private final Path journalFile;
    private final String runId;
    private String previousHash;

    public RunJournal(Path journalFile, String runId) {
        this.journalFile = journalFile;
        this.runId = runId == null || runId.isBlank() ? "run" : runId.trim();
        try {
            Files.createDirectories(journalFile.getParent());
            Files.write(journalFile, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StoreIOException("failed to initialize run journal " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void record(JournalEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("run_id", runId);
        row.put("action", event.action());
        row.put("ticket_id", event.ticketId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new StoreIOException("failed to write run journal", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path journalFile() {
        return journalFile;
    }

    public String runId() {
        return runId;
    }

    public synchronized List<JsonNode> tail(int limit) {
        try {
            List<String> lines = Files.readAllLines(journalFile, StandardCharsets.UTF_8).stream()
                    .filter(line -> !line.isBlank())
                    .toList();
            int from = Math.max(0, lines.size() - Math.max(1, limit));
            ArrayList<JsonNode> out = new ArrayList<>();
            for (String line : lines.subList(from, lines.size())) {
                out.add(Jsons.mapper().readTree(line));
            }
            return out;
        } catch (IOException e) {
            throw new StoreIOException("failed to read run journal", e);
        }
    }

    /**
     * Recomputes every row hash and checks the {@code prev_hash} links.
     */
    @SuppressWarnings("unchecked")
    public synchronized VerifyOutcome verify() {
        int rows = 0;
        String expectedPrev = "";
        try {
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                rows++;
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                Object prev = row.get("prev_hash");
                if (!expectedPrev.equals(prev)) {
                    return new VerifyOutcome(false, rows, rows, "prev_hash mismatch");
                }
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!recomputed.equals(hash)) {
                    return new VerifyOutcome(false, rows, rows, "hash mismatch");
                }
                expectedPrev = recomputed;
            }
        } catch (IOException e) {
            throw new StoreIOException("failed to verify run journal", e);
        }
        return new VerifyOutcome(true, rows, -1, "ok");
    }

    private String loadLastHash() {
        try {
            if (!Files.exists(journalFile)) {
                return "";
            }
            String last = "";
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            throw new StoreIOException("failed to read run journal tail " + journalFile, e);
        }
    }

    public record JournalEvent(String action, String ticketId, String result, Map<String, Object> details) {
        public static JournalEvent of(String action, String ticketId, String result, Map<String, Object> details) {
            return new JournalEvent(action, ticketId, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean valid, int rows, int firstBadRow, String message) {
    }
}
