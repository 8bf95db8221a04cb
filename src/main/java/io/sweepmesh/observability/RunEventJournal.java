package io.sweepmesh.observability;

import io.sweepmesh.engine.RunEvent;
import io.sweepmesh.engine.RunUpdateListener;
import io.sweepmesh.security.SensitiveDataMasker;
import io.sweepmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL journal of one run's events, with sensitive fields masked.
 */
public final class RunEventJournal implements RunUpdateListener {
    private final Path journalFile;
    private long sequence;

    public RunEventJournal(Path journalFile) {
        this.journalFile = journalFile;
        try {
            Files.createDirectories(journalFile.getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize run event journal: " + journalFile, e);
        }
        this.sequence = countLines();
    }

    @Override
    public void onUpdate(long runId, RunEvent event) {
        record(event);
    }

    public synchronized void record(RunEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("seq", sequence + 1);
        row.put("timestamp", Instant.ofEpochMilli(event.timestampMs()).toString());
        row.put("run_id", event.runId());
        row.put("type", event.type().wireName());
        row.put("data", SensitiveDataMasker.masked(event.data()));
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            sequence++;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write run event journal: " + journalFile, e);
        }
    }

    public synchronized List<Map<String, Object>> readAll() {
        List<Map<String, Object>> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(Jsons.toMap(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read run event journal: " + journalFile, e);
        }
    }

    public Path journalFile() {
        return journalFile;
    }

    private long countLines() {
        try (var lines = Files.lines(journalFile, StandardCharsets.UTF_8)) {
            return lines.filter(line -> !line.isBlank()).count();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read run event journal: " + journalFile, e);
        }
    }
}
