package org.contagio.experiment.checkpoint;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.contagio.experiment.ExperimentRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonParseException;

/**
 * Checkpoint store backed by a JSON Lines file: one {@link ExperimentRecord} per line.
 * <p>
 * Appends are flushed before {@link #append(List)} returns, so a process
 * killed between two batches loses nothing, and a process killed during a write leaves at most
 * one incomplete trailing line. How such a line (or any other unreadable line) is handled on the
 * next {@link #load()} is decided by the {@link CorruptCheckpointPolicy}.
 * <p>
 * Not thread-safe. The experiment runner calls it from its coordinating thread only.
 */
public class JsonLinesCheckpointStore implements ICheckpointStore {
    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesCheckpointStore.class);

    private final Path file;
    private final CorruptCheckpointPolicy policy;
    private final Set<ExperimentRecord.Key> writtenKeys = new HashSet<>();
    private BufferedWriter writer;
    private boolean closed;

    /**
     * @param file the checkpoint file; created on the first append if absent.
     * @param policy what to do with unreadable lines.
     */
    public JsonLinesCheckpointStore(Path file, CorruptCheckpointPolicy policy) {
        this.file = file;
        this.policy = policy;
    }

    public JsonLinesCheckpointStore(Path file) {
        this(file, CorruptCheckpointPolicy.ABORT);
    }

    public Path getFile() {
        return file;
    }

    @Override
    public List<ExperimentRecord> load() {
        ensureOpen();
        writtenKeys.clear();
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CheckpointException("Failed to read checkpoint " + file + ": " + e.getMessage(), e);
        }

        List<ExperimentRecord> records = new ArrayList<>();
        List<String> validLines = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            ExperimentRecord record;
            try {
                record = ExperimentRecordCodec.decode(line);
            } catch (JsonParseException e) {
                return handleCorruption(i + 1, e, records, validLines);
            }
            if (writtenKeys.add(record.key())) {
                records.add(record);
                validLines.add(line);
            }
        }
        LOG.debug("Loaded {} records from checkpoint {}", records.size(), file);
        return records;
    }

    @Override
    public void append(List<ExperimentRecord> records) {
        ensureOpen();
        if (records.isEmpty()) {
            return;
        }
        try {
            if (writer == null) {
                writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
            int written = 0;
            for (ExperimentRecord record : records) {
                if (writtenKeys.add(record.key())) {
                    writer.write(ExperimentRecordCodec.encode(record));
                    writer.newLine();
                    written++;
                }
            }
            writer.flush();
            LOG.debug("Appended {} records to checkpoint {}", written, file);
        } catch (IOException e) {
            throw new CheckpointException("Failed to append to checkpoint " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                throw new CheckpointException("Failed to close checkpoint " + file + ": " + e.getMessage(), e);
            }
        }
    }

    private List<ExperimentRecord> handleCorruption(int lineNumber, JsonParseException cause,
                                                    List<ExperimentRecord> validRecords, List<String> validLines) {
        switch (policy) {
            case RECOVER -> {
                LOG.warn("Checkpoint {} is corrupt at line {} ({}); keeping {} records written before it",
                        file, lineNumber, cause.getMessage(), validRecords.size());
                rewrite(validLines);
                return validRecords;
            }
            case START_FRESH -> {
                LOG.warn("Checkpoint {} is corrupt at line {} ({}); discarding it and starting fresh",
                        file, lineNumber, cause.getMessage());
                writtenKeys.clear();
                rewrite(List.of());
                return List.of();
            }
            default -> throw new CheckpointException("Checkpoint " + file + " is corrupt at line " + lineNumber
                    + ": " + cause.getMessage(), cause);
        }
    }

    /**
     * Replaces the file with the given lines via a temporary sibling and an atomic move.
     */
    private void rewrite(List<String> lines) {
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.write(temp, lines, StandardCharsets.UTF_8);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to rewrite checkpoint " + file + ": " + e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Checkpoint store " + file + " is closed");
        }
    }
}
