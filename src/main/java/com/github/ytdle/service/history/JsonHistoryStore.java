package com.github.ytdle.service.history;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.ytdle.exception.HistoryStoreException;
import com.github.ytdle.model.HistoryRecord;
import com.github.ytdle.model.HistoryStats;
import com.github.ytdle.model.JobStatus;
import com.github.ytdle.model.MediaFormat;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * History store kept in a single JSON document, rewritten atomically on every record.
 * <p>
 * On first open a legacy history file (a bare list of records, or an object holding a "records" list) is
 * migrated and renamed to {@code *.backup}.
 */
@Slf4j
public class JsonHistoryStore implements HistoryStore {

    static final int FORMAT_VERSION = 2;

    private final Path storePath;
    private final Path legacyPath;
    private final ObjectMapper objectMapper;

    private final List<HistoryRecord> records = new ArrayList<>();
    private boolean open = false;

    public JsonHistoryStore(@NonNull Path storePath, Path legacyPath, @NonNull ObjectMapper objectMapper) {
        this.storePath = storePath;
        this.legacyPath = legacyPath;
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized void open() {
        if (open) {
            return;
        }
        records.clear();
        if (Files.exists(storePath)) {
            records.addAll(load());
            log.info("History store opened at {} with {} record(s)", storePath, records.size());
        } else if (legacyPath != null && Files.exists(legacyPath)) {
            int migrated = migrate(legacyPath);
            log.info("History store created at {}, migrated {} legacy record(s)", storePath, migrated);
        } else {
            log.info("History store created at {}", storePath);
        }
        open = true;
    }

    @Override
    public synchronized void record(@NonNull HistoryRecord record) {
        ensureOpen();
        records.add(record);
        save();
        log.debug("Recorded {} for job {} ({})", record.getStatus(), record.getId(), record.getUrl());
    }

    @Override
    public synchronized List<HistoryRecord> findAll(int limit) {
        ensureOpen();
        return query(record -> true, limit);
    }

    @Override
    public synchronized List<HistoryRecord> findFailed(int limit) {
        ensureOpen();
        return query(record -> record.getStatus() == JobStatus.FAILED, limit);
    }

    @Override
    public synchronized HistoryStats stats() {
        ensureOpen();
        return HistoryStats.builder()
                .total(records.size())
                .completed(count(JobStatus.COMPLETED))
                .failed(count(JobStatus.FAILED))
                .cancelled(count(JobStatus.CANCELLED))
                .skipped(count(JobStatus.SKIPPED))
                .build();
    }

    @Override
    public synchronized String renderFailedExport() {
        StringBuilder text = new StringBuilder();
        for (HistoryRecord record : findFailed(0)) {
            String cause = record.getErrorMessage() != null ? record.getErrorMessage()
                    : record.getErrorType() != null ? record.getErrorType().name() : "";
            text.append("# Failed: ").append(cause).append('\n');
            text.append("# Retry count: ").append(Math.max(0, record.getAttempts() - 1)).append('\n');
            text.append("# Date: ").append(record.getFinishedAt() != null ? record.getFinishedAt() : "").append('\n');
            text.append(record.getUrl()).append("\n\n");
        }
        return text.toString();
    }

    @Override
    public synchronized int exportFailed(@NonNull Path target) {
        int count = findFailed(0).size();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, renderFailedExport(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to export failed URLs to " + target, e, target);
        }
        log.info("Exported {} failed URL(s) to {}", count, target);
        return count;
    }

    @Override
    public synchronized int clear() {
        ensureOpen();
        int removed = records.size();
        records.clear();
        save();
        return removed;
    }

    @Override
    public synchronized void close() {
        if (!open) {
            return;
        }
        open = false;
        records.clear();
        log.debug("History store {} closed", storePath);
    }

    public synchronized boolean isOpen() {
        return open;
    }

    /**
     * Import a legacy history file into this store and rename the legacy file to {@code *.backup}.
     *
     * @return number of records migrated
     */
    synchronized int migrate(Path legacyFile) {
        JsonNode root;
        try {
            root = objectMapper.readTree(legacyFile.toFile());
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to read legacy history " + legacyFile, e, legacyFile);
        }

        JsonNode items = root != null && root.isObject() ? root.get("records") : root;
        int migrated = 0;
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                records.add(fromLegacy(item));
                migrated++;
            }
        } else {
            log.warn("Legacy history {} has no records, nothing to migrate", legacyFile);
        }
        save();

        Path backup = legacyFile.resolveSibling(legacyFile.getFileName() + ".backup");
        try {
            Files.move(legacyFile, backup, StandardCopyOption.REPLACE_EXISTING);
            log.info("Backed up legacy history to {}", backup);
        } catch (IOException e) {
            log.warn("Could not rename legacy history {}: {}", legacyFile, e.getMessage());
        }
        return migrated;
    }

    private HistoryRecord fromLegacy(JsonNode item) {
        boolean success = item.path("success").asBoolean(false);
        String format = item.path("format").asText("mp4");
        String outputPath = item.path("output_path").asText("");
        String errorMessage = item.path("error_message").asText("");
        LocalDateTime timestamp = parseTimestamp(item.path("timestamp").asText(null));

        return HistoryRecord.builder()
                .id(UUID.randomUUID().toString())
                .url(item.path("url").asText(""))
                .format("mp3".equalsIgnoreCase(format) || "audio".equalsIgnoreCase(format)
                        ? MediaFormat.AUDIO : MediaFormat.VIDEO)
                .quality(item.path("quality").asText("best"))
                .status(success ? JobStatus.COMPLETED : JobStatus.FAILED)
                .outputPath(outputPath.isBlank() ? null : outputPath)
                .errorMessage(errorMessage.isBlank() ? null : errorMessage)
                .attempts(item.path("retry_count").asInt(0) + 1)
                .finishedAt(timestamp)
                .build();
    }

    private LocalDateTime parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable legacy timestamp '{}'", value);
            return null;
        }
    }

    private List<HistoryRecord> load() {
        try {
            StoreDocument document = objectMapper.readValue(storePath.toFile(), StoreDocument.class);
            return document.getRecords() != null ? document.getRecords() : new ArrayList<>();
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to read history store " + storePath, e, storePath);
        }
    }

    private void save() {
        try {
            Path parent = storePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = storePath.resolveSibling(storePath.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), new StoreDocument(FORMAT_VERSION, records));
            Files.move(temp, storePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new HistoryStoreException("Failed to write history store " + storePath, e, storePath);
        }
    }

    private List<HistoryRecord> query(Predicate<HistoryRecord> filter, int limit) {
        Stream<HistoryRecord> matching = records.stream()
                .filter(filter)
                .sorted(Comparator.comparing(HistoryRecord::getFinishedAt,
                        Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())));
        if (limit > 0) {
            matching = matching.limit(limit);
        }
        return matching.collect(Collectors.toList());
    }

    private long count(JobStatus status) {
        return records.stream().filter(record -> record.getStatus() == status).count();
    }

    private void ensureOpen() {
        if (!open) {
            throw new HistoryStoreException("History store is not open", storePath);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    static class StoreDocument {
        private int version;
        private List<HistoryRecord> records;
    }
}
