package com.github.ytdle.service.engine;

import com.github.ytdle.model.HistoryRecord;
import com.github.ytdle.model.HistoryStats;
import com.github.ytdle.model.JobStatus;
import com.github.ytdle.service.history.HistoryStore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

class InMemoryHistoryStore implements HistoryStore {

    private final List<HistoryRecord> records = new ArrayList<>();

    @Override
    public void open() {
    }

    @Override
    public synchronized void record(HistoryRecord record) {
        records.add(record);
    }

    @Override
    public synchronized List<HistoryRecord> findAll(int limit) {
        return new ArrayList<>(records);
    }

    @Override
    public synchronized List<HistoryRecord> findFailed(int limit) {
        return records.stream()
                .filter(record -> record.getStatus() == JobStatus.FAILED)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized HistoryStats stats() {
        return HistoryStats.builder().total(records.size()).build();
    }

    @Override
    public String renderFailedExport() {
        return "";
    }

    @Override
    public int exportFailed(Path target) {
        return 0;
    }

    @Override
    public synchronized int clear() {
        int removed = records.size();
        records.clear();
        return removed;
    }

    @Override
    public void close() {
    }

    synchronized List<HistoryRecord> recordsFor(String jobId) {
        return records.stream()
                .filter(record -> record.getId().equals(jobId))
                .collect(Collectors.toList());
    }
}
