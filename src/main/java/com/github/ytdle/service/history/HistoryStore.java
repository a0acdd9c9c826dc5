package com.github.ytdle.service.history;

import com.github.ytdle.model.HistoryRecord;
import com.github.ytdle.model.HistoryStats;

import java.nio.file.Path;
import java.util.List;

/**
 * Persistent record of finished jobs.
 * <p>
 * The store has an explicit lifecycle: {@link #open()} loads it (migrating a legacy file when one is found) and
 * {@link #close()} releases it. The engine only ever writes to it.
 */
public interface HistoryStore extends AutoCloseable {

    void open();

    /**
     * Persist the finalize record of one job.
     */
    void record(HistoryRecord record);

    /**
     * Records newest first.
     *
     * @param limit maximum number of records, 0 for all
     */
    List<HistoryRecord> findAll(int limit);

    /**
     * Records of jobs that ended in failure, newest first.
     *
     * @param limit maximum number of records, 0 for all
     */
    List<HistoryRecord> findFailed(int limit);

    HistoryStats stats();

    /**
     * Failed URLs as commented text, one block per record, ready to be fed back as input.
     */
    String renderFailedExport();

    /**
     * Write {@link #renderFailedExport()} to a file.
     *
     * @return number of records exported
     */
    int exportFailed(Path target);

    /**
     * Remove every record.
     *
     * @return number of records removed
     */
    int clear();

    @Override
    void close();
}
